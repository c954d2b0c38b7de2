package com.flamingo.ai.md2db.service.ingest;

import com.flamingo.ai.md2db.domain.enums.EntityKind;
import com.flamingo.ai.md2db.domain.enums.RunStatus;
import com.flamingo.ai.md2db.exception.IngestionException;
import com.flamingo.ai.md2db.mongodb.QuestionBankStore;
import com.flamingo.ai.md2db.service.chunking.ByteRange;
import com.flamingo.ai.md2db.service.chunking.ChunkPlan;
import com.flamingo.ai.md2db.service.chunking.ChunkReader;
import com.flamingo.ai.md2db.service.chunking.ChunkReaderFactory;
import com.flamingo.ai.md2db.service.chunking.FileChunker;
import com.flamingo.ai.md2db.service.dedup.ContentKey;
import com.flamingo.ai.md2db.service.dedup.Deduplicator;
import com.flamingo.ai.md2db.service.parsing.ChunkParseResult;
import com.flamingo.ai.md2db.service.parsing.ChunkParsingTask;
import com.flamingo.ai.md2db.service.parsing.QuestionParser;
import com.flamingo.ai.md2db.service.parsing.RawQuestion;
import com.flamingo.ai.md2db.service.progress.ChunkProgress;
import com.flamingo.ai.md2db.service.progress.ProgressStore;
import com.flamingo.ai.md2db.service.progress.ProgressTracker;
import com.flamingo.ai.md2db.service.writer.BatchWriter;
import com.flamingo.ai.md2db.service.writer.FinalizedQuestion;
import com.flamingo.ai.md2db.service.writer.WriteFailure;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs the ingestion pipeline for one source file: plan chunks, parse them on a worker pool,
 * resolve sub-entities to canonical ids, and bulk-write the questions.
 *
 * <p>At most {@code workerCount + queueDepth} chunks are dispatched at a time. The coordinator
 * thread drains finished chunks in completion order, so the pool never holds more parsed results
 * than that. A failed attempt is put back at the head of the queue until the retry limit is spent;
 * after that the chunk is recorded as failed and the run carries on.
 *
 * <p>A chunk is marked done only once every one of its questions has been answered for by the
 * store. A chunk whose batch write failed as a whole is reported as failed and left for the next
 * run. Question ids are derived from the source, chunk start and position, so re-submitting a
 * chunk after a crash shows up as duplicates instead of extra rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionCoordinator {

  private static final int SOURCE_KEY_HEX_CHARS = 16;

  private final FileChunker fileChunker;
  private final QuestionParser questionParser;
  private final Deduplicator deduplicator;
  private final QuestionBankStore store;
  private final ProgressStore progressStore;
  private final ChunkReaderFactory chunkReaderFactory;
  private final MeterRegistry meterRegistry;

  @Timed(value = "ingestion.process", description = "Time to ingest one source file")
  public ProcessingResult process(Path file, IngestionOptions options) {
    return process(file, options, CancellationToken.create());
  }

  /**
   * Ingests {@code file}.
   *
   * @param file the Markdown source
   * @param options run settings
   * @param cancellation checked between dispatches; chunks not yet dispatched stay pending
   * @return the run summary
   * @throws IngestionException if the file cannot be sized, planned or opened
   */
  @Timed(value = "ingestion.process", description = "Time to ingest one source file")
  public ProcessingResult process(
      Path file, IngestionOptions options, CancellationToken cancellation) {
    Instant started = Instant.now();

    ChunkPlan plan;
    String sourceKey;
    try {
      plan =
          fileChunker.createChunks(
              file, options.targetChunkSizeBytes(), options.maxBoundarySearchBytes());
      sourceKey = sourceKey(file);
    } catch (IOException e) {
      throw new IngestionException(file, "Failed to plan chunks: " + e.getMessage(), e);
    }

    ProgressTracker tracker = ProgressTracker.open(progressStore, sourceKey, plan.ranges());
    Deque<ByteRange> pending = new ArrayDeque<>();
    int skipped = 0;
    for (ByteRange range : plan.ranges()) {
      if (tracker.isDone(range.id())) {
        skipped++;
      } else {
        pending.add(range);
      }
    }
    log.info(
        "Ingesting {} as {}: {} chunks, {} to process, {} workers",
        file,
        sourceKey,
        plan.ranges().size(),
        pending.size(),
        options.workerCount());

    RunState state = new RunState(sourceKey, tracker);
    ChunkWriteLedger ledger = new ChunkWriteLedger(tracker);
    long written;
    long duplicates;
    List<WriteFailure> writeFailures;

    try (ChunkReader reader = chunkReaderFactory.open(file);
        BatchWriter writer =
            new BatchWriter(store, options.batchSize(), ledger, meterRegistry)) {
      if (!pending.isEmpty()) {
        dispatch(reader, writer, ledger, pending, options, cancellation, state);
      }
      writer.flush();
      written = writer.getWrittenCount();
      duplicates = writer.getDuplicateCount();
      writeFailures = writer.getFailures();
    } catch (IOException e) {
      throw new IngestionException(file, "Failed to read source: " + e.getMessage(), e);
    }

    if (state.interrupted) {
      Thread.currentThread().interrupt();
    }

    List<FailedChunk> unwritten = ledger.failedChunks();
    meterRegistry.counter("ingestion.chunks.failed").increment(unwritten.size());
    List<FailedChunk> failed = new ArrayList<>(state.failed);
    failed.addAll(unwritten);
    int processed = state.processed - unwritten.size();

    ProcessingResult result =
        new ProcessingResult(
            status(state.cancelled, processed, failed, writeFailures.size()),
            file.toString(),
            written,
            duplicates,
            plan.ranges().size(),
            processed,
            skipped,
            failed,
            writeFailures,
            plan.warnings(),
            options.workerCount(),
            Duration.between(started, Instant.now()));
    log.info(
        "Ingestion of {} finished {}: {} questions written, {} duplicates, {}/{} chunks processed,"
            + " {} skipped, {} failed, {} write failures in {} ms",
        file,
        result.status(),
        result.questionsWritten(),
        result.duplicatesSkipped(),
        result.chunksProcessed(),
        result.chunksPlanned(),
        result.chunksSkipped(),
        result.chunksFailed(),
        result.writeFailures().size(),
        result.elapsed().toMillis());
    return result;
  }

  private void dispatch(
      ChunkReader reader,
      BatchWriter writer,
      ChunkWriteLedger ledger,
      Deque<ByteRange> pending,
      IngestionOptions options,
      CancellationToken cancellation,
      RunState state) {
    int maxInFlight = options.workerCount() + options.queueDepth();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(options.workerCount());
    executor.setMaxPoolSize(options.workerCount());
    // Dispatch is bounded by maxInFlight; the queue only has to absorb that.
    executor.setQueueCapacity(maxInFlight);
    executor.setThreadNamePrefix("chunk-parse-");
    executor.initialize();

    CompletionService<ChunkParseResult> completion = new ExecutorCompletionService<>(executor);
    Map<Future<ChunkParseResult>, ByteRange> inFlight = new HashMap<>();
    try {
      while (true) {
        while (!pending.isEmpty() && inFlight.size() < maxInFlight) {
          if (cancellation.isCancellationRequested()) {
            state.cancelled = true;
            break;
          }
          ByteRange range = pending.pollFirst();
          int attempt = state.tracker.markInFlight(range.id());
          Future<ChunkParseResult> future =
              completion.submit(new ChunkParsingTask(reader, questionParser, range, attempt));
          inFlight.put(future, range);
        }
        if (inFlight.isEmpty()) {
          break;
        }

        Future<ChunkParseResult> done = completion.take();
        ByteRange range = inFlight.remove(done);
        ChunkParseResult result;
        try {
          result = done.get();
        } catch (ExecutionException e) {
          result = ChunkParseResult.failure(range, attemptOf(state, range), e.getCause());
        }
        handle(result, writer, ledger, pending, options, cancellation, state);
      }
    } catch (InterruptedException e) {
      log.warn("Ingestion of {} interrupted, stopping dispatch", state.sourceKey);
      state.interrupted = true;
      state.cancelled = true;
      for (ByteRange range : inFlight.values()) {
        state.tracker.markPending(range.id());
      }
    } finally {
      executor.shutdown();
    }
    if (state.cancelled) {
      log.info(
          "Ingestion of {} cancelled with {} chunks left pending", state.sourceKey, pending.size());
    }
  }

  private void handle(
      ChunkParseResult result,
      BatchWriter writer,
      ChunkWriteLedger ledger,
      Deque<ByteRange> pending,
      IngestionOptions options,
      CancellationToken cancellation,
      RunState state) {
    ByteRange range = result.range();
    Throwable failure = result.failure();
    List<FinalizedQuestion> finalized = null;
    if (result.succeeded()) {
      try {
        finalized = finalize(state.sourceKey, range, result.questions());
      } catch (RuntimeException e) {
        failure = e;
      }
    }

    if (failure == null) {
      for (FinalizedQuestion question : finalized) {
        ledger.questionAdded(range.id());
        writer.add(question);
      }
      ledger.seal(range, result.attempt());
      state.processed++;
      meterRegistry.counter("ingestion.chunks.processed").increment();
      return;
    }

    String reason = failure.getClass().getSimpleName() + ": " + failure.getMessage();
    if (cancellation.isCancellationRequested()) {
      state.tracker.markPending(range.id());
      log.info("Chunk {} failed after cancellation, left pending: {}", range.id(), reason);
    } else if (result.attempt() <= options.retryLimit()) {
      log.warn("Chunk {} attempt {} failed, retrying: {}", range.id(), result.attempt(), reason);
      state.tracker.markPending(range.id());
      pending.addFirst(range);
      meterRegistry.counter("ingestion.chunks.retried").increment();
    } else {
      log.error(
          "Chunk {} failed after {} attempts: {}", range.id(), result.attempt(), reason, failure);
      state.tracker.markFailed(range.id(), reason);
      state.failed.add(new FailedChunk(range, result.attempt(), reason));
      meterRegistry.counter("ingestion.chunks.failed").increment();
    }
  }

  private List<FinalizedQuestion> finalize(
      String sourceKey, ByteRange range, List<RawQuestion> questions) {
    List<FinalizedQuestion> finalized = new ArrayList<>(questions.size());
    for (int position = 0; position < questions.size(); position++) {
      RawQuestion raw = questions.get(position);
      finalized.add(
          new FinalizedQuestion(
              sourceKey + ":" + range.start() + ":" + position,
              range.id(),
              position,
              raw.content(),
              raw.questionType(),
              resolve(EntityKind.OPTION, raw.options()),
              raw.answer(),
              raw.explanation(),
              resolveImages(raw),
              resolve(EntityKind.FORMULA, raw.formulas()),
              ContentKey.of(raw.content())));
    }
    return finalized;
  }

  private List<String> resolve(EntityKind kind, List<String> payloads) {
    List<String> ids = new ArrayList<>(payloads.size());
    for (String payload : payloads) {
      ids.add(deduplicator.getOrCreate(kind, payload));
    }
    return ids;
  }

  private List<String> resolveImages(RawQuestion raw) {
    List<String> ids = new ArrayList<>(raw.imageUrls().size());
    for (String url : raw.imageUrls()) {
      ids.add(deduplicator.getOrCreate(EntityKind.IMAGE, url, raw.imageAlts().get(url)));
    }
    return ids;
  }

  private static int attemptOf(RunState state, ByteRange range) {
    return state.tracker.snapshot().stream()
        .filter(entry -> entry.chunkId().equals(range.id()))
        .findFirst()
        .map(ChunkProgress::attemptCount)
        .orElse(1);
  }

  /**
   * Identifies the source across runs: its absolute path, size and modification time. Another file
   * with the same name, or the same file edited in place, gets a fresh key, so its progress and
   * question ids never mix with the previous one's.
   */
  private static String sourceKey(Path file) throws IOException {
    Path absolute = file.toAbsolutePath().normalize();
    String identity =
        absolute
            + ":"
            + Files.size(absolute)
            + ":"
            + Files.getLastModifiedTime(absolute).toMillis();
    return ContentKey.shortKey(identity, SOURCE_KEY_HEX_CHARS);
  }

  private static RunStatus status(
      boolean cancelled, int processed, List<FailedChunk> failed, int writeFailures) {
    if (cancelled) {
      return RunStatus.CANCELLED;
    }
    if (!failed.isEmpty() && processed == 0) {
      return RunStatus.FAILED;
    }
    if (!failed.isEmpty() || writeFailures > 0) {
      return RunStatus.COMPLETED_WITH_ERRORS;
    }
    return RunStatus.COMPLETED;
  }

  /** Mutable bookkeeping for one run, touched only by the coordinator thread. */
  private static final class RunState {
    private final String sourceKey;
    private final ProgressTracker tracker;
    private final List<FailedChunk> failed = new ArrayList<>();
    private int processed;
    private boolean cancelled;
    private boolean interrupted;

    private RunState(String sourceKey, ProgressTracker tracker) {
      this.sourceKey = sourceKey;
      this.tracker = tracker;
    }
  }
}
