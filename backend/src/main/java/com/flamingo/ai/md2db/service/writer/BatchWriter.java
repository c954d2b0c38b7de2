package com.flamingo.ai.md2db.service.writer;

import com.flamingo.ai.md2db.domain.document.QuestionDocument;
import com.flamingo.ai.md2db.mongodb.BulkWriteReport;
import com.flamingo.ai.md2db.mongodb.QuestionBankStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Buffers finalized questions and writes them to the store in unordered bulk inserts.
 *
 * <p>Two buffers alternate. {@link #add} fills the active buffer; when it reaches the batch size
 * it is handed to a dedicated write thread and the other buffer becomes active. {@code add} only
 * waits when the active buffer fills up again before the previous write has finished, which bounds
 * memory at two batches.
 *
 * <p>Refused documents never raise: duplicates (same stable id already stored) are counted, other
 * refusals are recorded as {@link WriteFailure}s. A batch whose write throws is recorded as failed
 * in full, and its {@link BatchOutcome#batchFailed()} tells the listener so.
 *
 * <p>Not thread-safe: one caller adds and flushes. The {@link BatchListener} is called on the write
 * thread for automatic flushes and on the caller's thread for {@link #flush()}.
 */
@Slf4j
public class BatchWriter implements AutoCloseable {

  /** Receives every batch once the store has answered for it. */
  @FunctionalInterface
  public interface BatchListener {

    void onBatchWritten(List<FinalizedQuestion> batch, BatchOutcome outcome);
  }

  private final QuestionBankStore store;
  private final int batchSize;
  private final BatchListener listener;
  private final MeterRegistry meterRegistry;
  private final ThreadPoolTaskExecutor writeExecutor;

  private List<FinalizedQuestion> active;
  private List<FinalizedQuestion> standby;
  private CompletableFuture<Void> inFlight = CompletableFuture.completedFuture(null);
  private boolean closed;

  private final AtomicLong written = new AtomicLong();
  private final AtomicLong duplicates = new AtomicLong();
  private final List<WriteFailure> failures = Collections.synchronizedList(new ArrayList<>());

  public BatchWriter(
      QuestionBankStore store, int batchSize, BatchListener listener, MeterRegistry meterRegistry) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    this.store = store;
    this.batchSize = batchSize;
    this.listener = listener;
    this.meterRegistry = meterRegistry;
    this.active = new ArrayList<>(batchSize);
    this.standby = new ArrayList<>(batchSize);

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(1);
    executor.setThreadNamePrefix("batch-write-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    this.writeExecutor = executor;
  }

  /**
   * Buffers a question, handing the buffer to the write thread once it holds a full batch.
   *
   * @param question the question to write
   */
  public void add(FinalizedQuestion question) {
    if (closed) {
      throw new IllegalStateException("BatchWriter is closed");
    }
    active.add(question);
    if (active.size() >= batchSize) {
      handOff();
    }
  }

  /** Waits for any in-flight write, then writes whatever is buffered on the calling thread. */
  public void flush() {
    awaitInFlight();
    if (active.isEmpty()) {
      return;
    }
    List<FinalizedQuestion> batch = swapBuffers();
    writeBatch(batch);
  }

  public long getWrittenCount() {
    return written.get();
  }

  public long getDuplicateCount() {
    return duplicates.get();
  }

  public List<WriteFailure> getFailures() {
    synchronized (failures) {
      return List.copyOf(failures);
    }
  }

  /** Flushes, then stops the write thread. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    try {
      flush();
    } finally {
      closed = true;
      writeExecutor.shutdown();
    }
  }

  private void handOff() {
    // The standby buffer is free only once the previous write has finished with it.
    awaitInFlight();
    List<FinalizedQuestion> batch = swapBuffers();
    log.debug("Handing off batch of {} questions", batch.size());
    inFlight = writeExecutor.submitCompletable(() -> writeBatch(batch));
  }

  private List<FinalizedQuestion> swapBuffers() {
    List<FinalizedQuestion> full = active;
    active = standby;
    standby = full;
    return full;
  }

  private void awaitInFlight() {
    inFlight.join();
  }

  private void writeBatch(List<FinalizedQuestion> batch) {
    try {
      BatchOutcome outcome;
      try {
        Instant now = Instant.now();
        List<QuestionDocument> documents = new ArrayList<>(batch.size());
        for (FinalizedQuestion question : batch) {
          documents.add(question.toDocument(now));
        }
        outcome = toOutcome(batch, store.insertQuestions(documents));
      } catch (RuntimeException e) {
        log.error("Bulk write of {} questions failed: {}", batch.size(), e.getMessage(), e);
        List<WriteFailure> batchFailures = new ArrayList<>(batch.size());
        for (FinalizedQuestion question : batch) {
          batchFailures.add(failure(question, "Bulk write failed: " + e.getMessage()));
        }
        outcome =
            new BatchOutcome(
                0, 0, batchFailures, e.getClass().getSimpleName() + ": " + e.getMessage());
      }
      record(outcome);
      notifyListener(batch, outcome);
    } finally {
      batch.clear();
    }
  }

  private BatchOutcome toOutcome(List<FinalizedQuestion> batch, BulkWriteReport report) {
    Map<Integer, BulkWriteReport.Rejection> rejectedByIndex = new HashMap<>();
    for (BulkWriteReport.Rejection rejection : report.rejected()) {
      rejectedByIndex.put(rejection.index(), rejection);
    }

    int duplicateCount = 0;
    List<WriteFailure> batchFailures = new ArrayList<>();
    for (int i = 0; i < batch.size(); i++) {
      BulkWriteReport.Rejection rejection = rejectedByIndex.get(i);
      if (rejection == null) {
        continue;
      }
      FinalizedQuestion question = batch.get(i);
      if (rejection.duplicate()) {
        duplicateCount++;
        log.debug("Question {} already stored, skipping", question.id());
      } else {
        log.warn(
            "Store refused question {} (chunk {}, content {}): {}",
            question.id(),
            question.sourceChunk(),
            question.contentHash(),
            rejection.reason());
        batchFailures.add(failure(question, rejection.reason()));
      }
    }
    return new BatchOutcome(report.inserted(), duplicateCount, batchFailures, null);
  }

  private void record(BatchOutcome outcome) {
    written.addAndGet(outcome.written());
    duplicates.addAndGet(outcome.duplicates());
    failures.addAll(outcome.failures());
    meterRegistry.counter("ingestion.questions.written").increment(outcome.written());
    meterRegistry.counter("ingestion.questions.duplicate").increment(outcome.duplicates());
    meterRegistry.counter("ingestion.write.failures").increment(outcome.failures().size());
    log.debug(
        "Batch written: {} inserted, {} duplicates, {} refused",
        outcome.written(),
        outcome.duplicates(),
        outcome.failures().size());
  }

  private void notifyListener(List<FinalizedQuestion> batch, BatchOutcome outcome) {
    try {
      listener.onBatchWritten(List.copyOf(batch), outcome);
    } catch (RuntimeException e) {
      log.error("Batch listener failed after writing {} questions", batch.size(), e);
    }
  }

  private static WriteFailure failure(FinalizedQuestion question, String reason) {
    return new WriteFailure(
        question.id(), question.sourceChunk(), question.contentHash(), reason);
  }
}
