package com.flamingo.ai.md2db.service.ingest;

import com.flamingo.ai.md2db.service.chunking.ByteRange;
import com.flamingo.ai.md2db.service.progress.ProgressTracker;
import com.flamingo.ai.md2db.service.writer.BatchOutcome;
import com.flamingo.ai.md2db.service.writer.BatchWriter;
import com.flamingo.ai.md2db.service.writer.FinalizedQuestion;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides when a chunk is settled: all of its questions have been handed to the writer (the chunk
 * is sealed) and the store has answered for every one of them.
 *
 * <p>A settled chunk is done unless one of its batches failed as a whole. Such a chunk is marked
 * failed instead, so the next run writes it again. Documents the store refused one by one still
 * count as answered.
 */
@Slf4j
class ChunkWriteLedger implements BatchWriter.BatchListener {

  private final ProgressTracker tracker;
  private final Map<String, Integer> outstanding = new HashMap<>();
  private final Map<String, Sealed> sealed = new HashMap<>();
  private final Map<String, String> batchErrors = new HashMap<>();
  private final List<FailedChunk> failed = new ArrayList<>();

  ChunkWriteLedger(ProgressTracker tracker) {
    this.tracker = tracker;
  }

  /** Called before a question of {@code chunkId} is added to the writer. */
  synchronized void questionAdded(String chunkId) {
    outstanding.merge(chunkId, 1, Integer::sum);
  }

  /** Called once every question of a successful attempt has been added. */
  synchronized void seal(ByteRange range, int attempt) {
    sealed.put(range.id(), new Sealed(range, attempt));
    completeIfSettled(range.id());
  }

  @Override
  public synchronized void onBatchWritten(List<FinalizedQuestion> batch, BatchOutcome outcome) {
    Set<String> touched = new HashSet<>();
    for (FinalizedQuestion question : batch) {
      outstanding.merge(question.sourceChunk(), -1, Integer::sum);
      touched.add(question.sourceChunk());
    }
    if (outcome.batchFailed()) {
      for (String chunkId : touched) {
        batchErrors.putIfAbsent(chunkId, outcome.batchError());
      }
    }
    for (String chunkId : touched) {
      completeIfSettled(chunkId);
    }
  }

  /** Chunks whose questions were parsed but could not be written. */
  synchronized List<FailedChunk> failedChunks() {
    return List.copyOf(failed);
  }

  private void completeIfSettled(String chunkId) {
    Sealed chunk = sealed.get(chunkId);
    if (chunk == null || outstanding.getOrDefault(chunkId, 0) > 0) {
      return;
    }
    sealed.remove(chunkId);
    outstanding.remove(chunkId);
    String batchError = batchErrors.remove(chunkId);
    if (batchError == null) {
      tracker.markDone(chunkId);
      log.debug("Chunk {} fully written", chunkId);
      return;
    }
    String reason = "Bulk write failed: " + batchError;
    tracker.markFailed(chunkId, reason);
    failed.add(new FailedChunk(chunk.range(), chunk.attempt(), reason));
    log.error("Chunk {} parsed but not written, left for the next run: {}", chunkId, batchError);
  }

  private record Sealed(ByteRange range, int attempt) {}
}
