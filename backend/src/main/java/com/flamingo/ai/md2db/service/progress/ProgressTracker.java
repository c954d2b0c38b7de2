package com.flamingo.ai.md2db.service.progress;

import com.flamingo.ai.md2db.domain.enums.ChunkStatus;
import com.flamingo.ai.md2db.service.chunking.ByteRange;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-run view of chunk progress, saved to a {@link ProgressStore} after every transition.
 *
 * <p>On {@link #open}, chunks the store already has as {@link ChunkStatus#DONE} stay done and are
 * not processed again. Every other chunk starts over as pending with no attempts.
 *
 * <p>Methods are synchronized: transitions come from the coordinator thread and, for {@link
 * #markDone}, from the batch write thread. A failed save is logged and the run carries on; the next
 * successful save writes the full state again.
 */
@Slf4j
public class ProgressTracker {

  private final ProgressStore store;
  private final String sourceKey;
  private final Map<String, ChunkProgress> entries = new LinkedHashMap<>();

  private ProgressTracker(ProgressStore store, String sourceKey) {
    this.store = store;
    this.sourceKey = sourceKey;
  }

  /**
   * Creates the tracker for a run over {@code ranges}, resuming saved state where it matches.
   *
   * @param store durable progress store
   * @param sourceKey identifies the source file
   * @param ranges the run's chunks
   * @return the tracker
   */
  public static ProgressTracker open(
      ProgressStore store, String sourceKey, List<ByteRange> ranges) {
    Map<String, ChunkProgress> saved = new HashMap<>();
    try {
      for (ChunkProgress entry : store.load(sourceKey)) {
        saved.put(entry.chunkId(), entry);
      }
    } catch (IOException e) {
      log.warn(
          "Could not read saved progress for {}, starting from scratch: {}",
          sourceKey,
          e.getMessage());
    }

    ProgressTracker tracker = new ProgressTracker(store, sourceKey);
    int resumedDone = 0;
    synchronized (tracker) {
      for (ByteRange range : ranges) {
        ChunkProgress previous = saved.get(range.id());
        if (previous != null && previous.status() == ChunkStatus.DONE) {
          tracker.entries.put(range.id(), previous);
          resumedDone++;
        } else {
          tracker.entries.put(range.id(), ChunkProgress.pending(range.id()));
        }
      }
      tracker.persist();
    }
    if (resumedDone > 0) {
      log.info("Resuming {}: {} of {} chunks already done", sourceKey, resumedDone, ranges.size());
    }
    return tracker;
  }

  public synchronized void markPending(String chunkId) {
    ChunkProgress current = require(chunkId);
    update(current.withStatus(ChunkStatus.PENDING));
  }

  /**
   * Records the start of a new attempt.
   *
   * @param chunkId the chunk
   * @return the attempt number, starting at 1
   */
  public synchronized int markInFlight(String chunkId) {
    ChunkProgress current = require(chunkId);
    int attempt = current.attemptCount() + 1;
    update(new ChunkProgress(chunkId, ChunkStatus.IN_FLIGHT, attempt, current.lastError()));
    return attempt;
  }

  public synchronized void markDone(String chunkId) {
    ChunkProgress current = require(chunkId);
    update(new ChunkProgress(chunkId, ChunkStatus.DONE, current.attemptCount(), null));
  }

  public synchronized void markFailed(String chunkId, String reason) {
    ChunkProgress current = require(chunkId);
    update(new ChunkProgress(chunkId, ChunkStatus.FAILED, current.attemptCount(), reason));
  }

  public synchronized boolean isDone(String chunkId) {
    return require(chunkId).status() == ChunkStatus.DONE;
  }

  public synchronized List<ChunkProgress> snapshot() {
    return List.copyOf(entries.values());
  }

  private ChunkProgress require(String chunkId) {
    ChunkProgress current = entries.get(chunkId);
    if (current == null) {
      throw new IllegalArgumentException("Unknown chunk " + chunkId);
    }
    return current;
  }

  private void update(ChunkProgress next) {
    entries.put(next.chunkId(), next);
    persist();
  }

  private void persist() {
    try {
      store.save(sourceKey, new ArrayList<>(entries.values()));
    } catch (IOException e) {
      log.error("Failed to save progress for {}: {}", sourceKey, e.getMessage(), e);
    }
  }
}
