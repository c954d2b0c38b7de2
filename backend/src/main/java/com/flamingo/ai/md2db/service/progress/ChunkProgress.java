package com.flamingo.ai.md2db.service.progress;

import com.flamingo.ai.md2db.domain.enums.ChunkStatus;

/**
 * Progress entry for one chunk.
 *
 * @param chunkId the chunk's byte range id
 * @param status current state
 * @param attemptCount attempts started in the current run
 * @param lastError reason of the most recent failure, or {@code null}
 */
public record ChunkProgress(
    String chunkId, ChunkStatus status, int attemptCount, String lastError) {

  public static ChunkProgress pending(String chunkId) {
    return new ChunkProgress(chunkId, ChunkStatus.PENDING, 0, null);
  }

  ChunkProgress withStatus(ChunkStatus newStatus) {
    return new ChunkProgress(chunkId, newStatus, attemptCount, lastError);
  }
}
