package com.flamingo.ai.md2db.service.ingest;

import com.flamingo.ai.md2db.service.chunking.ByteRange;

/**
 * A chunk that still failed after its last allowed attempt, or whose questions the store never
 * answered for. The range can be reprocessed on its own.
 *
 * @param range the chunk's bytes in the source file
 * @param attempts attempts made in this run
 * @param reason the last failure
 */
public record FailedChunk(ByteRange range, int attempts, String reason) {

  public String chunkId() {
    return range.id();
  }
}
