package com.flamingo.ai.md2db.service.chunking;

import java.util.List;

/**
 * Output of {@link FileChunker#createChunks}.
 *
 * @param fileSize size of the source file when it was planned
 * @param ranges contiguous, gapless, non-empty ranges covering {@code [0, fileSize)}
 * @param warnings boundaries that fell back to the rough cut
 */
public record ChunkPlan(long fileSize, List<ByteRange> ranges, List<BoundaryWarning> warnings) {

  public ChunkPlan {
    ranges = List.copyOf(ranges);
    warnings = List.copyOf(warnings);
  }
}
