package com.flamingo.ai.md2db.service.parsing;

import com.flamingo.ai.md2db.service.chunking.ByteRange;
import java.util.List;

/**
 * What a worker hands back for one attempt at one chunk: either the parsed questions or the
 * failure that stopped it.
 *
 * @param range the chunk
 * @param attempt 1-based attempt number within the run
 * @param questions parsed questions, empty on failure
 * @param failure the read or parse error, or {@code null} on success
 */
public record ChunkParseResult(
    ByteRange range, int attempt, List<RawQuestion> questions, Throwable failure) {

  public static ChunkParseResult success(
      ByteRange range, int attempt, List<RawQuestion> questions) {
    return new ChunkParseResult(range, attempt, List.copyOf(questions), null);
  }

  public static ChunkParseResult failure(ByteRange range, int attempt, Throwable failure) {
    return new ChunkParseResult(range, attempt, List.of(), failure);
  }

  public boolean succeeded() {
    return failure == null;
  }
}
