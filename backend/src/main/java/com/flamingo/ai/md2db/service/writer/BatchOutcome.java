package com.flamingo.ai.md2db.service.writer;

import java.util.List;

/**
 * Result of writing one batch.
 *
 * @param written questions inserted
 * @param duplicates questions refused because their id already existed
 * @param failures questions refused for any other reason
 * @param batchError message of the exception that stopped the whole write, or {@code null} if the
 *     store answered for every document
 */
public record BatchOutcome(
    int written, int duplicates, List<WriteFailure> failures, String batchError) {

  public BatchOutcome {
    failures = List.copyOf(failures);
  }

  /** True when the store never answered for the batch, so none of it may have been persisted. */
  public boolean batchFailed() {
    return batchError != null;
  }
}
