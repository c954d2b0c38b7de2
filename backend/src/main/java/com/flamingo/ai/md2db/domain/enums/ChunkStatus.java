package com.flamingo.ai.md2db.domain.enums;

/** Processing state of a single chunk. */
public enum ChunkStatus {
  /** Known to the run but not yet handed to a worker. */
  PENDING,

  /** Handed to a worker, or parsed with records still waiting for a bulk write. */
  IN_FLIGHT,

  /** Every record of the chunk has been acknowledged by the store. */
  DONE,

  /** The last attempt failed; retried while attempts remain. */
  FAILED
}
