package com.flamingo.ai.md2db.domain.enums;

/** Overall outcome of an ingestion run. */
public enum RunStatus {
  /** Every chunk was parsed and every record acknowledged. */
  COMPLETED,

  /** Some chunks or records failed; the rest were written. */
  COMPLETED_WITH_ERRORS,

  /** Dispatch stopped early on request; undispatched chunks remain pending. */
  CANCELLED,

  /** No chunk could be processed. */
  FAILED
}
