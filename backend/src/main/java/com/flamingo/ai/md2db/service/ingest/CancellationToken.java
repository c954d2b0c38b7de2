package com.flamingo.ai.md2db.service.ingest;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a run. The coordinator checks it between chunk dispatches; chunks
 * already handed to workers finish and their questions are still written.
 */
public final class CancellationToken {

  private final AtomicBoolean requested = new AtomicBoolean();

  public static CancellationToken create() {
    return new CancellationToken();
  }

  public void cancel() {
    requested.set(true);
  }

  public boolean isCancellationRequested() {
    return requested.get();
  }
}
