/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.executor.partition;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Caller-owned stop request for a partitioned query. Once fired it stays fired; queued partition
 * reads are abandoned and in-flight reads stop at the next row.
 */
public class CancellationSignal {

  private final CompletableFuture<Void> fired = new CompletableFuture<>();

  /** Fires the signal. Firing more than once has no further effect. */
  public void cancel() {
    fired.complete(null);
  }

  /**
   * Fires the signal once the delay elapses, unless it fired earlier.
   *
   * @param delay time until the signal fires
   * @return this signal
   */
  public CancellationSignal cancelAfter(Duration delay) {
    fired.completeOnTimeout(null, delay.toMillis(), TimeUnit.MILLISECONDS);
    return this;
  }

  public boolean isCancelled() {
    return fired.isDone();
  }

  /** Returns a future completed when the signal fires. Completing it does not fire the signal. */
  public CompletableFuture<Void> whenCancelled() {
    return fired.thenApply(ignored -> null);
  }

  /** Returns a signal that fires when this one fires, and that can also be fired on its own. */
  public CancellationSignal newChild() {
    CancellationSignal child = new CancellationSignal();
    fired.thenRun(child::cancel);
    return child;
  }
}
