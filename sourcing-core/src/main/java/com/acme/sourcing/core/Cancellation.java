package com.acme.sourcing.core;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation helpers.
 *
 * <p>A task is cancelled by interrupting its thread. Every blocking step (event log load/append,
 * projection write, external call, backoff wait) calls {@link #checkpoint()} so that a pending
 * interrupt surfaces as a {@link CancellationException}. Broad catch blocks must call {@link
 * #rethrowIfCancelled(Throwable)} before any other handling.
 */
public final class Cancellation {

  private Cancellation() {}

  public static void checkpoint() {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Task cancelled");
    }
  }

  public static void rethrowIfCancelled(Throwable t) {
    if (t instanceof CancellationException) {
      throw (CancellationException) t;
    }
  }

  /** Restores the interrupt flag and converts the interruption into a cancellation. */
  public static CancellationException fromInterrupt(InterruptedException e) {
    Thread.currentThread().interrupt();
    CancellationException cancelled = new CancellationException("Task cancelled while waiting");
    cancelled.initCause(e);
    return cancelled;
  }
}
