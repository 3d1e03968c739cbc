package com.acme.sourcing.resilience;

import com.acme.sourcing.core.Cancellation;
import java.time.Duration;

/** Waits between retry attempts. Interruption surfaces as a cancellation. */
@FunctionalInterface
public interface Sleeper {

  /**
   * @throws java.util.concurrent.CancellationException if the waiting thread is interrupted
   */
  void sleep(Duration duration);

  static Sleeper threadSleeper() {
    return duration -> {
      try {
        Thread.sleep(duration.toMillis());
      } catch (InterruptedException e) {
        throw Cancellation.fromInterrupt(e);
      }
    };
  }
}
