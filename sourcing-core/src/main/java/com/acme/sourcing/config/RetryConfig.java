package com.acme.sourcing.config;

import java.time.Duration;

/**
 * Retry policy for calls to unreliable external systems. Pure POJO - no framework dependencies.
 */
public class RetryConfig {

  private int maxAttempts = 5;
  private Duration initialBackoff = Duration.ofSeconds(10);
  private double multiplier = 2.0;
  private Duration maxBackoff = Duration.ofSeconds(120);

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public void setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = initialBackoff;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public void setMultiplier(double multiplier) {
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    this.multiplier = multiplier;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  /**
   * Wait before the attempt that follows failed attempt {@code attempt} (1-based): {@code
   * initialBackoff * multiplier^(attempt-1)}, capped at {@code maxBackoff}.
   */
  public Duration backoffFor(int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
    double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
    long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
    return Duration.ofMillis(capped);
  }
}
