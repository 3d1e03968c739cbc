package com.acme.sourcing.core;

import java.util.UUID;
import org.slf4j.MDC;

/**
 * Puts a correlation id into the logging MDC for the duration of a try-with-resources block.
 *
 * <p>Closing restores whatever value was there before, so a command dispatched from inside another
 * command on the same thread hands the outer correlation id back when it finishes.
 */
public final class CorrelationScope implements AutoCloseable {

  public static final String CORRELATION_ID = "correlationId";

  private final String previous;

  private CorrelationScope(String previous) {
    this.previous = previous;
  }

  public static CorrelationScope open(UUID correlationId) {
    String previous = MDC.get(CORRELATION_ID);
    MDC.put(CORRELATION_ID, String.valueOf(correlationId));
    return new CorrelationScope(previous);
  }

  @Override
  public void close() {
    if (previous == null) {
      MDC.remove(CORRELATION_ID);
    } else {
      MDC.put(CORRELATION_ID, previous);
    }
  }
}
