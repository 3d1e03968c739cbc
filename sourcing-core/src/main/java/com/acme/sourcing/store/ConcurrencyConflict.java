package com.acme.sourcing.store;

import java.util.UUID;

/** The stream had moved on between load and append. */
public record ConcurrencyConflict(UUID aggregateId, long expectedVersion, long actualVersion) {

  public String message() {
    return "Version mismatch: expected " + expectedVersion + ", actual " + actualVersion;
  }
}
