package com.acme.sourcing.event;

import java.time.Instant;
import java.util.UUID;

/** Who caused an event, for which tenant, within which correlated flow, and when. */
public record EventMetadata(UUID tenantId, UUID userId, UUID correlationId, Instant timestamp) {

  public EventMetadata {
    if (tenantId == null) {
      throw new IllegalArgumentException("Tenant ID cannot be null");
    }
    if (userId == null) {
      throw new IllegalArgumentException("User ID cannot be null");
    }
    if (correlationId == null) {
      throw new IllegalArgumentException("Correlation ID cannot be null");
    }
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null");
    }
  }

  public static EventMetadata create(UUID tenantId, UUID userId, UUID correlationId) {
    return new EventMetadata(tenantId, userId, correlationId, Instant.now());
  }
}
