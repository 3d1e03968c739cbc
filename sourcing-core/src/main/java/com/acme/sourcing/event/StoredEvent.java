package com.acme.sourcing.event;

import java.time.Instant;
import java.util.UUID;

/**
 * An event as persisted in the log.
 *
 * @param version 1-based position of the event within its stream
 * @param payload JSON form of the domain event record
 */
public record StoredEvent(
    UUID id,
    UUID aggregateId,
    String aggregateType,
    String eventType,
    String payload,
    EventMetadata metadata,
    long version,
    Instant createdAt) {}
