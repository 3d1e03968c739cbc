package com.acme.sourcing.event;

import java.util.UUID;

/**
 * An immutable fact recorded against one aggregate stream. Implementations are records whose
 * components form the serialized payload.
 */
public interface DomainEvent {

  UUID aggregateId();

  String aggregateType();

  EventMetadata metadata();

  /** Type tag used in the event log to select the payload class on replay. */
  default String eventType() {
    return getClass().getSimpleName();
  }
}
