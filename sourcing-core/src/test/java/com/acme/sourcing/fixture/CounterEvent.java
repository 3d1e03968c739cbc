package com.acme.sourcing.fixture;

import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.EventMetadata;
import java.util.UUID;

/** Minimal event family for exercising the sourcing core. */
public sealed interface CounterEvent extends DomainEvent {

  @Override
  default String aggregateType() {
    return "Counter";
  }

  record CounterOpened(UUID aggregateId, String name, EventMetadata metadata)
      implements CounterEvent {}

  record CounterIncremented(UUID aggregateId, int amount, EventMetadata metadata)
      implements CounterEvent {}

  record CounterClosed(UUID aggregateId, EventMetadata metadata) implements CounterEvent {}
}
