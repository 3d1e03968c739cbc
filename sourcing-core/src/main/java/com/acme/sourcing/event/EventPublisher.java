package com.acme.sourcing.event;

import java.util.List;

/** Hands committed events to whoever reacts to them. Called only after a successful append. */
public interface EventPublisher {

  void publish(List<? extends DomainEvent> events);

  /** Publisher that drops everything, for write paths with no subscribers. */
  static EventPublisher noop() {
    return events -> {};
  }
}
