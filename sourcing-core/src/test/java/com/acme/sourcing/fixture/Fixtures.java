package com.acme.sourcing.fixture;

import com.acme.sourcing.core.Jsons;
import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.EventTypeRegistry;
import com.acme.sourcing.event.JacksonEventDeserializer;
import com.acme.sourcing.event.StoredEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public final class Fixtures {

  private Fixtures() {}

  public static EventTypeRegistry<CounterEvent> counterRegistry() {
    return EventTypeRegistry.builder(CounterEvent.class)
        .register(CounterEvent.CounterOpened.class)
        .register(CounterEvent.CounterIncremented.class)
        .register(CounterEvent.CounterClosed.class)
        .build();
  }

  public static JacksonEventDeserializer<CounterEvent> counterDeserializer() {
    return new JacksonEventDeserializer<>(counterRegistry());
  }

  /** Stores events the way an event log would, at versions 1..n. */
  public static List<StoredEvent> stored(List<? extends DomainEvent> events) {
    List<StoredEvent> stored = new ArrayList<>();
    long version = 0;
    for (DomainEvent event : events) {
      version++;
      stored.add(
          new StoredEvent(
              UUID.randomUUID(),
              event.aggregateId(),
              event.aggregateType(),
              event.eventType(),
              Jsons.toJson(event),
              event.metadata(),
              version,
              Instant.now()));
    }
    return stored;
  }
}
