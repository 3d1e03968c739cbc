package com.acme.sourcing.event;

import com.acme.sourcing.core.Jsons;

/** Deserializes JSON payloads using an {@link EventTypeRegistry} to pick the target record. */
public class JacksonEventDeserializer<E extends DomainEvent> implements EventDeserializer<E> {

  private final EventTypeRegistry<E> registry;

  public JacksonEventDeserializer(EventTypeRegistry<E> registry) {
    this.registry = registry;
  }

  @Override
  public E deserialize(StoredEvent stored) {
    Class<? extends E> type =
        registry
            .resolve(stored.eventType())
            .orElseThrow(
                () -> new UnknownEventTypeException(stored.eventType(), stored.aggregateType()));
    return Jsons.fromJson(stored.payload(), type);
  }
}
