package com.acme.sourcing.event;

/** Turns a stored event back into the domain event of one aggregate family. */
public interface EventDeserializer<E extends DomainEvent> {

  /**
   * @throws UnknownEventTypeException if the type tag has no mapping
   */
  E deserialize(StoredEvent stored);
}
