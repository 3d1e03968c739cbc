package com.acme.sourcing.event;

/** Raised when a stored event carries a type tag that has no registered payload class. */
public class UnknownEventTypeException extends RuntimeException {
  private final String eventType;

  public UnknownEventTypeException(String eventType, String aggregateType) {
    super("Unknown event type '" + eventType + "' for aggregate type " + aggregateType);
    this.eventType = eventType;
  }

  public String getEventType() {
    return eventType;
  }
}
