package com.acme.sourcing.store;

/** Storage-level failure reading or writing the event log. */
public class EventLogException extends RuntimeException {

  public EventLogException(String message) {
    super(message);
  }

  public EventLogException(String message, Throwable cause) {
    super(message, cause);
  }
}
