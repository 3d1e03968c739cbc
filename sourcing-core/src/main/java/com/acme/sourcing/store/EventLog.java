package com.acme.sourcing.store;

import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.StoredEvent;
import java.util.List;
import java.util.UUID;

/**
 * Append-only log of per-aggregate event streams.
 *
 * <p>Implementations throw {@link EventLogException} for I/O faults and {@link
 * java.util.concurrent.CancellationException} when the calling task is cancelled.
 */
public interface EventLog {

  /** All events of a stream in version order. Empty means the stream does not exist. */
  List<StoredEvent> load(UUID aggregateId);

  /** Events of a stream with {@code version >= fromVersion}, in version order. */
  List<StoredEvent> loadFrom(UUID aggregateId, long fromVersion);

  /**
   * Conditionally appends events. Either all events are written at versions {@code
   * expectedVersion + 1 .. expectedVersion + n}, or none are and a conflict is returned because the
   * stream's current version is not {@code expectedVersion}. An empty list succeeds without writing.
   *
   * @return the stream version after the append
   */
  Result<Long, ConcurrencyConflict> append(
      UUID aggregateId, List<? extends DomainEvent> events, long expectedVersion);
}
