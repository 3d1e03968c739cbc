package com.acme.sourcing.persistence.memory;

import com.acme.sourcing.core.Cancellation;
import com.acme.sourcing.core.Jsons;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.StoredEvent;
import com.acme.sourcing.store.ConcurrencyConflict;
import com.acme.sourcing.store.EventLog;
import com.acme.sourcing.store.EventLogException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event log kept in process memory. Payloads are stored as JSON exactly as a database-backed log
 * would store them, so replay exercises the same deserialization path.
 *
 * <p>Each stream is guarded by its own monitor; the version check and the write happen under it,
 * which gives at most one winner per expected version.
 */
public class InMemoryEventLog implements EventLog {
  private static final Logger log = LoggerFactory.getLogger(InMemoryEventLog.class);

  private final Map<UUID, EventStream> streams = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryEventLog() {
    this(Clock.systemUTC());
  }

  public InMemoryEventLog(Clock clock) {
    this.clock = clock;
  }

  @Override
  public List<StoredEvent> load(UUID aggregateId) {
    return loadFrom(aggregateId, 1);
  }

  @Override
  public List<StoredEvent> loadFrom(UUID aggregateId, long fromVersion) {
    Cancellation.checkpoint();
    EventStream stream = streams.get(aggregateId);
    if (stream == null) {
      return List.of();
    }
    synchronized (stream) {
      return stream.events.stream()
          .filter(e -> e.version() >= fromVersion)
          .collect(Collectors.toUnmodifiableList());
    }
  }

  @Override
  public Result<Long, ConcurrencyConflict> append(
      UUID aggregateId, List<? extends DomainEvent> events, long expectedVersion) {
    Cancellation.checkpoint();
    if (events.isEmpty()) {
      return Result.success(expectedVersion);
    }

    List<String> payloads = new ArrayList<>(events.size());
    for (DomainEvent event : events) {
      if (!aggregateId.equals(event.aggregateId())) {
        throw new EventLogException(
            "Event " + event.eventType() + " belongs to " + event.aggregateId()
                + ", not to stream " + aggregateId);
      }
      try {
        payloads.add(Jsons.toJson(event));
      } catch (IllegalArgumentException e) {
        throw new EventLogException("Failed to serialize " + event.eventType(), e);
      }
    }

    EventStream stream = streams.computeIfAbsent(aggregateId, id -> new EventStream());
    synchronized (stream) {
      long actual = stream.events.size();
      if (actual != expectedVersion) {
        log.debug(
            "Append rejected: aggregateId={} expected={} actual={}",
            aggregateId,
            expectedVersion,
            actual);
        return Result.failure(new ConcurrencyConflict(aggregateId, expectedVersion, actual));
      }
      Instant now = clock.instant();
      long version = expectedVersion;
      for (int i = 0; i < events.size(); i++) {
        DomainEvent event = events.get(i);
        version++;
        stream.events.add(
            new StoredEvent(
                UUID.randomUUID(),
                aggregateId,
                event.aggregateType(),
                event.eventType(),
                payloads.get(i),
                event.metadata(),
                version,
                now));
      }
      log.debug("Appended {} events: aggregateId={} version={}", events.size(), aggregateId, version);
      return Result.success(version);
    }
  }

  /** Number of streams with at least one event. */
  public int streamCount() {
    return (int) streams.values().stream().filter(s -> s.size() > 0).count();
  }

  private static final class EventStream {
    private final List<StoredEvent> events = new ArrayList<>();

    synchronized int size() {
      return events.size();
    }
  }
}
