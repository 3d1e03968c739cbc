package com.acme.sourcing.command;

import com.acme.sourcing.aggregate.AggregateRoot;
import com.acme.sourcing.core.Cancellation;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.projection.ProjectionError;
import com.acme.sourcing.store.ConcurrencyConflict;
import com.acme.sourcing.store.EventLog;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared write path for handlers of one aggregate family: append the aggregate's pending events,
 * then update read models and publish. Read-model and publication failures are logged and never
 * fail the command, since both can be rebuilt from the event log.
 *
 * @param <A> aggregate type
 * @param <E> event family
 * @param <X> handler error type
 */
public abstract class EventSourcedCommandSupport<A extends AggregateRoot<E>, E extends DomainEvent, X> {
  private static final Logger log = LoggerFactory.getLogger(EventSourcedCommandSupport.class);

  protected final EventLog eventLog;
  protected final EventPublisher eventPublisher;

  protected EventSourcedCommandSupport(EventLog eventLog, EventPublisher eventPublisher) {
    this.eventLog = eventLog;
    this.eventPublisher = eventPublisher;
  }

  protected abstract X concurrencyConflict(ConcurrencyConflict conflict);

  protected abstract X persistenceFailure(String message);

  /**
   * Appends pending events at {@code expectedVersion} and clears them on success.
   *
   * @return the committed events, empty if there was nothing to append
   */
  protected final Result<List<E>, X> commit(A aggregate, long expectedVersion) {
    List<E> events = aggregate.getUncommittedEvents();
    if (events.isEmpty()) {
      return Result.success(List.of());
    }

    Result<Long, ConcurrencyConflict> appended;
    try {
      Cancellation.checkpoint();
      appended = eventLog.append(aggregate.getId(), events, expectedVersion);
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error(
          "Failed to persist events: aggregateType={} aggregateId={}",
          aggregate.getAggregateType(),
          aggregate.getId(),
          e);
      return Result.failure(persistenceFailure("Failed to persist events: " + e.getMessage()));
    }

    if (appended.isFailure()) {
      ConcurrencyConflict conflict = appended.errorOrNull();
      log.warn(
          "Concurrency conflict: aggregateType={} aggregateId={} {}",
          aggregate.getAggregateType(),
          aggregate.getId(),
          conflict.message());
      return Result.failure(concurrencyConflict(conflict));
    }

    aggregate.clearUncommittedEvents();
    log.info(
        "Committed {} events: aggregateType={} aggregateId={} version={}",
        events.size(),
        aggregate.getAggregateType(),
        aggregate.getId(),
        appended.getOrNull());
    return Result.success(events);
  }

  /** Runs one read-model write; failures are logged at WARN. */
  protected final void updateProjection(
      String operation, UUID aggregateId, Supplier<Result<Void, ProjectionError>> update) {
    try {
      Cancellation.checkpoint();
      update
          .get()
          .onFailure(
              error ->
                  log.warn(
                      "Projection update failed: operation={} aggregateId={} error={}. "
                          + "Projection can be rebuilt from event store",
                      operation,
                      aggregateId,
                      error.message()));
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn(
          "Projection update failed: operation={} aggregateId={}. "
              + "Projection can be rebuilt from event store",
          operation,
          aggregateId,
          e);
    }
  }

  protected final void publish(List<E> committed) {
    if (committed.isEmpty()) {
      return;
    }
    try {
      eventPublisher.publish(committed);
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn(
          "Committed events not published: aggregateId={} count={}",
          committed.get(0).aggregateId(),
          committed.size(),
          e);
    }
  }
}
