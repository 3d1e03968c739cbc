package com.acme.sourcing.command;

import com.acme.sourcing.aggregate.AggregateRoot;
import com.acme.sourcing.core.Cancellation;
import com.acme.sourcing.core.CorrelationScope;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.event.StoredEvent;
import com.acme.sourcing.store.ConcurrencyConflict;
import com.acme.sourcing.store.EventLog;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Template for commands against an existing aggregate.
 *
 * <ol>
 *   <li>load the stream; empty means not found
 *   <li>the stream's tenant (from its first event) must match the command's tenant, otherwise the
 *       aggregate is reported as not found
 *   <li>deserialize and fold
 *   <li>compare the caller's expected version, if any, with the folded version
 *   <li>run the domain mutation; domain guard violations come back as typed errors
 *   <li>no new events means an idempotent no-op: succeed without writing
 *   <li>append with the version captured at load time
 *   <li>update read models and publish
 * </ol>
 *
 * <p>Unexpected failures while loading, deserializing or appending become persistence failures
 * carrying the original message. {@link CancellationException} always propagates.
 */
public abstract class AggregateCommandHandler<
        C extends TenantCommand, A extends AggregateRoot<E>, E extends DomainEvent, T, X>
    extends EventSourcedCommandSupport<A, E, X> implements CommandHandler<C, T, X> {

  private static final Logger log = LoggerFactory.getLogger(AggregateCommandHandler.class);

  private final EventDeserializer<E> deserializer;

  protected AggregateCommandHandler(
      EventLog eventLog, EventDeserializer<E> deserializer, EventPublisher eventPublisher) {
    super(eventLog, eventPublisher);
    this.deserializer = deserializer;
  }

  protected abstract UUID aggregateId(C command);

  /** Human-readable aggregate name for messages, e.g. "Project". */
  protected abstract String aggregateLabel();

  protected abstract A reconstitute(UUID aggregateId, List<E> history);

  protected abstract X notFound(C command, String message);

  /** Applies the domain mutation. Domain guard violations are returned as failures. */
  protected abstract Result<T, X> execute(A aggregate, C command);

  /** Caller's expected version, or {@code null} when the caller does not care. */
  protected Long expectedVersion(C command) {
    return null;
  }

  /** Read-model updates after a successful append. Use {@link #updateProjection}. */
  protected void project(A aggregate, C command, List<E> committed) {}

  @Override
  public final Result<T, X> handle(C command) {
    try (CorrelationScope ignored = CorrelationScope.open(command.correlationId())) {
      return doHandle(aggregateId(command), command);
    }
  }

  private Result<T, X> doHandle(UUID aggregateId, C command) {
    String label = aggregateLabel();
    String commandName = command.getClass().getSimpleName();

    List<StoredEvent> stored;
    try {
      Cancellation.checkpoint();
      stored = eventLog.load(aggregateId);
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to load {}: aggregateId={} command={}", label, aggregateId, commandName, e);
      return Result.failure(
          persistenceFailure("Failed to load " + label.toLowerCase() + ": " + e.getMessage()));
    }

    if (stored.isEmpty()) {
      log.info("{} not found: aggregateId={} command={}", label, aggregateId, commandName);
      return Result.failure(notFound(command, label + " not found: " + aggregateId));
    }

    UUID streamTenant = stored.get(0).metadata().tenantId();
    if (!streamTenant.equals(command.tenantId())) {
      log.warn(
          "Tenant mismatch: aggregateId={} streamTenant={} commandTenant={} command={}",
          aggregateId,
          streamTenant,
          command.tenantId(),
          commandName);
      return Result.failure(notFound(command, label + " not found: " + aggregateId));
    }

    A aggregate;
    try {
      List<E> history = stored.stream().map(deserializer::deserialize).collect(Collectors.toList());
      aggregate = reconstitute(aggregateId, history);
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to rebuild {}: aggregateId={}", label, aggregateId, e);
      return Result.failure(
          persistenceFailure("Failed to load " + label.toLowerCase() + ": " + e.getMessage()));
    }

    long loadedVersion = aggregate.getVersion();
    Long expected = expectedVersion(command);
    if (expected != null && expected.longValue() != loadedVersion) {
      log.info(
          "Stale expected version: aggregateId={} expected={} actual={}",
          aggregateId,
          expected,
          loadedVersion);
      return Result.failure(
          concurrencyConflict(new ConcurrencyConflict(aggregateId, expected, loadedVersion)));
    }

    Result<T, X> outcome = execute(aggregate, command);
    if (outcome.isFailure()) {
      log.info(
          "{} rejected: aggregateId={} tenantId={} error={}",
          commandName,
          aggregateId,
          command.tenantId(),
          outcome.errorOrNull());
      return outcome;
    }

    if (!aggregate.hasUncommittedEvents()) {
      log.debug("{} was a no-op: aggregateId={}", commandName, aggregateId);
      return outcome;
    }

    Result<List<E>, X> committed = commit(aggregate, loadedVersion);
    if (committed.isFailure()) {
      return Result.failure(committed.errorOrNull());
    }

    List<E> events = committed.getOrNull();
    try {
      project(aggregate, command, events);
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn(
          "Projection update failed: aggregateId={}. Projection can be rebuilt from event store",
          aggregateId,
          e);
    }
    publish(events);
    return outcome;
  }
}
