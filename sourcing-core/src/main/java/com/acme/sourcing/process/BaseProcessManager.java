package com.acme.sourcing.process;

import com.acme.sourcing.aggregate.AggregateRoot;
import com.acme.sourcing.command.CommandHandlerRegistry;
import com.acme.sourcing.command.DomainCommand;
import com.acme.sourcing.core.Cancellation;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.StoredEvent;
import com.acme.sourcing.store.EventLog;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for process managers that turn one committed event into a follow-up command
 * on another aggregate.
 *
 * <p>The trigger event only says what happened; the source stream is reloaded to get the full
 * current state. If that state is no longer the one this step expects (a duplicate delivery, or
 * another actor got there first) the step is skipped. Otherwise the follow-up command goes through
 * the {@link CommandHandlerRegistry} like any user command.
 *
 * <p>There is no transaction across the two aggregates. A failed dispatch is logged at ERROR with
 * both ids so an operator can reconcile.
 *
 * @param <T> trigger event type
 * @param <A> source aggregate type
 * @param <C> follow-up command type
 */
public abstract class BaseProcessManager<
    T extends DomainEvent, A extends AggregateRoot<?>, C extends DomainCommand> {

  private static final Logger LOG = LoggerFactory.getLogger(BaseProcessManager.class);

  // Template methods - subclasses provide infrastructure dependencies
  protected abstract EventLog getEventLog();

  protected abstract CommandHandlerRegistry getCommandHandlers();

  /** Short name used in log lines, e.g. "VmProvisioning". */
  protected abstract String getProcessName();

  protected abstract A reconstitute(UUID aggregateId, List<StoredEvent> history);

  /** Idempotency guard: is the source aggregate still exactly where this step expects it? */
  protected abstract boolean isStillApplicable(A aggregate);

  protected abstract C buildCommand(T trigger, A aggregate);

  /** Id of the aggregate the follow-up command targets, for reconciliation logs. */
  protected abstract UUID targetId(C command);

  /** Stream to reload. Defaults to the stream the trigger was recorded on. */
  protected UUID sourceId(T trigger) {
    return trigger.aggregateId();
  }

  public ProcessStepOutcome onEvent(T trigger) {
    UUID sourceId = sourceId(trigger);
    UUID correlationId = trigger.metadata().correlationId();

    A aggregate;
    try {
      Cancellation.checkpoint();
      List<StoredEvent> history = getEventLog().load(sourceId);
      if (history.isEmpty()) {
        LOG.warn(
            "{}: source aggregate not found: aggregateId={} correlationId={}",
            getProcessName(),
            sourceId,
            correlationId);
        return ProcessStepOutcome.SOURCE_MISSING;
      }
      aggregate = reconstitute(sourceId, history);
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      LOG.error(
          "{}: failed to load source aggregate: aggregateId={} correlationId={}",
          getProcessName(),
          sourceId,
          correlationId,
          e);
      return ProcessStepOutcome.LOAD_FAILED;
    }

    if (!isStillApplicable(aggregate)) {
      LOG.info(
          "{}: source aggregate already advanced, skipping: aggregateId={} version={}",
          getProcessName(),
          sourceId,
          aggregate.getVersion());
      return ProcessStepOutcome.SKIPPED;
    }

    C command = buildCommand(trigger, aggregate);
    UUID targetId = targetId(command);
    try {
      Result<?, ?> result = getCommandHandlers().dispatch(command);
      if (result.isFailure()) {
        LOG.error(
            "CRITICAL: {} step failed, system may be inconsistent: sourceId={} targetId={} "
                + "correlationId={} error={}",
            getProcessName(),
            sourceId,
            targetId,
            correlationId,
            result.errorOrNull());
        return ProcessStepOutcome.DISPATCH_FAILED;
      }
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      LOG.error(
          "CRITICAL: {} step threw, system may be inconsistent: sourceId={} targetId={} "
              + "correlationId={}",
          getProcessName(),
          sourceId,
          targetId,
          correlationId,
          e);
      return ProcessStepOutcome.DISPATCH_FAILED;
    }

    LOG.info(
        "{}: dispatched {}: sourceId={} targetId={} correlationId={}",
        getProcessName(),
        command.getClass().getSimpleName(),
        sourceId,
        targetId,
        correlationId);
    return ProcessStepOutcome.DISPATCHED;
  }
}
