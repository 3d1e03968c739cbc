package com.acme.sourcing.aggregate;

import com.acme.sourcing.event.DomainEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Base for event-sourced aggregates.
 *
 * <p>State changes only happen in {@link #handle(DomainEvent)}, which must be deterministic and do
 * no I/O. The version is the number of events applied so far, so an aggregate rebuilt from {@code
 * n} stored events has version {@code n}.
 *
 * @param <E> the aggregate's event family
 */
public abstract class AggregateRoot<E extends DomainEvent> {

  private final List<E> uncommittedEvents = new ArrayList<>();
  private long version;

  public abstract UUID getId();

  public abstract String getAggregateType();

  /** Folds one event into state. */
  protected abstract void handle(E event);

  /** Records a new event produced by a command method. */
  protected final void applyEvent(E event) {
    handle(event);
    version++;
    uncommittedEvents.add(event);
  }

  /** Folds a historical event without recording it as new. */
  public final void replay(E event) {
    handle(event);
    version++;
  }

  public final void loadFromHistory(List<? extends E> history) {
    if (!uncommittedEvents.isEmpty()) {
      throw new IllegalStateException("Cannot replay history onto an aggregate with pending events");
    }
    history.forEach(this::replay);
  }

  public long getVersion() {
    return version;
  }

  public List<E> getUncommittedEvents() {
    return List.copyOf(uncommittedEvents);
  }

  public boolean hasUncommittedEvents() {
    return !uncommittedEvents.isEmpty();
  }

  public void clearUncommittedEvents() {
    uncommittedEvents.clear();
  }
}
