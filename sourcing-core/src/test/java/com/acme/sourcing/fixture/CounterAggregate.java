package com.acme.sourcing.fixture;

import com.acme.sourcing.aggregate.AggregateRoot;
import com.acme.sourcing.event.EventMetadata;
import com.acme.sourcing.fixture.CounterEvent.CounterClosed;
import com.acme.sourcing.fixture.CounterEvent.CounterIncremented;
import com.acme.sourcing.fixture.CounterEvent.CounterOpened;
import java.util.List;
import java.util.UUID;

public class CounterAggregate extends AggregateRoot<CounterEvent> {

  private final UUID id;
  private String name;
  private int value;
  private boolean closed;

  private CounterAggregate(UUID id) {
    this.id = id;
  }

  public static CounterAggregate open(UUID id, String name, EventMetadata metadata) {
    CounterAggregate counter = new CounterAggregate(id);
    counter.applyEvent(new CounterOpened(id, name, metadata));
    return counter;
  }

  public static CounterAggregate reconstitute(UUID id, List<CounterEvent> history) {
    CounterAggregate counter = new CounterAggregate(id);
    counter.loadFromHistory(history);
    return counter;
  }

  public void increment(int amount, EventMetadata metadata) {
    if (closed) {
      throw new IllegalStateException("Counter is closed");
    }
    if (amount == 0) {
      return;
    }
    applyEvent(new CounterIncremented(id, amount, metadata));
  }

  public void close(EventMetadata metadata) {
    if (!closed) {
      applyEvent(new CounterClosed(id, metadata));
    }
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public String getAggregateType() {
    return "Counter";
  }

  @Override
  protected void handle(CounterEvent event) {
    if (event instanceof CounterOpened) {
      name = ((CounterOpened) event).name();
    } else if (event instanceof CounterIncremented) {
      value += ((CounterIncremented) event).amount();
    } else if (event instanceof CounterClosed) {
      closed = true;
    }
  }

  public String getName() {
    return name;
  }

  public int getValue() {
    return value;
  }

  public boolean isClosed() {
    return closed;
  }
}
