package com.acme.sourcing.aggregate;

import static org.assertj.core.api.Assertions.*;

import com.acme.sourcing.event.EventMetadata;
import com.acme.sourcing.fixture.CounterAggregate;
import com.acme.sourcing.fixture.CounterEvent;
import com.acme.sourcing.fixture.CounterEvent.CounterIncremented;
import com.acme.sourcing.fixture.CounterEvent.CounterOpened;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AggregateRootTest {

  private final UUID id = UUID.randomUUID();
  private final EventMetadata metadata =
      EventMetadata.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

  @Test
  @DisplayName("applyEvent - should fold state, bump version and record the event as pending")
  void testApplyEvent() {
    CounterAggregate counter = CounterAggregate.open(id, "hits", metadata);
    counter.increment(3, metadata);

    assertThat(counter.getValue()).isEqualTo(3);
    assertThat(counter.getVersion()).isEqualTo(2);
    assertThat(counter.getUncommittedEvents())
        .extracting(CounterEvent::eventType)
        .containsExactly("CounterOpened", "CounterIncremented");
  }

  @Test
  @DisplayName("replay - should rebuild the same state with nothing pending")
  void testReplayMatchesLiveState() {
    // Given
    CounterAggregate live = CounterAggregate.open(id, "hits", metadata);
    live.increment(2, metadata);
    live.increment(5, metadata);

    // When
    CounterAggregate replayed = CounterAggregate.reconstitute(id, live.getUncommittedEvents());

    // Then
    assertThat(replayed.getValue()).isEqualTo(live.getValue());
    assertThat(replayed.getName()).isEqualTo("hits");
    assertThat(replayed.getVersion()).isEqualTo(3);
    assertThat(replayed.hasUncommittedEvents()).isFalse();
  }

  @Test
  @DisplayName("no-op command - should leave version and pending events unchanged")
  void testNoOpCommand() {
    CounterAggregate counter =
        CounterAggregate.reconstitute(id, List.of(new CounterOpened(id, "hits", metadata)));

    counter.increment(0, metadata);
    counter.close(metadata);
    counter.clearUncommittedEvents();
    counter.close(metadata);

    assertThat(counter.getVersion()).isEqualTo(2);
    assertThat(counter.hasUncommittedEvents()).isFalse();
  }

  @Test
  @DisplayName("loadFromHistory - should refuse to replay over pending events")
  void testLoadFromHistoryWithPendingEvents() {
    CounterAggregate counter = CounterAggregate.open(id, "hits", metadata);

    assertThatThrownBy(() -> counter.loadFromHistory(List.of(new CounterIncremented(id, 1, metadata))))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("getUncommittedEvents - should return a snapshot")
  void testUncommittedEventsSnapshot() {
    CounterAggregate counter = CounterAggregate.open(id, "hits", metadata);
    List<CounterEvent> snapshot = counter.getUncommittedEvents();

    counter.clearUncommittedEvents();

    assertThat(snapshot).hasSize(1);
    assertThatThrownBy(() -> snapshot.add(new CounterIncremented(id, 1, metadata)))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
