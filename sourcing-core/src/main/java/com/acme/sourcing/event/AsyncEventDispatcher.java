package com.acme.sourcing.event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process publisher that delivers each committed event to the subscribers of its class on an
 * executor. A failing subscriber is logged and does not affect other subscribers or the
 * publishing command.
 */
public class AsyncEventDispatcher implements EventPublisher, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AsyncEventDispatcher.class);

  private final Executor executor;
  private final Map<Class<?>, List<Consumer<DomainEvent>>> subscribers = new ConcurrentHashMap<>();
  private volatile boolean closed;

  public AsyncEventDispatcher(Executor executor) {
    this.executor = executor;
  }

  @SuppressWarnings("unchecked")
  public <E extends DomainEvent> void subscribe(Class<E> eventType, Consumer<? super E> subscriber) {
    subscribers
        .computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
        .add(event -> subscriber.accept((E) event));
    log.info("Subscribed {} to {}", subscriber.getClass().getSimpleName(), eventType.getSimpleName());
  }

  @Override
  public void publish(List<? extends DomainEvent> events) {
    if (closed) {
      log.warn("Dispatcher closed, dropping {} events", events.size());
      return;
    }
    for (DomainEvent event : events) {
      List<Consumer<DomainEvent>> targets = subscribers.get(event.getClass());
      if (targets == null) {
        continue;
      }
      for (Consumer<DomainEvent> target : targets) {
        try {
          executor.execute(() -> deliver(event, target));
        } catch (RejectedExecutionException e) {
          log.warn(
              "Delivery rejected: event={} aggregateId={}",
              event.eventType(),
              event.aggregateId(),
              e);
        }
      }
    }
  }

  private void deliver(DomainEvent event, Consumer<DomainEvent> target) {
    try {
      target.accept(event);
    } catch (CancellationException e) {
      log.info("Delivery cancelled: event={} aggregateId={}", event.eventType(), event.aggregateId());
      throw e;
    } catch (RuntimeException e) {
      log.error(
          "Subscriber failed: event={} aggregateId={} correlationId={}",
          event.eventType(),
          event.aggregateId(),
          event.metadata().correlationId(),
          e);
    }
  }

  /** Stops accepting events and interrupts deliveries that are still running. */
  @Override
  public void close() {
    closed = true;
    if (executor instanceof ExecutorService) {
      ExecutorService service = (ExecutorService) executor;
      service.shutdownNow();
      try {
        if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Event dispatcher did not terminate within 5s");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for event dispatcher shutdown");
      }
    }
    log.info("Event dispatcher closed");
  }
}
