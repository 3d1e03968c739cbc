package com.acme.dcm.config;

import com.acme.sourcing.config.RetryConfig;
import com.acme.sourcing.event.AsyncEventDispatcher;
import com.acme.sourcing.persistence.memory.InMemoryEventLog;
import com.acme.sourcing.resilience.Sleeper;
import com.acme.sourcing.store.EventLog;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the framework-agnostic sourcing-core beans.
 *
 * <p>The core module stays free of framework dependencies; this factory does the DI wiring and
 * binds its configuration from application.yml.
 */
@Factory
public class CoreBeansFactory {

    /** Creates RetryConfig bean populated from application.yml retry.* properties */
    @Singleton
    public RetryConfig retryConfig(
        @Value("${retry.max-attempts:5}") int maxAttempts,
        @Value("${retry.initial-backoff:10s}") Duration initialBackoff,
        @Value("${retry.multiplier:2.0}") double multiplier,
        @Value("${retry.max-backoff:120s}") Duration maxBackoff
    ) {
        RetryConfig config = new RetryConfig();
        config.setMaxAttempts(maxAttempts);
        config.setInitialBackoff(initialBackoff);
        config.setMultiplier(multiplier);
        config.setMaxBackoff(maxBackoff);
        return config;
    }

    @Singleton
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Singleton
    public EventLog eventLog() {
        return new InMemoryEventLog();
    }

    /** Dispatcher for committed events; closing it interrupts deliveries still in flight */
    @Singleton
    @Bean(preDestroy = "close")
    public AsyncEventDispatcher eventDispatcher(DispatcherConfig config) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "event-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ExecutorService executor = Executors.newFixedThreadPool(config.getThreads(), threads);
        return new AsyncEventDispatcher(executor);
    }
}
