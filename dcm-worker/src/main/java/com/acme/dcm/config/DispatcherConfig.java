package com.acme.dcm.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Thread pool for delivering committed events to in-process subscribers.
 */
@ConfigurationProperties("events.dispatcher")
public class DispatcherConfig {

    private int threads = 4;

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("events.dispatcher.threads must be at least 1");
        }
        this.threads = threads;
    }
}
