package com.acme.dcm.config;

import com.acme.sourcing.config.RetryConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final RetryConfig retryConfig;
    private final ProvisioningTimeouts timeouts;
    private final DispatcherConfig dispatcherConfig;

    public ConfigurationLogger(RetryConfig retryConfig, ProvisioningTimeouts timeouts, DispatcherConfig dispatcherConfig) {
        this.retryConfig = retryConfig;
        this.timeouts = timeouts;
        this.dispatcherConfig = dispatcherConfig;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("DCM worker configuration:");
        LOG.info("  retry: maxAttempts={} initialBackoff={} multiplier={} maxBackoff={}",
            retryConfig.getMaxAttempts(), retryConfig.getInitialBackoff(),
            retryConfig.getMultiplier(), retryConfig.getMaxBackoff());
        LOG.info("  provisioning.timeouts: clone={} network={} margin={} overall={}",
            timeouts.getCloneTimeout(), timeouts.getNetworkTimeout(),
            timeouts.getMargin(), timeouts.getOverallTimeout());
        LOG.info("  events.dispatcher: threads={}", dispatcherConfig.getThreads());
    }
}
