package com.acme.dcm.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;

/**
 * Timeouts for one hypervisor call. The overall budget must cover the inner phases plus a margin,
 * otherwise an expiring phase would be reported as an unclassified overall timeout.
 */
@ConfigurationProperties("provisioning.timeouts")
public class ProvisioningTimeouts {

    private Duration cloneTimeout = Duration.ofMinutes(5);
    private Duration networkTimeout = Duration.ofMinutes(2);
    private Duration margin = Duration.ofSeconds(30);
    private Duration overallTimeout = Duration.ofMinutes(10);

    public Duration getCloneTimeout() {
        return cloneTimeout;
    }

    public void setCloneTimeout(Duration cloneTimeout) {
        this.cloneTimeout = cloneTimeout;
    }

    public Duration getNetworkTimeout() {
        return networkTimeout;
    }

    public void setNetworkTimeout(Duration networkTimeout) {
        this.networkTimeout = networkTimeout;
    }

    public Duration getMargin() {
        return margin;
    }

    public void setMargin(Duration margin) {
        this.margin = margin;
    }

    public Duration getOverallTimeout() {
        return overallTimeout;
    }

    public void setOverallTimeout(Duration overallTimeout) {
        this.overallTimeout = overallTimeout;
    }

    /**
     * @throws IllegalStateException if the overall timeout is shorter than clone + network + margin
     */
    public void validate() {
        Duration required = cloneTimeout.plus(networkTimeout).plus(margin);
        if (overallTimeout.compareTo(required) < 0) {
            throw new IllegalStateException(
                "provisioning.timeouts.overall-timeout (" + overallTimeout + ") must be at least clone-timeout + "
                    + "network-timeout + margin (" + required + ")"
            );
        }
    }
}
