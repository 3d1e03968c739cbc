package com.acme.dcm.application.vm;

/**
 * Every allowed attempt failed with a transient error.
 */
public record RetryExhaustedError(
    int attemptCount,
    ProvisioningErrorCode lastErrorCode,
    String userMessage,
    HypervisorError lastError
) {}
