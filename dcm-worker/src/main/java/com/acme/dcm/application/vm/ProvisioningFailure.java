package com.acme.dcm.application.vm;

/**
 * Why {@link ResilientProvisioningService#createVmWithRetry} gave up.
 */
public sealed interface ProvisioningFailure {

    ProvisioningErrorCode errorCode();

    String userMessage();

    String message();

    /** Permanent hypervisor error, returned without retry. */
    record HypervisorFailure(HypervisorError error) implements ProvisioningFailure {
        @Override
        public ProvisioningErrorCode errorCode() {
            return error.errorCode();
        }

        @Override
        public String userMessage() {
            return error.userMessage();
        }

        @Override
        public String message() {
            return error.message();
        }
    }

    /** Transient errors until the attempt budget ran out. */
    record Exhausted(RetryExhaustedError error) implements ProvisioningFailure {
        @Override
        public ProvisioningErrorCode errorCode() {
            return error.lastErrorCode();
        }

        @Override
        public String userMessage() {
            return error.userMessage();
        }

        @Override
        public String message() {
            return "Provisioning failed after " + error.attemptCount() + " attempts: " + error.lastError().message();
        }
    }
}
