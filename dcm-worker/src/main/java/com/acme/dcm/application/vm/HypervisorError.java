package com.acme.dcm.application.vm;

import java.util.Locale;

/**
 * Classified failure of a hypervisor call. Transient errors may succeed on a later attempt;
 * permanent ones need a person to change configuration or the request.
 */
public sealed interface HypervisorError {

    String message();

    boolean isRetriable();

    ProvisioningErrorCode errorCode();

    default String userMessage() {
        return errorCode().getUserMessage();
    }

    /** Network-level failure talking to the hypervisor. Transient. */
    record ConnectionError(String message, Throwable cause) implements HypervisorError {
        public ConnectionError(String message) {
            this(message, null);
        }

        @Override
        public boolean isRetriable() {
            return true;
        }

        @Override
        public ProvisioningErrorCode errorCode() {
            return ProvisioningErrorCode.CONNECTION_TIMEOUT;
        }
    }

    /** Credentials or session rejected. Permanent. */
    record AuthenticationError(String message, Throwable cause) implements HypervisorError {
        public AuthenticationError(String message) {
            this(message, null);
        }

        @Override
        public boolean isRetriable() {
            return false;
        }

        @Override
        public ProvisioningErrorCode errorCode() {
            return ProvisioningErrorCode.CONNECTION_FAILED;
        }
    }

    /** Unclassified API failure. Transient. */
    record ApiError(String message, Throwable cause) implements HypervisorError {
        public ApiError(String message) {
            this(message, null);
        }

        @Override
        public boolean isRetriable() {
            return true;
        }

        @Override
        public ProvisioningErrorCode errorCode() {
            return ProvisioningErrorCode.UNKNOWN;
        }
    }

    /** A template, datastore or other named resource does not exist. Permanent. */
    record ResourceNotFound(String resourceType, String resourceId) implements HypervisorError {
        @Override
        public String message() {
            return resourceType + " not found: " + resourceId;
        }

        @Override
        public boolean isRetriable() {
            return false;
        }

        @Override
        public ProvisioningErrorCode errorCode() {
            switch (resourceType.toLowerCase(Locale.ROOT)) {
                case "template":
                    return ProvisioningErrorCode.TEMPLATE_NOT_FOUND;
                case "datastore":
                    return ProvisioningErrorCode.DATASTORE_NOT_AVAILABLE;
                default:
                    return ProvisioningErrorCode.UNKNOWN;
            }
        }
    }

    /** An operation phase did not finish in time. Transient. */
    record Timeout(String message) implements HypervisorError {
        @Override
        public boolean isRetriable() {
            return true;
        }

        @Override
        public ProvisioningErrorCode errorCode() {
            return ProvisioningErrorCode.VMWARE_TOOLS_TIMEOUT;
        }
    }

    /** Cluster capacity reached. Transient, capacity may free up. */
    record ResourceExhausted(String message, String resourceType, int requested, int available) implements HypervisorError {
        @Override
        public boolean isRetriable() {
            return true;
        }

        @Override
        public ProvisioningErrorCode errorCode() {
            return ProvisioningErrorCode.INSUFFICIENT_RESOURCES;
        }
    }

    /** The VM specification is not acceptable. Permanent. */
    record InvalidConfiguration(String message, String field) implements HypervisorError {
        @Override
        public boolean isRetriable() {
            return false;
        }

        @Override
        public ProvisioningErrorCode errorCode() {
            return ProvisioningErrorCode.VM_CONFIG_INVALID;
        }
    }

    /** A provisioning step failed, e.g. "network config". Transient. */
    record OperationFailed(String operation, String details) implements HypervisorError {
        @Override
        public String message() {
            return operation + " failed: " + details;
        }

        @Override
        public boolean isRetriable() {
            return true;
        }

        @Override
        public ProvisioningErrorCode errorCode() {
            return operation.toLowerCase(Locale.ROOT).contains("network")
                ? ProvisioningErrorCode.NETWORK_CONFIG_FAILED
                : ProvisioningErrorCode.UNKNOWN;
        }
    }
}
