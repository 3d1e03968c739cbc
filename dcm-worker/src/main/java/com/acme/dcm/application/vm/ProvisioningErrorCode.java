package com.acme.dcm.application.vm;

/**
 * Error codes shown to requesters when provisioning fails, each with a message safe to display.
 */
public enum ProvisioningErrorCode {
    INSUFFICIENT_RESOURCES("Cluster capacity reached. Please try a smaller size or contact support."),
    DATASTORE_NOT_AVAILABLE("Storage unavailable. Please contact support."),
    VM_CONFIG_INVALID("Invalid configuration. Please check your request parameters."),
    CONNECTION_FAILED("System authentication failed. IT has been notified."),
    TEMPLATE_NOT_FOUND("VM template missing. IT has been notified."),
    NETWORK_CONFIG_FAILED("Network setup failed. IT has been notified."),
    VMWARE_TOOLS_TIMEOUT("VM started but tools didn't respond. Please restart the VM."),
    CONNECTION_TIMEOUT("Temporary connection issue. We will retry automatically."),
    UNKNOWN("Unexpected error. IT has been notified.");

    private final String userMessage;

    ProvisioningErrorCode(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
