package com.acme.dcm.application.vmrequest;

/**
 * Entries shown on a request's history.
 */
public enum TimelineEventType {
    CREATED,
    APPROVED,
    REJECTED,
    CANCELLED,
    PROVISIONING_STARTED,
    PROVISIONING_FAILED,
    VM_READY
}
