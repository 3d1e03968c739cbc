package com.acme.dcm.domain.model.vmrequest;

public enum VmRequestStatus {
    PENDING,
    APPROVED,
    REJECTED,
    CANCELLED,
    PROVISIONING,
    READY,
    FAILED
}
