package com.acme.dcm.domain.model.vm;

public enum VmStatus {
    PROVISIONING,
    READY,
    FAILED
}
