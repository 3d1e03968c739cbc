package com.acme.dcm.domain.model.vm;

/**
 * Stages reported by the hypervisor while a VM is being built, in order.
 */
public enum VmProvisioningStage {
    CREATED,
    CLONING,
    CONFIGURING,
    POWERING_ON,
    WAITING_FOR_NETWORK,
    READY
}
