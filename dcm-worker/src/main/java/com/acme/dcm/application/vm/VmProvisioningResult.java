package com.acme.dcm.application.vm;

/**
 * @param warningMessage set when the VM is up but something non-fatal went wrong, e.g. no IP yet
 */
public record VmProvisioningResult(String vmwareVmId, String ipAddress, String hostname, String warningMessage) {}
