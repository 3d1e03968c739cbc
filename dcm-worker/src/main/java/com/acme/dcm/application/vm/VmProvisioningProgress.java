package com.acme.dcm.application.vm;

import com.acme.dcm.domain.model.vm.VmProvisioningStage;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-model row with the latest provisioning stage of a VM still being built.
 */
public record VmProvisioningProgress(UUID vmId, UUID requestId, UUID tenantId, VmProvisioningStage stage, String details, Instant updatedAt) {}
