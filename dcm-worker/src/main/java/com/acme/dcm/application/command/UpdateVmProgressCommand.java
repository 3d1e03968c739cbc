package com.acme.dcm.application.command;

import com.acme.dcm.domain.model.vm.VmProvisioningStage;
import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * System command recording a provisioning stage reported by the hypervisor.
 */
public record UpdateVmProgressCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID vmId,
    VmProvisioningStage stage
) implements TenantCommand {

    public UpdateVmProgressCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(vmId, "VM ID");
    }
}
