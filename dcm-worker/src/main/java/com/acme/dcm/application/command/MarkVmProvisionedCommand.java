package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * System command recording the hypervisor's successful result.
 */
public record MarkVmProvisionedCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID vmId,
    String vmwareVmId,
    String ipAddress,
    String hostname,
    String warningMessage
) implements TenantCommand {

    public MarkVmProvisionedCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(vmId, "VM ID");
    }
}
