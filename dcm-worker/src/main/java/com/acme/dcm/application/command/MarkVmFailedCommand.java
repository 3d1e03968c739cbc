package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * System command recording a provisioning failure.
 */
public record MarkVmFailedCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID vmId,
    String reason,
    String errorCode
) implements TenantCommand {

    public MarkVmFailedCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(vmId, "VM ID");
    }
}
