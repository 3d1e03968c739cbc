package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * System command moving an approved request to PROVISIONING.
 */
public record MarkVmRequestProvisioningCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID requestId
) implements TenantCommand {

    public MarkVmRequestProvisioningCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(requestId, "Request ID");
    }
}
