package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * System command recording that the requested VM is up.
 */
public record MarkVmRequestReadyCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID requestId,
    String vmwareVmId,
    String ipAddress,
    String hostname
) implements TenantCommand {

    public MarkVmRequestReadyCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(requestId, "Request ID");
    }
}
