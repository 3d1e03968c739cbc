package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * System command recording that provisioning gave up.
 */
public record MarkVmRequestFailedCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID requestId,
    String reason,
    String errorCode
) implements TenantCommand {

    public MarkVmRequestFailedCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(requestId, "Request ID");
    }
}
