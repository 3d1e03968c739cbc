package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command issued by the requester to withdraw a pending request.
 */
public record CancelVmRequestCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID requestId,
    String reason,
    Long expectedVersion
) implements TenantCommand {

    public CancelVmRequestCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(requestId, "Request ID");
    }
}
