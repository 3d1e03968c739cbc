package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command issued by an admin to approve a pending request.
 */
public record ApproveVmRequestCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID requestId,
    Long expectedVersion
) implements TenantCommand {

    public ApproveVmRequestCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(requestId, "Request ID");
    }
}
