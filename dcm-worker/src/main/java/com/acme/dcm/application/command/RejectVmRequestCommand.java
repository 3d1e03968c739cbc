package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command issued by an admin to reject a pending request with a reason.
 */
public record RejectVmRequestCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID requestId,
    String reason,
    Long expectedVersion
) implements TenantCommand {

    public RejectVmRequestCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(requestId, "Request ID");
    }
}
