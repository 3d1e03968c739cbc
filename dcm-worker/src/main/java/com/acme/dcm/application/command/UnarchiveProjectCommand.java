package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command to reactivate an archived project. Unarchiving an active project is a no-op.
 */
public record UnarchiveProjectCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID projectId,
    Long expectedVersion
) implements TenantCommand {

    public UnarchiveProjectCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(projectId, "Project ID");
    }
}
