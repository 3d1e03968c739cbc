package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command to archive a project. Archiving an archived project is a no-op.
 */
public record ArchiveProjectCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID projectId,
    Long expectedVersion
) implements TenantCommand {

    public ArchiveProjectCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(projectId, "Project ID");
    }
}
