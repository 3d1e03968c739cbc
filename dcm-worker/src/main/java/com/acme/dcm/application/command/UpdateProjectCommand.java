package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command to rename a project or change its description.
 */
public record UpdateProjectCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID projectId,
    String name,
    String description,
    Long expectedVersion
) implements TenantCommand {

    public UpdateProjectCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(projectId, "Project ID");
    }
}
