package com.acme.dcm.application.command;

import com.acme.dcm.domain.model.project.ProjectRole;
import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command to add a member or change an existing member's role.
 */
public record AssignUserToProjectCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID projectId,
    UUID targetUserId,
    ProjectRole role,
    Long expectedVersion
) implements TenantCommand {

    public AssignUserToProjectCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(projectId, "Project ID");
        CommandPreconditions.requireId(targetUserId, "Target user ID");
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
    }
}
