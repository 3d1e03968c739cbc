package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command to remove a member. The project creator cannot be removed.
 */
public record RemoveUserFromProjectCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID projectId,
    UUID targetUserId,
    Long expectedVersion
) implements TenantCommand {

    public RemoveUserFromProjectCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(projectId, "Project ID");
        CommandPreconditions.requireId(targetUserId, "Target user ID");
    }
}
