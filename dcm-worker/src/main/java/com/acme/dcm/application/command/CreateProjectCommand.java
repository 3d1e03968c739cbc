package com.acme.dcm.application.command;

import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command to create a project. The issuing user becomes its PROJECT_ADMIN.
 */
public record CreateProjectCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    String name,
    String description
) implements TenantCommand {

    public CreateProjectCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
    }
}
