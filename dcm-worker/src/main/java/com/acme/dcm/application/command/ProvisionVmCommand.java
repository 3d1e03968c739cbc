package com.acme.dcm.application.command;

import com.acme.dcm.domain.model.vmrequest.VmSize;
import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * System command creating the VM aggregate for an approved request.
 */
public record ProvisionVmCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID requestId,
    UUID projectId,
    String vmName,
    VmSize size,
    UUID requesterId
) implements TenantCommand {

    public ProvisionVmCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(requestId, "Request ID");
        CommandPreconditions.requireId(projectId, "Project ID");
    }
}
