package com.acme.dcm.application.command;

import com.acme.dcm.domain.model.vmrequest.VmSize;
import com.acme.sourcing.command.TenantCommand;

import java.util.UUID;

/**
 * Command to request a VM for a project. The issuing user is the requester.
 */
public record CreateVmRequestCommand(
    UUID tenantId,
    UUID userId,
    UUID correlationId,
    UUID projectId,
    String vmName,
    VmSize size,
    String justification,
    String requesterEmail
) implements TenantCommand {

    public CreateVmRequestCommand {
        CommandPreconditions.requireContext(tenantId, userId, correlationId);
        CommandPreconditions.requireId(projectId, "Project ID");
    }
}
