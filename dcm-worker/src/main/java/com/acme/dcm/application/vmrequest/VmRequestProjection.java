package com.acme.dcm.application.vmrequest;

import com.acme.dcm.domain.model.vmrequest.VmRequestStatus;
import com.acme.dcm.domain.model.vmrequest.VmSize;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-model row for a VM request.
 */
public record VmRequestProjection(
    UUID id,
    UUID tenantId,
    UUID projectId,
    UUID requesterId,
    String requesterEmail,
    String vmName,
    VmSize size,
    String justification,
    VmRequestStatus status,
    String statusReason,
    String vmwareVmId,
    String ipAddress,
    String hostname,
    Instant createdAt,
    Instant updatedAt,
    long version
) {
    public VmRequestProjection withStatus(VmRequestStatus newStatus, String reason, Instant at, long newVersion) {
        return new VmRequestProjection(
            id, tenantId, projectId, requesterId, requesterEmail, vmName, size, justification,
            newStatus, reason, vmwareVmId, ipAddress, hostname, createdAt, at, newVersion
        );
    }

    public VmRequestProjection withVmDetails(String newVmwareVmId, String newIpAddress, String newHostname, Instant at, long newVersion) {
        return new VmRequestProjection(
            id, tenantId, projectId, requesterId, requesterEmail, vmName, size, justification,
            VmRequestStatus.READY, statusReason, newVmwareVmId, newIpAddress, newHostname, createdAt, at, newVersion
        );
    }
}
