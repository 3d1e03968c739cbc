package com.acme.dcm.application.vmrequest;

import com.acme.dcm.domain.model.vmrequest.VmRequestStatus;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.projection.ProjectionError;

import java.time.Instant;
import java.util.UUID;

/**
 * Write port for the VM request read model.
 */
public interface VmRequestProjectionUpdater {

    Result<Void, ProjectionError> insert(VmRequestProjection request);

    /**
     * @param reason rejection, cancellation or failure reason; null for other transitions
     */
    Result<Void, ProjectionError> updateStatus(UUID requestId, VmRequestStatus status, String reason, Instant updatedAt, long version);

    Result<Void, ProjectionError> markReady(UUID requestId, String vmwareVmId, String ipAddress, String hostname, Instant updatedAt, long version);
}
