package com.acme.dcm.infrastructure.persistence;

import com.acme.dcm.application.vmrequest.VmRequestProjection;
import com.acme.dcm.application.vmrequest.VmRequestProjectionUpdater;
import com.acme.dcm.domain.model.vmrequest.VmRequestStatus;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.projection.ProjectionError;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory VM request read model.
 */
public class InMemoryVmRequestProjectionRepository implements VmRequestProjectionUpdater {

    private final Map<UUID, VmRequestProjection> requests = new ConcurrentHashMap<>();

    @Override
    public Result<Void, ProjectionError> insert(VmRequestProjection request) {
        if (requests.putIfAbsent(request.id(), request) != null) {
            return Result.failure(new ProjectionError.DatabaseError("VM request already projected: " + request.id()));
        }
        return Result.success(null);
    }

    @Override
    public Result<Void, ProjectionError> updateStatus(UUID requestId, VmRequestStatus status, String reason, Instant updatedAt, long version) {
        VmRequestProjection updated = requests.computeIfPresent(requestId, (id, r) -> r.withStatus(status, reason, updatedAt, version));
        return updated == null ? notFound(requestId) : Result.success(null);
    }

    @Override
    public Result<Void, ProjectionError> markReady(UUID requestId, String vmwareVmId, String ipAddress, String hostname, Instant updatedAt, long version) {
        VmRequestProjection updated = requests.computeIfPresent(requestId,
            (id, r) -> r.withVmDetails(vmwareVmId, ipAddress, hostname, updatedAt, version));
        return updated == null ? notFound(requestId) : Result.success(null);
    }

    public Optional<VmRequestProjection> findById(UUID requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    private static Result<Void, ProjectionError> notFound(UUID requestId) {
        return Result.failure(new ProjectionError.NotFound("VM request not found: " + requestId));
    }
}
