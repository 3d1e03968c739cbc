package com.acme.dcm.infrastructure.persistence;

import com.acme.dcm.application.vm.VmProvisioningProgress;
import com.acme.dcm.application.vm.VmProvisioningProgressRepository;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.projection.ProjectionError;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryVmProvisioningProgressRepository implements VmProvisioningProgressRepository {

    private final Map<UUID, VmProvisioningProgress> progress = new ConcurrentHashMap<>();

    @Override
    public Result<Void, ProjectionError> save(VmProvisioningProgress row) {
        progress.put(row.vmId(), row);
        return Result.success(null);
    }

    @Override
    public Result<Void, ProjectionError> delete(UUID vmId) {
        progress.remove(vmId);
        return Result.success(null);
    }

    @Override
    public Optional<VmProvisioningProgress> findByVmId(UUID vmId) {
        return Optional.ofNullable(progress.get(vmId));
    }
}
