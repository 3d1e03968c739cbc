package com.acme.dcm.application.vm;

import com.acme.sourcing.core.Result;
import com.acme.sourcing.projection.ProjectionError;

import java.util.Optional;
import java.util.UUID;

public interface VmProvisioningProgressRepository {

    Result<Void, ProjectionError> save(VmProvisioningProgress progress);

    /** Called once provisioning has finished, successfully or not. */
    Result<Void, ProjectionError> delete(UUID vmId);

    Optional<VmProvisioningProgress> findByVmId(UUID vmId);
}
