package com.acme.dcm.application.vm;

import com.acme.dcm.domain.model.vm.VmProvisioningStage;
import com.acme.sourcing.core.Result;

import java.util.function.Consumer;

/**
 * Outbound port to the virtualization platform.
 */
public interface HypervisorPort {

    /**
     * Clone, configure and power on a VM, reporting stages as they are reached. Classified failures
     * come back as {@link Result} failures; anything thrown is unexpected.
     *
     * @throws java.util.concurrent.CancellationException if the calling task is cancelled
     */
    Result<VmProvisioningResult, HypervisorError> createVm(VmSpec spec, Consumer<VmProvisioningStage> onProgress);
}
