package com.acme.dcm.application.vm;

import com.acme.dcm.application.command.UpdateVmProgressCommand;
import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vm.VmAggregate;
import com.acme.dcm.domain.model.vm.VmEvent;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.UUID;

/**
 * Records a provisioning stage reported by the hypervisor.
 */
@Singleton
public class UpdateVmProgressHandler extends VmCommandHandler<UpdateVmProgressCommand> {

    public UpdateVmProgressHandler(
        EventLog eventLog,
        EventDeserializer<VmEvent> deserializer,
        EventPublisher eventPublisher,
        VmProvisioningProgressRepository progressRepository
    ) {
        super(eventLog, deserializer, eventPublisher, progressRepository);
    }

    @Override
    protected UUID aggregateId(UpdateVmProgressCommand command) {
        return command.vmId();
    }

    @Override
    protected Result<UUID, VmCommandError> execute(VmAggregate vm, UpdateVmProgressCommand command) {
        try {
            vm.updateProgress(command.stage(), command.metadata());
        } catch (InvalidStateException e) {
            return Result.failure(invalidState(e));
        }
        return Result.success(vm.getId());
    }

    @Override
    protected void project(VmAggregate vm, UpdateVmProgressCommand command, List<VmEvent> committed) {
        VmEvent.VmProvisioningProgressUpdated updated = (VmEvent.VmProvisioningProgressUpdated) committed.get(0);
        updateProjection("saveProgress", vm.getId(), () -> progressRepository.save(new VmProvisioningProgress(
            vm.getId(), vm.getRequestId(), vm.getTenantId(), updated.stage(), updated.details(), updated.metadata().timestamp()
        )));
    }
}
