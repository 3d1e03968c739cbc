package com.acme.dcm.application.vm;

import com.acme.dcm.application.command.MarkVmFailedCommand;
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
 * Records a provisioning failure and clears the progress row.
 */
@Singleton
public class MarkVmFailedHandler extends VmCommandHandler<MarkVmFailedCommand> {

    public MarkVmFailedHandler(
        EventLog eventLog,
        EventDeserializer<VmEvent> deserializer,
        EventPublisher eventPublisher,
        VmProvisioningProgressRepository progressRepository
    ) {
        super(eventLog, deserializer, eventPublisher, progressRepository);
    }

    @Override
    protected UUID aggregateId(MarkVmFailedCommand command) {
        return command.vmId();
    }

    @Override
    protected Result<UUID, VmCommandError> execute(VmAggregate vm, MarkVmFailedCommand command) {
        try {
            vm.markFailed(command.reason(), command.errorCode(), command.metadata());
        } catch (InvalidStateException e) {
            return Result.failure(invalidState(e));
        }
        return Result.success(vm.getId());
    }

    @Override
    protected void project(VmAggregate vm, MarkVmFailedCommand command, List<VmEvent> committed) {
        updateProjection("deleteProgress", vm.getId(), () -> progressRepository.delete(vm.getId()));
    }
}
