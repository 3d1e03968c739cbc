package com.acme.dcm.application.vm;

import com.acme.dcm.application.command.MarkVmProvisionedCommand;
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
 * Records the hypervisor's successful result and clears the progress row.
 */
@Singleton
public class MarkVmProvisionedHandler extends VmCommandHandler<MarkVmProvisionedCommand> {

    public MarkVmProvisionedHandler(
        EventLog eventLog,
        EventDeserializer<VmEvent> deserializer,
        EventPublisher eventPublisher,
        VmProvisioningProgressRepository progressRepository
    ) {
        super(eventLog, deserializer, eventPublisher, progressRepository);
    }

    @Override
    protected UUID aggregateId(MarkVmProvisionedCommand command) {
        return command.vmId();
    }

    @Override
    protected Result<UUID, VmCommandError> execute(VmAggregate vm, MarkVmProvisionedCommand command) {
        try {
            vm.markProvisioned(command.vmwareVmId(), command.ipAddress(), command.hostname(), command.warningMessage(), command.metadata());
        } catch (InvalidStateException e) {
            return Result.failure(invalidState(e));
        }
        return Result.success(vm.getId());
    }

    @Override
    protected void project(VmAggregate vm, MarkVmProvisionedCommand command, List<VmEvent> committed) {
        updateProjection("deleteProgress", vm.getId(), () -> progressRepository.delete(vm.getId()));
    }
}
