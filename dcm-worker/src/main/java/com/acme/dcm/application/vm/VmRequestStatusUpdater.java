package com.acme.dcm.application.vm;

import com.acme.dcm.application.command.MarkVmRequestProvisioningCommand;
import com.acme.dcm.domain.model.vm.VmEvent.VmProvisioningStarted;
import com.acme.dcm.domain.model.vmrequest.VmRequestAggregate;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent;
import com.acme.dcm.domain.model.vmrequest.VmRequestStatus;
import com.acme.sourcing.command.CommandHandlerRegistry;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.StoredEvent;
import com.acme.sourcing.process.BaseProcessManager;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Moves the request to PROVISIONING once its VM aggregate exists.
 */
@Singleton
@RequiredArgsConstructor
public class VmRequestStatusUpdater
    extends BaseProcessManager<VmProvisioningStarted, VmRequestAggregate, MarkVmRequestProvisioningCommand> {

    private final EventLog eventLog;
    private final CommandHandlerRegistry commandHandlers;
    private final EventDeserializer<VmRequestEvent> deserializer;

    @Override
    protected EventLog getEventLog() {
        return eventLog;
    }

    @Override
    protected CommandHandlerRegistry getCommandHandlers() {
        return commandHandlers;
    }

    @Override
    protected String getProcessName() {
        return "VmRequestStatus";
    }

    @Override
    protected UUID sourceId(VmProvisioningStarted trigger) {
        return trigger.requestId();
    }

    @Override
    protected VmRequestAggregate reconstitute(UUID aggregateId, List<StoredEvent> history) {
        return VmRequestAggregate.reconstitute(
            aggregateId,
            history.stream().map(deserializer::deserialize).collect(Collectors.toList())
        );
    }

    @Override
    protected boolean isStillApplicable(VmRequestAggregate request) {
        return request.getStatus() == VmRequestStatus.APPROVED;
    }

    @Override
    protected MarkVmRequestProvisioningCommand buildCommand(VmProvisioningStarted trigger, VmRequestAggregate request) {
        return new MarkVmRequestProvisioningCommand(
            request.getTenantId(),
            trigger.metadata().userId(),
            trigger.metadata().correlationId(),
            request.getId()
        );
    }

    @Override
    protected UUID targetId(MarkVmRequestProvisioningCommand command) {
        return command.requestId();
    }
}
