package com.acme.dcm.application.vm;

import com.acme.dcm.application.command.ProvisionVmCommand;
import com.acme.dcm.domain.model.vm.VmAggregate;
import com.acme.dcm.domain.model.vmrequest.VmRequestAggregate;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestApproved;
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
 * Starts provisioning when a request is approved: reloads the request for the fields the approval
 * event does not carry and dispatches {@link ProvisionVmCommand} while the request is still APPROVED.
 */
@Singleton
@RequiredArgsConstructor
public class VmProvisioningProcessManager
    extends BaseProcessManager<VmRequestApproved, VmRequestAggregate, ProvisionVmCommand> {

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
        return "VmProvisioning";
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
    protected ProvisionVmCommand buildCommand(VmRequestApproved trigger, VmRequestAggregate request) {
        return new ProvisionVmCommand(
            request.getTenantId(),
            trigger.metadata().userId(),
            trigger.metadata().correlationId(),
            request.getId(),
            request.getProjectId(),
            request.getVmName().value(),
            request.getSize(),
            request.getRequesterId()
        );
    }

    @Override
    protected UUID targetId(ProvisionVmCommand command) {
        return VmAggregate.idForRequest(command.requestId());
    }
}
