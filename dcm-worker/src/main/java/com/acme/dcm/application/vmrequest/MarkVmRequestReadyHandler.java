package com.acme.dcm.application.vmrequest;

import com.acme.dcm.application.command.MarkVmRequestReadyCommand;
import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vmrequest.VmRequestAggregate;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.UUID;

/**
 * Records that the requested VM is up and reachable.
 */
@Singleton
public class MarkVmRequestReadyHandler extends VmRequestCommandHandler<MarkVmRequestReadyCommand, UUID> {

    public MarkVmRequestReadyHandler(
        EventLog eventLog,
        EventDeserializer<VmRequestEvent> deserializer,
        EventPublisher eventPublisher,
        VmRequestProjectionUpdater projectionUpdater,
        TimelineEventProjectionUpdater timelineUpdater,
        VmRequestNotificationSender notificationSender
    ) {
        super(eventLog, deserializer, eventPublisher, projectionUpdater, timelineUpdater, notificationSender);
    }

    @Override
    protected UUID aggregateId(MarkVmRequestReadyCommand command) {
        return command.requestId();
    }

    @Override
    protected Result<UUID, VmRequestCommandError> execute(VmRequestAggregate request, MarkVmRequestReadyCommand command) {
        try {
            request.markReady(command.vmwareVmId(), command.ipAddress(), command.hostname(), command.metadata());
        } catch (InvalidStateException e) {
            return Result.failure(invalidState(e));
        }
        return Result.success(request.getId());
    }

    @Override
    protected void project(VmRequestAggregate request, MarkVmRequestReadyCommand command, List<VmRequestEvent> committed) {
        updateProjection("markReady", request.getId(), () -> projectionUpdater.markReady(
            request.getId(),
            request.getVmwareVmId(),
            request.getIpAddress(),
            request.getHostname(),
            committed.get(0).metadata().timestamp(),
            request.getVersion()
        ));
        recordTimeline(request, TimelineEventType.VM_READY, null, null, committed);
        notifyRequester(new VmRequestNotification.VmReady(
            request.getId(), request.getTenantId(), request.getRequesterEmail(),
            request.getVmName().value(), request.getProjectId(), request.getIpAddress(), request.getHostname()
        ), command.correlationId());
    }
}
