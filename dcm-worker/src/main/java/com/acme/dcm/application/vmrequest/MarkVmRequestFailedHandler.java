package com.acme.dcm.application.vmrequest;

import com.acme.dcm.application.command.MarkVmRequestFailedCommand;
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
 * Records that provisioning of the requested VM failed for good.
 */
@Singleton
public class MarkVmRequestFailedHandler extends VmRequestCommandHandler<MarkVmRequestFailedCommand, UUID> {

    public MarkVmRequestFailedHandler(
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
    protected UUID aggregateId(MarkVmRequestFailedCommand command) {
        return command.requestId();
    }

    @Override
    protected Result<UUID, VmRequestCommandError> execute(VmRequestAggregate request, MarkVmRequestFailedCommand command) {
        try {
            request.markFailed(command.reason(), command.errorCode(), command.metadata());
        } catch (InvalidStateException e) {
            return Result.failure(invalidState(e));
        }
        return Result.success(request.getId());
    }

    @Override
    protected void project(VmRequestAggregate request, MarkVmRequestFailedCommand command, List<VmRequestEvent> committed) {
        projectStatus(request, request.getFailureReason(), committed);
        recordTimeline(request, TimelineEventType.PROVISIONING_FAILED, null, request.getFailureReason(), committed);
        notifyRequester(new VmRequestNotification.ProvisioningFailed(
            request.getId(), request.getTenantId(), request.getRequesterEmail(),
            request.getVmName().value(), request.getProjectId(), request.getFailureReason()
        ), command.correlationId());
    }
}
