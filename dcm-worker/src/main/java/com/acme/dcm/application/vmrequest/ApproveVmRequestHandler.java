package com.acme.dcm.application.vmrequest;

import com.acme.dcm.application.command.ApproveVmRequestCommand;
import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vmrequest.VmRequestAggregate.SelfApprovalException;
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
 * Approves a pending request. The requester cannot approve their own request.
 */
@Singleton
public class ApproveVmRequestHandler extends VmRequestCommandHandler<ApproveVmRequestCommand, UUID> {

    public ApproveVmRequestHandler(
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
    protected UUID aggregateId(ApproveVmRequestCommand command) {
        return command.requestId();
    }

    @Override
    protected Long expectedVersion(ApproveVmRequestCommand command) {
        return command.expectedVersion();
    }

    @Override
    protected Result<UUID, VmRequestCommandError> execute(VmRequestAggregate request, ApproveVmRequestCommand command) {
        try {
            request.approve(command.userId(), command.metadata());
        } catch (SelfApprovalException e) {
            return Result.failure(new VmRequestCommandError.Forbidden(e.getMessage()));
        } catch (InvalidStateException e) {
            return Result.failure(invalidState(e));
        }
        return Result.success(request.getId());
    }

    @Override
    protected void project(VmRequestAggregate request, ApproveVmRequestCommand command, List<VmRequestEvent> committed) {
        projectStatus(request, null, committed);
        recordTimeline(request, TimelineEventType.APPROVED, command.userId(), null, committed);
        notifyRequester(new VmRequestNotification.RequestApproved(
            request.getId(), request.getTenantId(), request.getRequesterEmail(),
            request.getVmName().value(), request.getProjectId()
        ), command.correlationId());
    }
}
