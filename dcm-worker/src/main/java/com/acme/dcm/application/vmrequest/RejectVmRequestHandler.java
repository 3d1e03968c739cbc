package com.acme.dcm.application.vmrequest;

import com.acme.dcm.application.command.RejectVmRequestCommand;
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
 * Rejects a pending request with a reason. The requester cannot reject their own request.
 */
@Singleton
public class RejectVmRequestHandler extends VmRequestCommandHandler<RejectVmRequestCommand, UUID> {

    public RejectVmRequestHandler(
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
    protected UUID aggregateId(RejectVmRequestCommand command) {
        return command.requestId();
    }

    @Override
    protected Long expectedVersion(RejectVmRequestCommand command) {
        return command.expectedVersion();
    }

    @Override
    protected Result<UUID, VmRequestCommandError> execute(VmRequestAggregate request, RejectVmRequestCommand command) {
        try {
            request.reject(command.userId(), command.reason(), command.metadata());
        } catch (SelfApprovalException e) {
            return Result.failure(new VmRequestCommandError.Forbidden(e.getMessage()));
        } catch (InvalidStateException e) {
            return Result.failure(invalidState(e));
        } catch (IllegalArgumentException e) {
            return Result.failure(new VmRequestCommandError.ValidationFailed(e.getMessage()));
        }
        return Result.success(request.getId());
    }

    @Override
    protected void project(VmRequestAggregate request, RejectVmRequestCommand command, List<VmRequestEvent> committed) {
        projectStatus(request, request.getRejectionReason(), committed);
        recordTimeline(request, TimelineEventType.REJECTED, command.userId(), request.getRejectionReason(), committed);
        notifyRequester(new VmRequestNotification.RequestRejected(
            request.getId(), request.getTenantId(), request.getRequesterEmail(),
            request.getVmName().value(), request.getProjectId(), request.getRejectionReason()
        ), command.correlationId());
    }
}
