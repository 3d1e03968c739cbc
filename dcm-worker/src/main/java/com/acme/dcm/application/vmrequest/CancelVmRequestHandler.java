package com.acme.dcm.application.vmrequest;

import com.acme.dcm.application.command.CancelVmRequestCommand;
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
 * Withdraws a pending request. Only the requester may cancel; cancelling twice records one event.
 */
@Singleton
public class CancelVmRequestHandler extends VmRequestCommandHandler<CancelVmRequestCommand, UUID> {

    public CancelVmRequestHandler(
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
    protected UUID aggregateId(CancelVmRequestCommand command) {
        return command.requestId();
    }

    @Override
    protected Long expectedVersion(CancelVmRequestCommand command) {
        return command.expectedVersion();
    }

    @Override
    protected Result<UUID, VmRequestCommandError> execute(VmRequestAggregate request, CancelVmRequestCommand command) {
        if (!request.getRequesterId().equals(command.userId())) {
            return Result.failure(new VmRequestCommandError.Forbidden("Only the requester can cancel a request"));
        }
        try {
            request.cancel(command.reason(), command.metadata());
        } catch (InvalidStateException e) {
            return Result.failure(invalidState(e));
        } catch (IllegalArgumentException e) {
            return Result.failure(new VmRequestCommandError.ValidationFailed(e.getMessage()));
        }
        return Result.success(request.getId());
    }

    @Override
    protected void project(VmRequestAggregate request, CancelVmRequestCommand command, List<VmRequestEvent> committed) {
        projectStatus(request, request.getCancellationReason(), committed);
        recordTimeline(request, TimelineEventType.CANCELLED, command.userId(), request.getCancellationReason(), committed);
    }
}
