package com.acme.dcm.application.vmrequest;

import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vmrequest.VmRequestAggregate;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent;
import com.acme.dcm.domain.model.vmrequest.VmRequestStatus;
import com.acme.sourcing.command.AggregateCommandHandler;
import com.acme.sourcing.command.TenantCommand;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.ConcurrencyConflict;
import com.acme.sourcing.store.EventLog;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Base for commands against an existing VM request.
 */
abstract class VmRequestCommandHandler<C extends TenantCommand, T>
    extends AggregateCommandHandler<C, VmRequestAggregate, VmRequestEvent, T, VmRequestCommandError> {

    protected final VmRequestProjectionUpdater projectionUpdater;
    protected final TimelineEventProjectionUpdater timelineUpdater;
    protected final VmRequestNotificationSender notificationSender;

    protected VmRequestCommandHandler(
        EventLog eventLog,
        EventDeserializer<VmRequestEvent> deserializer,
        EventPublisher eventPublisher,
        VmRequestProjectionUpdater projectionUpdater,
        TimelineEventProjectionUpdater timelineUpdater,
        VmRequestNotificationSender notificationSender
    ) {
        super(eventLog, deserializer, eventPublisher);
        this.projectionUpdater = projectionUpdater;
        this.timelineUpdater = timelineUpdater;
        this.notificationSender = notificationSender;
    }

    @Override
    protected String aggregateLabel() {
        return "VM request";
    }

    @Override
    protected VmRequestAggregate reconstitute(UUID aggregateId, List<VmRequestEvent> history) {
        return VmRequestAggregate.reconstitute(aggregateId, history);
    }

    @Override
    protected VmRequestCommandError notFound(C command, String message) {
        return new VmRequestCommandError.NotFound(aggregateId(command), message);
    }

    @Override
    protected VmRequestCommandError concurrencyConflict(ConcurrencyConflict conflict) {
        return new VmRequestCommandError.ConcurrencyConflict(
            conflict.expectedVersion(), conflict.actualVersion(), conflict.message()
        );
    }

    @Override
    protected VmRequestCommandError persistenceFailure(String message) {
        return new VmRequestCommandError.PersistenceFailure(message);
    }

    protected static VmRequestCommandError invalidState(InvalidStateException e) {
        return new VmRequestCommandError.InvalidState(e.getCurrentState(), e.getMessage());
    }

    protected void projectStatus(VmRequestAggregate request, String reason, List<VmRequestEvent> committed) {
        VmRequestStatus status = request.getStatus();
        Instant at = committed.get(committed.size() - 1).metadata().timestamp();
        updateProjection("updateStatus", request.getId(), () -> projectionUpdater.updateStatus(
            request.getId(), status, reason, at, request.getVersion()
        ));
    }

    /**
     * @param actorId null for transitions driven by the provisioning saga
     */
    protected void recordTimeline(
        VmRequestAggregate request,
        TimelineEventType type,
        UUID actorId,
        String reason,
        List<VmRequestEvent> committed
    ) {
        TimelineEvent event = TimelineEvent.of(
            request.getId(),
            request.getTenantId(),
            type,
            actorId,
            reason,
            committed.get(committed.size() - 1).metadata().timestamp(),
            request.getVersion()
        );
        updateProjection("addTimelineEvent", request.getId(), () -> timelineUpdater.addTimelineEvent(event));
    }

    protected void notifyRequester(VmRequestNotification notification, UUID correlationId) {
        RequesterNotifications.send(notificationSender, notification, correlationId);
    }
}
