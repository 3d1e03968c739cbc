package com.acme.dcm.application.vmrequest;

import com.acme.dcm.application.command.CreateVmRequestCommand;
import com.acme.dcm.application.project.ProjectProjection;
import com.acme.dcm.application.project.ProjectQueryService;
import com.acme.dcm.domain.model.project.ProjectStatus;
import com.acme.dcm.domain.model.vmrequest.VmName;
import com.acme.dcm.domain.model.vmrequest.VmRequestAggregate;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent;
import com.acme.sourcing.command.CommandHandler;
import com.acme.sourcing.command.EventSourcedCommandSupport;
import com.acme.sourcing.core.Cancellation;
import com.acme.sourcing.core.CorrelationScope;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventMetadata;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.ConcurrencyConflict;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Submits a VM request for an active project of the caller's tenant.
 */
@Slf4j
@Singleton
public class CreateVmRequestHandler
    extends EventSourcedCommandSupport<VmRequestAggregate, VmRequestEvent, VmRequestCommandError>
    implements CommandHandler<CreateVmRequestCommand, CreateVmRequestResult, VmRequestCommandError> {

    private final ProjectQueryService projectQueryService;
    private final VmRequestProjectionUpdater projectionUpdater;
    private final TimelineEventProjectionUpdater timelineUpdater;
    private final VmRequestNotificationSender notificationSender;

    public CreateVmRequestHandler(
        EventLog eventLog,
        EventPublisher eventPublisher,
        ProjectQueryService projectQueryService,
        VmRequestProjectionUpdater projectionUpdater,
        TimelineEventProjectionUpdater timelineUpdater,
        VmRequestNotificationSender notificationSender
    ) {
        super(eventLog, eventPublisher);
        this.projectQueryService = projectQueryService;
        this.projectionUpdater = projectionUpdater;
        this.timelineUpdater = timelineUpdater;
        this.notificationSender = notificationSender;
    }

    @Override
    public Result<CreateVmRequestResult, VmRequestCommandError> handle(CreateVmRequestCommand command) {
        try (CorrelationScope ignored = CorrelationScope.open(command.correlationId())) {
            return create(command);
        }
    }

    private Result<CreateVmRequestResult, VmRequestCommandError> create(CreateVmRequestCommand command) {
        Optional<ProjectProjection> project;
        try {
            Cancellation.checkpoint();
            project = projectQueryService.findById(command.tenantId(), command.projectId());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to look up project: projectId={}", command.projectId(), e);
            return Result.failure(new VmRequestCommandError.PersistenceFailure("Failed to look up project: " + e.getMessage()));
        }
        if (project.isEmpty() || project.get().status() != ProjectStatus.ACTIVE) {
            return Result.failure(new VmRequestCommandError.ProjectNotAvailable(
                command.projectId(), "Project not found or archived: " + command.projectId()
            ));
        }

        UUID requestId = UUID.randomUUID();
        EventMetadata metadata = command.metadata();
        VmRequestAggregate request;
        try {
            request = VmRequestAggregate.create(
                requestId,
                command.projectId(),
                VmName.of(command.vmName()),
                command.size(),
                command.justification(),
                command.requesterEmail(),
                metadata
            );
        } catch (IllegalArgumentException e) {
            return Result.failure(new VmRequestCommandError.ValidationFailed(e.getMessage()));
        }

        Result<List<VmRequestEvent>, VmRequestCommandError> committed = commit(request, 0);
        if (committed.isFailure()) {
            return Result.failure(committed.errorOrNull());
        }

        updateProjection("insert", requestId, () -> projectionUpdater.insert(new VmRequestProjection(
            requestId,
            command.tenantId(),
            command.projectId(),
            command.userId(),
            command.requesterEmail(),
            request.getVmName().value(),
            request.getSize(),
            request.getJustification(),
            request.getStatus(),
            null,
            null,
            null,
            null,
            metadata.timestamp(),
            metadata.timestamp(),
            request.getVersion()
        )));
        TimelineEvent created = TimelineEvent.of(
            requestId, command.tenantId(), TimelineEventType.CREATED, command.userId(), null,
            metadata.timestamp(), request.getVersion()
        );
        updateProjection("addTimelineEvent", requestId, () -> timelineUpdater.addTimelineEvent(created));
        RequesterNotifications.send(notificationSender, new VmRequestNotification.RequestCreated(
            requestId, command.tenantId(), command.requesterEmail(), request.getVmName().value(), command.projectId()
        ), command.correlationId());
        publish(committed.getOrNull());

        log.info("VM request created: requestId={} projectId={} vmName={} size={}",
            requestId, command.projectId(), command.vmName(), command.size());
        return Result.success(new CreateVmRequestResult(requestId, request.getVersion()));
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
}
