package com.acme.dcm.application.project;

import com.acme.dcm.application.command.CreateProjectCommand;
import com.acme.dcm.domain.model.project.ProjectAggregate;
import com.acme.dcm.domain.model.project.ProjectEvent;
import com.acme.dcm.domain.model.project.ProjectName;
import com.acme.dcm.domain.model.project.ProjectRole;
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
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Creates a project after checking name uniqueness against the read model. The check is
 * eventually consistent: two concurrent creates with the same name can both pass it.
 */
@Slf4j
@Singleton
public class CreateProjectHandler
    extends EventSourcedCommandSupport<ProjectAggregate, ProjectEvent, ProjectCommandError>
    implements CommandHandler<CreateProjectCommand, CreateProjectResult, ProjectCommandError> {

    private final ProjectQueryService queryService;
    private final ProjectProjectionUpdater projectionUpdater;

    public CreateProjectHandler(
        EventLog eventLog,
        EventPublisher eventPublisher,
        ProjectQueryService queryService,
        ProjectProjectionUpdater projectionUpdater
    ) {
        super(eventLog, eventPublisher);
        this.queryService = queryService;
        this.projectionUpdater = projectionUpdater;
    }

    @Override
    public Result<CreateProjectResult, ProjectCommandError> handle(CreateProjectCommand command) {
        try (CorrelationScope ignored = CorrelationScope.open(command.correlationId())) {
            return create(command);
        }
    }

    private Result<CreateProjectResult, ProjectCommandError> create(CreateProjectCommand command) {
        ProjectName name;
        try {
            name = ProjectName.of(command.name());
        } catch (IllegalArgumentException e) {
            return Result.failure(new ProjectCommandError.ValidationFailed(e.getMessage()));
        }

        boolean taken;
        try {
            Cancellation.checkpoint();
            taken = queryService.existsByName(command.tenantId(), name.normalized(), null);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to check project name: tenantId={} name={}", command.tenantId(), name.value(), e);
            return Result.failure(new ProjectCommandError.PersistenceFailure("Failed to check project name: " + e.getMessage()));
        }
        if (taken) {
            log.info("Project name already exists: tenantId={} name={}", command.tenantId(), name.value());
            return Result.failure(new ProjectCommandError.NameAlreadyExists(
                name.value(), "Project name already exists: " + name.value()
            ));
        }

        UUID projectId = UUID.randomUUID();
        EventMetadata metadata = command.metadata();
        ProjectAggregate project = ProjectAggregate.create(projectId, name, command.description(), metadata);

        Result<List<ProjectEvent>, ProjectCommandError> committed = commit(project, 0);
        if (committed.isFailure()) {
            return Result.failure(committed.errorOrNull());
        }

        updateProjection("insertProject", projectId, () -> projectionUpdater.insertProject(new ProjectProjection(
            projectId,
            command.tenantId(),
            name.value(),
            command.description(),
            project.getStatus(),
            command.userId(),
            metadata.timestamp(),
            metadata.timestamp(),
            project.getVersion()
        )));
        updateProjection("insertMember", projectId, () -> projectionUpdater.insertMember(new ProjectMemberProjection(
            projectId, command.userId(), ProjectRole.PROJECT_ADMIN, command.userId(), metadata.timestamp()
        )));
        publish(committed.getOrNull());

        log.info("Project created: projectId={} tenantId={} name={}", projectId, command.tenantId(), name.value());
        return Result.success(new CreateProjectResult(projectId, project.getVersion()));
    }

    @Override
    protected ProjectCommandError concurrencyConflict(ConcurrencyConflict conflict) {
        return new ProjectCommandError.ConcurrencyConflict(
            conflict.expectedVersion(), conflict.actualVersion(), conflict.message()
        );
    }

    @Override
    protected ProjectCommandError persistenceFailure(String message) {
        return new ProjectCommandError.PersistenceFailure(message);
    }
}
