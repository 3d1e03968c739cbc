package com.acme.dcm.application.project;

import com.acme.dcm.application.command.UpdateProjectCommand;
import com.acme.dcm.domain.model.project.ProjectAggregate;
import com.acme.dcm.domain.model.project.ProjectAggregate.ProjectArchivedException;
import com.acme.dcm.domain.model.project.ProjectEvent;
import com.acme.dcm.domain.model.project.ProjectName;
import com.acme.sourcing.core.Cancellation;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Renames a project or changes its description. A new name is checked for uniqueness.
 */
@Slf4j
@Singleton
public class UpdateProjectHandler extends ProjectCommandHandler<UpdateProjectCommand, UUID> {

    private final ProjectQueryService queryService;

    public UpdateProjectHandler(
        EventLog eventLog,
        EventDeserializer<ProjectEvent> deserializer,
        EventPublisher eventPublisher,
        ProjectProjectionUpdater projectionUpdater,
        ProjectQueryService queryService
    ) {
        super(eventLog, deserializer, eventPublisher, projectionUpdater);
        this.queryService = queryService;
    }

    @Override
    protected UUID aggregateId(UpdateProjectCommand command) {
        return command.projectId();
    }

    @Override
    protected Long expectedVersion(UpdateProjectCommand command) {
        return command.expectedVersion();
    }

    @Override
    protected Result<UUID, ProjectCommandError> execute(ProjectAggregate project, UpdateProjectCommand command) {
        ProjectName name;
        try {
            name = ProjectName.of(command.name());
        } catch (IllegalArgumentException e) {
            return Result.failure(new ProjectCommandError.ValidationFailed(e.getMessage()));
        }

        if (project.isActive() && !name.normalized().equals(project.getName().normalized())) {
            boolean taken;
            try {
                Cancellation.checkpoint();
                taken = queryService.existsByName(command.tenantId(), name.normalized(), project.getId());
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to check project name: projectId={} name={}", project.getId(), name.value(), e);
                return Result.failure(new ProjectCommandError.PersistenceFailure("Failed to check project name: " + e.getMessage()));
            }
            if (taken) {
                return Result.failure(new ProjectCommandError.NameAlreadyExists(
                    name.value(), "Project name already exists: " + name.value()
                ));
            }
        }

        try {
            project.update(name, command.description(), command.metadata());
        } catch (ProjectArchivedException e) {
            return Result.failure(new ProjectCommandError.ProjectArchived(project.getId(), e.getMessage()));
        }
        return Result.success(project.getId());
    }

    @Override
    protected void project(ProjectAggregate project, UpdateProjectCommand command, List<ProjectEvent> committed) {
        updateProjection("updateProject", project.getId(), () -> projectionUpdater.updateProject(
            project.getId(),
            project.getName().value(),
            project.getDescription(),
            committed.get(committed.size() - 1).metadata().timestamp(),
            project.getVersion()
        ));
    }
}
