package com.acme.dcm.application.project;

import com.acme.dcm.application.command.ArchiveProjectCommand;
import com.acme.dcm.domain.model.project.ProjectAggregate;
import com.acme.dcm.domain.model.project.ProjectEvent;
import com.acme.dcm.domain.model.project.ProjectStatus;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.UUID;

/**
 * Archives a project. Archiving twice records a single event.
 */
@Singleton
public class ArchiveProjectHandler extends ProjectCommandHandler<ArchiveProjectCommand, UUID> {

    public ArchiveProjectHandler(
        EventLog eventLog,
        EventDeserializer<ProjectEvent> deserializer,
        EventPublisher eventPublisher,
        ProjectProjectionUpdater projectionUpdater
    ) {
        super(eventLog, deserializer, eventPublisher, projectionUpdater);
    }

    @Override
    protected UUID aggregateId(ArchiveProjectCommand command) {
        return command.projectId();
    }

    @Override
    protected Long expectedVersion(ArchiveProjectCommand command) {
        return command.expectedVersion();
    }

    @Override
    protected Result<UUID, ProjectCommandError> execute(ProjectAggregate project, ArchiveProjectCommand command) {
        project.archive(command.metadata());
        return Result.success(project.getId());
    }

    @Override
    protected void project(ProjectAggregate project, ArchiveProjectCommand command, List<ProjectEvent> committed) {
        updateProjection("updateStatus", project.getId(), () -> projectionUpdater.updateStatus(
            project.getId(),
            ProjectStatus.ARCHIVED,
            committed.get(0).metadata().timestamp(),
            project.getVersion()
        ));
    }
}
