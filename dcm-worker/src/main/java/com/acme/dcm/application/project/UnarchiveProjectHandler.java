package com.acme.dcm.application.project;

import com.acme.dcm.application.command.UnarchiveProjectCommand;
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
 * Reactivates an archived project. Unarchiving an active project records nothing.
 */
@Singleton
public class UnarchiveProjectHandler extends ProjectCommandHandler<UnarchiveProjectCommand, UUID> {

    public UnarchiveProjectHandler(
        EventLog eventLog,
        EventDeserializer<ProjectEvent> deserializer,
        EventPublisher eventPublisher,
        ProjectProjectionUpdater projectionUpdater
    ) {
        super(eventLog, deserializer, eventPublisher, projectionUpdater);
    }

    @Override
    protected UUID aggregateId(UnarchiveProjectCommand command) {
        return command.projectId();
    }

    @Override
    protected Long expectedVersion(UnarchiveProjectCommand command) {
        return command.expectedVersion();
    }

    @Override
    protected Result<UUID, ProjectCommandError> execute(ProjectAggregate project, UnarchiveProjectCommand command) {
        project.unarchive(command.metadata());
        return Result.success(project.getId());
    }

    @Override
    protected void project(ProjectAggregate project, UnarchiveProjectCommand command, List<ProjectEvent> committed) {
        updateProjection("updateStatus", project.getId(), () -> projectionUpdater.updateStatus(
            project.getId(),
            ProjectStatus.ACTIVE,
            committed.get(0).metadata().timestamp(),
            project.getVersion()
        ));
    }
}
