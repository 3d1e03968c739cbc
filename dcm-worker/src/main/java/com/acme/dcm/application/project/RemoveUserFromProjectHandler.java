package com.acme.dcm.application.project;

import com.acme.dcm.application.command.RemoveUserFromProjectCommand;
import com.acme.dcm.domain.model.project.ProjectAggregate;
import com.acme.dcm.domain.model.project.ProjectAggregate.CreatorRemovalException;
import com.acme.dcm.domain.model.project.ProjectAggregate.ProjectArchivedException;
import com.acme.dcm.domain.model.project.ProjectEvent;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.UUID;

/**
 * Removes a member from a project. Removing a non-member succeeds without writing anything.
 */
@Singleton
public class RemoveUserFromProjectHandler extends ProjectCommandHandler<RemoveUserFromProjectCommand, UUID> {

    public RemoveUserFromProjectHandler(
        EventLog eventLog,
        EventDeserializer<ProjectEvent> deserializer,
        EventPublisher eventPublisher,
        ProjectProjectionUpdater projectionUpdater
    ) {
        super(eventLog, deserializer, eventPublisher, projectionUpdater);
    }

    @Override
    protected UUID aggregateId(RemoveUserFromProjectCommand command) {
        return command.projectId();
    }

    @Override
    protected Long expectedVersion(RemoveUserFromProjectCommand command) {
        return command.expectedVersion();
    }

    @Override
    protected Result<UUID, ProjectCommandError> execute(ProjectAggregate project, RemoveUserFromProjectCommand command) {
        try {
            project.removeUser(command.targetUserId(), command.metadata());
        } catch (CreatorRemovalException e) {
            return Result.failure(new ProjectCommandError.CannotRemoveCreator(
                project.getId(), command.targetUserId(), e.getMessage()
            ));
        } catch (ProjectArchivedException e) {
            return Result.failure(new ProjectCommandError.ProjectArchived(project.getId(), e.getMessage()));
        }
        return Result.success(project.getId());
    }

    @Override
    protected void project(ProjectAggregate project, RemoveUserFromProjectCommand command, List<ProjectEvent> committed) {
        updateProjection("removeMember", project.getId(), () -> projectionUpdater.removeMember(
            project.getId(), command.targetUserId()
        ));
    }
}
