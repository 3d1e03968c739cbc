package com.acme.dcm.application.project;

import com.acme.dcm.application.command.AssignUserToProjectCommand;
import com.acme.dcm.domain.model.project.ProjectAggregate;
import com.acme.dcm.domain.model.project.ProjectAggregate.ProjectArchivedException;
import com.acme.dcm.domain.model.project.ProjectEvent;
import com.acme.dcm.domain.model.project.ProjectEvent.ProjectMemberRoleChanged;
import com.acme.dcm.domain.model.project.ProjectEvent.UserAssignedToProject;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.UUID;

/**
 * Adds a user to a project, or changes the role of an existing member. Assigning the role a member
 * already has succeeds without writing anything.
 */
@Singleton
public class AssignUserToProjectHandler
    extends ProjectCommandHandler<AssignUserToProjectCommand, AssignUserToProjectResult> {

    public AssignUserToProjectHandler(
        EventLog eventLog,
        EventDeserializer<ProjectEvent> deserializer,
        EventPublisher eventPublisher,
        ProjectProjectionUpdater projectionUpdater
    ) {
        super(eventLog, deserializer, eventPublisher, projectionUpdater);
    }

    @Override
    protected UUID aggregateId(AssignUserToProjectCommand command) {
        return command.projectId();
    }

    @Override
    protected Long expectedVersion(AssignUserToProjectCommand command) {
        return command.expectedVersion();
    }

    @Override
    protected Result<AssignUserToProjectResult, ProjectCommandError> execute(
        ProjectAggregate project,
        AssignUserToProjectCommand command
    ) {
        boolean wasAlreadyMember = project.isMember(command.targetUserId());
        try {
            project.assignUser(command.targetUserId(), command.role(), command.metadata());
        } catch (ProjectArchivedException e) {
            return Result.failure(new ProjectCommandError.ProjectArchived(project.getId(), e.getMessage()));
        }
        return Result.success(new AssignUserToProjectResult(project.getId(), wasAlreadyMember));
    }

    @Override
    protected void project(ProjectAggregate project, AssignUserToProjectCommand command, List<ProjectEvent> committed) {
        for (ProjectEvent event : committed) {
            if (event instanceof UserAssignedToProject) {
                UserAssignedToProject assigned = (UserAssignedToProject) event;
                updateProjection("insertMember", project.getId(), () -> projectionUpdater.insertMember(new ProjectMemberProjection(
                    project.getId(),
                    assigned.userId(),
                    assigned.role(),
                    assigned.metadata().userId(),
                    assigned.metadata().timestamp()
                )));
            } else if (event instanceof ProjectMemberRoleChanged) {
                ProjectMemberRoleChanged changed = (ProjectMemberRoleChanged) event;
                updateProjection("updateMemberRole", project.getId(), () -> projectionUpdater.updateMemberRole(
                    project.getId(), changed.userId(), changed.newRole()
                ));
            }
        }
    }
}
