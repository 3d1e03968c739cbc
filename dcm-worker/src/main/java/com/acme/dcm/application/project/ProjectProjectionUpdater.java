package com.acme.dcm.application.project;

import com.acme.dcm.domain.model.project.ProjectRole;
import com.acme.dcm.domain.model.project.ProjectStatus;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.projection.ProjectionError;

import java.time.Instant;
import java.util.UUID;

/**
 * Write port for the project read model. Called after events are committed; failures are logged
 * by the caller and repaired by rebuilding from the event log.
 */
public interface ProjectProjectionUpdater {

    Result<Void, ProjectionError> insertProject(ProjectProjection project);

    Result<Void, ProjectionError> updateProject(UUID projectId, String name, String description, Instant updatedAt, long version);

    Result<Void, ProjectionError> updateStatus(UUID projectId, ProjectStatus status, Instant updatedAt, long version);

    Result<Void, ProjectionError> insertMember(ProjectMemberProjection member);

    Result<Void, ProjectionError> updateMemberRole(UUID projectId, UUID userId, ProjectRole role);

    Result<Void, ProjectionError> removeMember(UUID projectId, UUID userId);
}
