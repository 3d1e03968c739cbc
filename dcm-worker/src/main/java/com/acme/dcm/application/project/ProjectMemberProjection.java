package com.acme.dcm.application.project;

import com.acme.dcm.domain.model.project.ProjectRole;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-model row for one project membership.
 */
public record ProjectMemberProjection(UUID projectId, UUID userId, ProjectRole role, UUID assignedBy, Instant assignedAt) {

    public ProjectMemberProjection withRole(ProjectRole newRole) {
        return new ProjectMemberProjection(projectId, userId, newRole, assignedBy, assignedAt);
    }
}
