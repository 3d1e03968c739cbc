package com.acme.dcm.application.project;

import com.acme.dcm.domain.model.project.ProjectStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-model row for a project.
 */
public record ProjectProjection(
    UUID id,
    UUID tenantId,
    String name,
    String description,
    ProjectStatus status,
    UUID createdBy,
    Instant createdAt,
    Instant updatedAt,
    long version
) {
    public ProjectProjection withDetails(String newName, String newDescription, Instant at, long newVersion) {
        return new ProjectProjection(id, tenantId, newName, newDescription, status, createdBy, createdAt, at, newVersion);
    }

    public ProjectProjection withStatus(ProjectStatus newStatus, Instant at, long newVersion) {
        return new ProjectProjection(id, tenantId, name, description, newStatus, createdBy, createdAt, at, newVersion);
    }
}
