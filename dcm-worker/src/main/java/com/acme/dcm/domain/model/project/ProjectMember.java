package com.acme.dcm.domain.model.project;

import java.time.Instant;
import java.util.UUID;

public record ProjectMember(UUID userId, ProjectRole role, UUID assignedBy, Instant assignedAt) {

    public ProjectMember withRole(ProjectRole newRole) {
        return new ProjectMember(userId, newRole, assignedBy, assignedAt);
    }
}
