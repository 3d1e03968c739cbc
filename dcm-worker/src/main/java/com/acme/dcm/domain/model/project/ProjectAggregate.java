package com.acme.dcm.domain.model.project;

import com.acme.dcm.domain.model.project.ProjectEvent.ProjectArchived;
import com.acme.dcm.domain.model.project.ProjectEvent.ProjectCreated;
import com.acme.dcm.domain.model.project.ProjectEvent.ProjectMemberRoleChanged;
import com.acme.dcm.domain.model.project.ProjectEvent.ProjectUnarchived;
import com.acme.dcm.domain.model.project.ProjectEvent.ProjectUpdated;
import com.acme.dcm.domain.model.project.ProjectEvent.UserAssignedToProject;
import com.acme.dcm.domain.model.project.ProjectEvent.UserRemovedFromProject;
import com.acme.sourcing.aggregate.AggregateRoot;
import com.acme.sourcing.event.EventMetadata;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregate root for Project.
 *
 * <p>A project is ACTIVE or ARCHIVED. Membership changes and updates require ACTIVE. The creator
 * is assigned PROJECT_ADMIN on creation and can never be removed.
 */
@Getter
public class ProjectAggregate extends AggregateRoot<ProjectEvent> {
    private final UUID id;
    private UUID tenantId;
    private UUID createdBy;
    private ProjectName name;
    private String description;
    private ProjectStatus status;
    private Instant createdAt;
    private final Map<UUID, ProjectMember> members = new LinkedHashMap<>();

    private ProjectAggregate(UUID id) {
        this.id = id;
    }

    /**
     * Create a new project. Emits ProjectCreated followed by the creator's PROJECT_ADMIN assignment.
     */
    public static ProjectAggregate create(UUID id, ProjectName name, String description, EventMetadata metadata) {
        if (id == null) {
            throw new IllegalArgumentException("Project ID cannot be null");
        }
        ProjectAggregate project = new ProjectAggregate(id);
        project.applyEvent(new ProjectCreated(id, name.value(), description, metadata));
        project.applyEvent(new UserAssignedToProject(id, metadata.userId(), ProjectRole.PROJECT_ADMIN, metadata));
        return project;
    }

    public static ProjectAggregate reconstitute(UUID id, List<ProjectEvent> history) {
        ProjectAggregate project = new ProjectAggregate(id);
        project.loadFromHistory(history);
        return project;
    }

    @Override
    public String getAggregateType() {
        return ProjectEvent.AGGREGATE_TYPE;
    }

    public void update(ProjectName newName, String newDescription, EventMetadata metadata) {
        requireActive("update");
        applyEvent(new ProjectUpdated(id, newName.value(), newDescription, metadata));
    }

    /** Idempotent: archiving an archived project records nothing. */
    public void archive(EventMetadata metadata) {
        if (status == ProjectStatus.ARCHIVED) {
            return;
        }
        applyEvent(new ProjectArchived(id, metadata));
    }

    /** Idempotent: unarchiving an active project records nothing. */
    public void unarchive(EventMetadata metadata) {
        if (status == ProjectStatus.ACTIVE) {
            return;
        }
        applyEvent(new ProjectUnarchived(id, metadata));
    }

    /**
     * Assign a user. Same role again is a no-op; a different role records a role change.
     */
    public void assignUser(UUID userId, ProjectRole role, EventMetadata metadata) {
        requireActive("assign users to");
        ProjectMember existing = members.get(userId);
        if (existing == null) {
            applyEvent(new UserAssignedToProject(id, userId, role, metadata));
        } else if (existing.role() != role) {
            applyEvent(new ProjectMemberRoleChanged(id, userId, existing.role(), role, metadata));
        }
    }

    /**
     * Remove a user. The creator can never be removed, whatever the project state. Removing a
     * non-member is a no-op.
     */
    public void removeUser(UUID userId, EventMetadata metadata) {
        if (userId.equals(createdBy)) {
            throw new CreatorRemovalException(id, userId);
        }
        requireActive("remove users from");
        if (!members.containsKey(userId)) {
            return;
        }
        applyEvent(new UserRemovedFromProject(id, userId, metadata));
    }

    public boolean isActive() {
        return status == ProjectStatus.ACTIVE;
    }

    public boolean isMember(UUID userId) {
        return members.containsKey(userId);
    }

    public Optional<ProjectMember> findMember(UUID userId) {
        return Optional.ofNullable(members.get(userId));
    }

    // Override Lombok getter to return unmodifiable map
    public Map<UUID, ProjectMember> getMembers() {
        return Collections.unmodifiableMap(members);
    }

    private void requireActive(String operation) {
        if (status != ProjectStatus.ACTIVE) {
            throw new ProjectArchivedException(id, operation);
        }
    }

    @Override
    protected void handle(ProjectEvent event) {
        if (event instanceof ProjectCreated) {
            ProjectCreated e = (ProjectCreated) event;
            tenantId = e.metadata().tenantId();
            createdBy = e.metadata().userId();
            name = ProjectName.of(e.name());
            description = e.description();
            status = ProjectStatus.ACTIVE;
            createdAt = e.metadata().timestamp();
        } else if (event instanceof ProjectUpdated) {
            ProjectUpdated e = (ProjectUpdated) event;
            name = ProjectName.of(e.name());
            description = e.description();
        } else if (event instanceof ProjectArchived) {
            status = ProjectStatus.ARCHIVED;
        } else if (event instanceof ProjectUnarchived) {
            status = ProjectStatus.ACTIVE;
        } else if (event instanceof UserAssignedToProject) {
            UserAssignedToProject e = (UserAssignedToProject) event;
            members.put(e.userId(), new ProjectMember(e.userId(), e.role(), e.metadata().userId(), e.metadata().timestamp()));
        } else if (event instanceof ProjectMemberRoleChanged) {
            ProjectMemberRoleChanged e = (ProjectMemberRoleChanged) event;
            members.computeIfPresent(e.userId(), (k, m) -> m.withRole(e.newRole()));
        } else if (event instanceof UserRemovedFromProject) {
            members.remove(((UserRemovedFromProject) event).userId());
        }
    }

    /**
     * Exception thrown when a mutation requires an active project
     */
    @Getter
    public static class ProjectArchivedException extends RuntimeException {
        private final UUID projectId;

        public ProjectArchivedException(UUID projectId, String operation) {
            super("Cannot " + operation + " archived project " + projectId);
            this.projectId = projectId;
        }
    }

    /**
     * Exception thrown when removing the project creator
     */
    @Getter
    public static class CreatorRemovalException extends RuntimeException {
        private final UUID projectId;
        private final UUID userId;

        public CreatorRemovalException(UUID projectId, UUID userId) {
            super("Cannot remove the project creator");
            this.projectId = projectId;
            this.userId = userId;
        }
    }
}
