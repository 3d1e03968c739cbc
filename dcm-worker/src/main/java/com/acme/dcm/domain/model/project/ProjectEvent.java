package com.acme.dcm.domain.model.project;

import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.EventMetadata;

import java.util.UUID;

/**
 * Events of the Project stream. The nested records are the complete set.
 */
public sealed interface ProjectEvent extends DomainEvent {

    String AGGREGATE_TYPE = "Project";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }

    record ProjectCreated(UUID aggregateId, String name, String description, EventMetadata metadata)
        implements ProjectEvent {}

    record ProjectUpdated(UUID aggregateId, String name, String description, EventMetadata metadata)
        implements ProjectEvent {}

    record ProjectArchived(UUID aggregateId, EventMetadata metadata) implements ProjectEvent {}

    record ProjectUnarchived(UUID aggregateId, EventMetadata metadata) implements ProjectEvent {}

    record UserAssignedToProject(UUID aggregateId, UUID userId, ProjectRole role, EventMetadata metadata)
        implements ProjectEvent {}

    record ProjectMemberRoleChanged(
        UUID aggregateId,
        UUID userId,
        ProjectRole previousRole,
        ProjectRole newRole,
        EventMetadata metadata
    ) implements ProjectEvent {}

    record UserRemovedFromProject(UUID aggregateId, UUID userId, EventMetadata metadata)
        implements ProjectEvent {}
}
