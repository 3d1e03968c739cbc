package com.acme.dcm.application.project;

import com.acme.dcm.domain.model.project.ProjectAggregate;
import com.acme.dcm.domain.model.project.ProjectEvent;
import com.acme.sourcing.command.AggregateCommandHandler;
import com.acme.sourcing.command.TenantCommand;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.ConcurrencyConflict;
import com.acme.sourcing.store.EventLog;

import java.util.List;
import java.util.UUID;

/**
 * Base for commands against an existing project.
 */
abstract class ProjectCommandHandler<C extends TenantCommand, T>
    extends AggregateCommandHandler<C, ProjectAggregate, ProjectEvent, T, ProjectCommandError> {

    protected final ProjectProjectionUpdater projectionUpdater;

    protected ProjectCommandHandler(
        EventLog eventLog,
        EventDeserializer<ProjectEvent> deserializer,
        EventPublisher eventPublisher,
        ProjectProjectionUpdater projectionUpdater
    ) {
        super(eventLog, deserializer, eventPublisher);
        this.projectionUpdater = projectionUpdater;
    }

    @Override
    protected String aggregateLabel() {
        return "Project";
    }

    @Override
    protected ProjectAggregate reconstitute(UUID aggregateId, List<ProjectEvent> history) {
        return ProjectAggregate.reconstitute(aggregateId, history);
    }

    @Override
    protected ProjectCommandError notFound(C command, String message) {
        return new ProjectCommandError.NotFound(aggregateId(command), message);
    }

    @Override
    protected ProjectCommandError concurrencyConflict(ConcurrencyConflict conflict) {
        return new ProjectCommandError.ConcurrencyConflict(
            conflict.expectedVersion(), conflict.actualVersion(), conflict.message()
        );
    }

    @Override
    protected ProjectCommandError persistenceFailure(String message) {
        return new ProjectCommandError.PersistenceFailure(message);
    }
}
