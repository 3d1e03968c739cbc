package com.acme.dcm.application.vm;

import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vm.VmAggregate;
import com.acme.dcm.domain.model.vm.VmEvent;
import com.acme.sourcing.command.AggregateCommandHandler;
import com.acme.sourcing.command.TenantCommand;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.ConcurrencyConflict;
import com.acme.sourcing.store.EventLog;

import java.util.List;
import java.util.UUID;

/**
 * Base for commands against an existing VM.
 */
abstract class VmCommandHandler<C extends TenantCommand> extends AggregateCommandHandler<C, VmAggregate, VmEvent, UUID, VmCommandError> {

    protected final VmProvisioningProgressRepository progressRepository;

    protected VmCommandHandler(
        EventLog eventLog,
        EventDeserializer<VmEvent> deserializer,
        EventPublisher eventPublisher,
        VmProvisioningProgressRepository progressRepository
    ) {
        super(eventLog, deserializer, eventPublisher);
        this.progressRepository = progressRepository;
    }

    @Override
    protected String aggregateLabel() {
        return "VM";
    }

    @Override
    protected VmAggregate reconstitute(UUID aggregateId, List<VmEvent> history) {
        return VmAggregate.reconstitute(aggregateId, history);
    }

    @Override
    protected VmCommandError notFound(C command, String message) {
        return new VmCommandError.NotFound(aggregateId(command), message);
    }

    @Override
    protected VmCommandError concurrencyConflict(ConcurrencyConflict conflict) {
        return new VmCommandError.ConcurrencyConflict(conflict.expectedVersion(), conflict.actualVersion(), conflict.message());
    }

    @Override
    protected VmCommandError persistenceFailure(String message) {
        return new VmCommandError.PersistenceFailure(message);
    }

    protected static VmCommandError invalidState(InvalidStateException e) {
        return new VmCommandError.InvalidState(e.getCurrentState(), e.getMessage());
    }
}
