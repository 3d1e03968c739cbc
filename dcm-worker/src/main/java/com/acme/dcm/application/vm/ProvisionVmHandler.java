package com.acme.dcm.application.vm;

import com.acme.dcm.application.command.ProvisionVmCommand;
import com.acme.dcm.domain.model.vm.VmAggregate;
import com.acme.dcm.domain.model.vm.VmEvent;
import com.acme.dcm.domain.model.vm.VmProvisioningStage;
import com.acme.dcm.domain.model.vmrequest.VmName;
import com.acme.sourcing.command.CommandHandler;
import com.acme.sourcing.command.EventSourcedCommandSupport;
import com.acme.sourcing.core.CorrelationScope;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventMetadata;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.ConcurrencyConflict;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;

/**
 * Creates the VM aggregate for an approved request. The VM id is derived from the request id, so
 * a duplicate command fails with a concurrency conflict instead of creating a second VM.
 */
@Slf4j
@Singleton
public class ProvisionVmHandler
    extends EventSourcedCommandSupport<VmAggregate, VmEvent, VmCommandError>
    implements CommandHandler<ProvisionVmCommand, UUID, VmCommandError> {

    private final VmProvisioningProgressRepository progressRepository;

    public ProvisionVmHandler(EventLog eventLog, EventPublisher eventPublisher, VmProvisioningProgressRepository progressRepository) {
        super(eventLog, eventPublisher);
        this.progressRepository = progressRepository;
    }

    @Override
    public Result<UUID, VmCommandError> handle(ProvisionVmCommand command) {
        try (CorrelationScope ignored = CorrelationScope.open(command.correlationId())) {
            EventMetadata metadata = command.metadata();
            VmAggregate vm;
            try {
                vm = VmAggregate.startProvisioning(
                    command.requestId(),
                    command.projectId(),
                    VmName.of(command.vmName()),
                    command.size(),
                    command.requesterId(),
                    metadata
                );
            } catch (IllegalArgumentException e) {
                return Result.failure(new VmCommandError.ValidationFailed(e.getMessage()));
            }

            Result<List<VmEvent>, VmCommandError> committed = commit(vm, 0);
            if (committed.isFailure()) {
                return Result.failure(committed.errorOrNull());
            }

            updateProjection("saveProgress", vm.getId(), () -> progressRepository.save(new VmProvisioningProgress(
                vm.getId(), command.requestId(), command.tenantId(), VmProvisioningStage.CREATED,
                "Provisioning requested", metadata.timestamp()
            )));
            publish(committed.getOrNull());

            log.info("VM provisioning started: vmId={} requestId={} vmName={}", vm.getId(), command.requestId(), command.vmName());
            return Result.success(vm.getId());
        }
    }

    @Override
    protected VmCommandError concurrencyConflict(ConcurrencyConflict conflict) {
        return new VmCommandError.ConcurrencyConflict(conflict.expectedVersion(), conflict.actualVersion(), conflict.message());
    }

    @Override
    protected VmCommandError persistenceFailure(String message) {
        return new VmCommandError.PersistenceFailure(message);
    }
}
