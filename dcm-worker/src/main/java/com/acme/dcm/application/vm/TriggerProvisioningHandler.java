package com.acme.dcm.application.vm;

import com.acme.dcm.application.command.MarkVmFailedCommand;
import com.acme.dcm.application.command.MarkVmProvisionedCommand;
import com.acme.dcm.application.command.MarkVmRequestFailedCommand;
import com.acme.dcm.application.command.MarkVmRequestReadyCommand;
import com.acme.dcm.application.command.UpdateVmProgressCommand;
import com.acme.dcm.domain.model.vm.VmAggregate;
import com.acme.dcm.domain.model.vm.VmEvent;
import com.acme.dcm.domain.model.vm.VmProvisioningStage;
import com.acme.dcm.domain.model.vm.VmStatus;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestProvisioningStarted;
import com.acme.sourcing.command.CommandHandlerRegistry;
import com.acme.sourcing.command.DomainCommand;
import com.acme.sourcing.core.Cancellation;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.StoredEvent;
import com.acme.sourcing.process.ProcessStepOutcome;
import com.acme.sourcing.store.EventLog;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Runs the hypervisor call once a request is in PROVISIONING, then records the outcome on both the
 * VM and the request. Progress stages are recorded on the VM as they arrive; a failure to record one
 * does not stop provisioning.
 */
@Slf4j
@Singleton
public class TriggerProvisioningHandler {

    private final EventLog eventLog;
    private final EventDeserializer<VmEvent> deserializer;
    private final CommandHandlerRegistry commandHandlers;
    private final ResilientProvisioningService provisioningService;
    private final String template;

    public TriggerProvisioningHandler(
        EventLog eventLog,
        EventDeserializer<VmEvent> deserializer,
        CommandHandlerRegistry commandHandlers,
        ResilientProvisioningService provisioningService,
        @Value("${provisioning.template:ubuntu-22.04-template}") String template
    ) {
        this.eventLog = eventLog;
        this.deserializer = deserializer;
        this.commandHandlers = commandHandlers;
        this.provisioningService = provisioningService;
        this.template = template;
    }

    public ProcessStepOutcome onEvent(VmRequestProvisioningStarted trigger) {
        UUID requestId = trigger.aggregateId();
        UUID vmId = VmAggregate.idForRequest(requestId);
        UUID correlationId = trigger.metadata().correlationId();

        VmAggregate vm;
        try {
            Cancellation.checkpoint();
            List<StoredEvent> history = eventLog.load(vmId);
            if (history.isEmpty()) {
                log.warn("VM not found for request: requestId={} vmId={} correlationId={}", requestId, vmId, correlationId);
                return ProcessStepOutcome.SOURCE_MISSING;
            }
            vm = VmAggregate.reconstitute(vmId, history.stream().map(deserializer::deserialize).collect(Collectors.toList()));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to load VM: vmId={} requestId={} correlationId={}", vmId, requestId, correlationId, e);
            return ProcessStepOutcome.LOAD_FAILED;
        }

        if (vm.getStatus() != VmStatus.PROVISIONING) {
            log.info("VM already {}, skipping provisioning: vmId={} requestId={}", vm.getStatus(), vmId, requestId);
            return ProcessStepOutcome.SKIPPED;
        }

        UUID tenantId = vm.getTenantId();
        UUID userId = trigger.metadata().userId();
        VmSpec spec = VmSpec.of(vm.getVmName().value(), vm.getSize(), template);
        Consumer<VmProvisioningStage> onProgress = stage ->
            recordProgress(new UpdateVmProgressCommand(tenantId, userId, correlationId, vmId, stage));

        log.info("Provisioning VM: vmId={} requestId={} vmName={} correlationId={}", vmId, requestId, spec.name(), correlationId);
        Result<VmProvisioningResult, ProvisioningFailure> result =
            provisioningService.createVmWithRetry(spec, correlationId, onProgress);

        if (result.isSuccess()) {
            VmProvisioningResult provisioned = result.getOrNull();
            boolean vmRecorded = dispatch(new MarkVmProvisionedCommand(
                tenantId, userId, correlationId, vmId,
                provisioned.vmwareVmId(), provisioned.ipAddress(), provisioned.hostname(), provisioned.warningMessage()
            ), requestId, vmId);
            boolean requestRecorded = dispatch(new MarkVmRequestReadyCommand(
                tenantId, userId, correlationId, requestId,
                provisioned.vmwareVmId(), provisioned.ipAddress(), provisioned.hostname()
            ), requestId, vmId);
            return vmRecorded && requestRecorded ? ProcessStepOutcome.DISPATCHED : ProcessStepOutcome.DISPATCH_FAILED;
        }

        ProvisioningFailure failure = result.errorOrNull();
        log.warn("Provisioning failed: vmId={} requestId={} errorCode={} error={}",
            vmId, requestId, failure.errorCode(), failure.message());
        boolean vmRecorded = dispatch(new MarkVmFailedCommand(
            tenantId, userId, correlationId, vmId, failure.message(), failure.errorCode().name()
        ), requestId, vmId);
        boolean requestRecorded = dispatch(new MarkVmRequestFailedCommand(
            tenantId, userId, correlationId, requestId, failure.userMessage(), failure.errorCode().name()
        ), requestId, vmId);
        return vmRecorded && requestRecorded ? ProcessStepOutcome.DISPATCHED : ProcessStepOutcome.DISPATCH_FAILED;
    }

    private void recordProgress(UpdateVmProgressCommand command) {
        try {
            Result<?, ?> result = commandHandlers.dispatch(command);
            if (result.isFailure()) {
                log.warn("Failed to record provisioning stage {}: vmId={} error={}", command.stage(), command.vmId(), result.errorOrNull());
            }
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Failed to record provisioning stage {}: vmId={}", command.stage(), command.vmId(), e);
        }
    }

    private boolean dispatch(DomainCommand command, UUID requestId, UUID vmId) {
        String commandName = command.getClass().getSimpleName();
        try {
            Result<?, ?> result = commandHandlers.dispatch(command);
            if (result.isSuccess()) {
                return true;
            }
            log.error("CRITICAL: {} failed after provisioning, system may be inconsistent: requestId={} vmId={} error={}",
                commandName, requestId, vmId, result.errorOrNull());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("CRITICAL: {} threw after provisioning, system may be inconsistent: requestId={} vmId={}",
                commandName, requestId, vmId, e);
        }
        return false;
    }
}
