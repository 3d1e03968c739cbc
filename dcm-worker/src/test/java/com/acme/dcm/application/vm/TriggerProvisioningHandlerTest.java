package com.acme.dcm.application.vm;

import com.acme.dcm.application.vmrequest.VmRequestProjection;
import com.acme.dcm.domain.model.vm.VmAggregate;
import com.acme.dcm.domain.model.vm.VmEvent.VmProvisioningStarted;
import com.acme.dcm.domain.model.vm.VmProvisioningStage;
import com.acme.dcm.domain.model.vm.VmStatus;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestApproved;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestProvisioningStarted;
import com.acme.dcm.domain.model.vmrequest.VmRequestStatus;
import com.acme.dcm.support.DcmTestHarness;
import com.acme.sourcing.config.RetryConfig;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventMetadata;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.process.ProcessStepOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TriggerProvisioningHandler")
class TriggerProvisioningHandlerTest {

    @Mock
    private HypervisorPort hypervisorPort;

    private DcmTestHarness harness;
    private TriggerProvisioningHandler trigger;
    private UUID tenantId;
    private UUID adminId;
    private UUID requestId;
    private UUID vmId;

    @BeforeEach
    void setUp() {
        harness = new DcmTestHarness(EventPublisher.noop());
        trigger = harness.triggerProvisioning(hypervisorPort, new RetryConfig(), duration -> { });
        tenantId = UUID.randomUUID();
        adminId = UUID.randomUUID();
        UUID projectId = harness.givenProject(tenantId, adminId, "Analytics");
        requestId = harness.givenRequest(tenantId, UUID.randomUUID(), projectId, "etl-01");
        vmId = VmAggregate.idForRequest(requestId);
    }

    private void givenProvisioningStarted() {
        harness.givenApproved(tenantId, adminId, requestId);
        harness.provisioningProcessManager().onEvent(
            new VmRequestApproved(requestId, EventMetadata.create(tenantId, adminId, UUID.randomUUID())));
        VmProvisioningStarted started =
            (VmProvisioningStarted) harness.vmDeserializer.deserialize(harness.eventLog.load(vmId).get(0));
        harness.requestStatusUpdater().onEvent(started);
    }

    private VmRequestProvisioningStarted provisioningTrigger() {
        return new VmRequestProvisioningStarted(requestId, EventMetadata.create(tenantId, adminId, UUID.randomUUID()));
    }

    private static Result<VmProvisioningResult, HypervisorError> failed(HypervisorError error) {
        return Result.failure(error);
    }

    @Test
    @DisplayName("should record success on both the VM and the request")
    void testSuccess() {
        // Given
        givenProvisioningStarted();
        Result<VmProvisioningResult, HypervisorError> created =
            Result.success(new VmProvisioningResult("vm-1001", "10.0.0.2", "etl-01", null));
        when(hypervisorPort.createVm(any(), any())).thenReturn(created);

        // When
        ProcessStepOutcome outcome = trigger.onEvent(provisioningTrigger());

        // Then
        assertThat(outcome).isEqualTo(ProcessStepOutcome.DISPATCHED);
        VmAggregate vm = harness.loadVmForRequest(requestId);
        assertThat(vm.getStatus()).isEqualTo(VmStatus.READY);
        assertThat(vm.getVmwareVmId()).isEqualTo("vm-1001");
        VmRequestProjection row = harness.requests.findById(requestId).orElseThrow();
        assertThat(row.status()).isEqualTo(VmRequestStatus.READY);
        assertThat(row.ipAddress()).isEqualTo("10.0.0.2");
        assertThat(harness.progress.findByVmId(vmId)).isEmpty();
    }

    @Test
    @DisplayName("should request the size and configured template")
    void testSpec() {
        // Given
        givenProvisioningStarted();
        when(hypervisorPort.createVm(any(), any())).thenReturn(failed(new HypervisorError.AuthenticationError("denied")));

        // When
        trigger.onEvent(provisioningTrigger());

        // Then
        verify(hypervisorPort).createVm(eq(new VmSpec("etl-01", "ubuntu-22.04-template", 4, 8, 100)), any());
    }

    @Test
    @DisplayName("should record a permanent failure with the user-facing message")
    void testPermanentFailure() {
        // Given
        givenProvisioningStarted();
        when(hypervisorPort.createVm(any(), any()))
            .thenReturn(failed(new HypervisorError.ResourceNotFound("Template", "ubuntu-22.04-template")));

        // When
        ProcessStepOutcome outcome = trigger.onEvent(provisioningTrigger());

        // Then
        assertThat(outcome).isEqualTo(ProcessStepOutcome.DISPATCHED);
        VmAggregate vm = harness.loadVmForRequest(requestId);
        assertThat(vm.getStatus()).isEqualTo(VmStatus.FAILED);
        assertThat(vm.getFailureReason()).isEqualTo("Template not found: ubuntu-22.04-template");
        VmRequestProjection row = harness.requests.findById(requestId).orElseThrow();
        assertThat(row.status()).isEqualTo(VmRequestStatus.FAILED);
        assertThat(row.statusReason()).isEqualTo("VM template missing. IT has been notified.");
        verify(hypervisorPort, times(1)).createVm(any(), any());
    }

    @Test
    @DisplayName("should record each reported stage on the VM")
    void testProgress() {
        // Given
        givenProvisioningStarted();
        when(hypervisorPort.createVm(any(), any())).thenAnswer(invocation -> {
            Consumer<VmProvisioningStage> onProgress = invocation.getArgument(1);
            onProgress.accept(VmProvisioningStage.CLONING);
            onProgress.accept(VmProvisioningStage.POWERING_ON);
            return failed(new HypervisorError.InvalidConfiguration("Too many CPUs", "cpu"));
        });

        // When
        trigger.onEvent(provisioningTrigger());

        // Then
        assertThat(harness.eventTypes(vmId)).containsExactly(
            "VmProvisioningStarted", "VmProvisioningProgressUpdated", "VmProvisioningProgressUpdated", "VmProvisioningFailed");
    }

    @Test
    @DisplayName("should skip a VM that is no longer provisioning")
    void testSkipFinishedVm() {
        // Given
        givenProvisioningStarted();
        Result<VmProvisioningResult, HypervisorError> created =
            Result.success(new VmProvisioningResult("vm-1001", "10.0.0.2", "etl-01", null));
        when(hypervisorPort.createVm(any(), any())).thenReturn(created);
        trigger.onEvent(provisioningTrigger());

        // When
        ProcessStepOutcome outcome = trigger.onEvent(provisioningTrigger());

        // Then
        assertThat(outcome).isEqualTo(ProcessStepOutcome.SKIPPED);
        verify(hypervisorPort, times(1)).createVm(any(), any());
    }

    @Test
    @DisplayName("should report a request without a VM")
    void testSourceMissing() {
        // When
        ProcessStepOutcome outcome = trigger.onEvent(provisioningTrigger());

        // Then
        assertThat(outcome).isEqualTo(ProcessStepOutcome.SOURCE_MISSING);
        verifyNoInteractions(hypervisorPort);
    }
}
