package com.acme.dcm.application.vm;

import com.acme.dcm.domain.model.vm.VmAggregate;
import com.acme.dcm.domain.model.vm.VmEvent.VmProvisioningStarted;
import com.acme.dcm.domain.model.vm.VmProvisioningStage;
import com.acme.dcm.domain.model.vm.VmStatus;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestApproved;
import com.acme.dcm.domain.model.vmrequest.VmRequestStatus;
import com.acme.dcm.support.DcmTestHarness;
import com.acme.sourcing.event.EventMetadata;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.process.ProcessStepOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Provisioning process steps")
class VmProvisioningProcessManagerTest {

    private DcmTestHarness harness;
    private VmProvisioningProcessManager processManager;
    private VmRequestStatusUpdater statusUpdater;
    private UUID tenantId;
    private UUID adminId;
    private UUID requestId;

    @BeforeEach
    void setUp() {
        harness = new DcmTestHarness(EventPublisher.noop());
        processManager = harness.provisioningProcessManager();
        statusUpdater = harness.requestStatusUpdater();
        tenantId = UUID.randomUUID();
        adminId = UUID.randomUUID();
        UUID projectId = harness.givenProject(tenantId, adminId, "Platform");
        requestId = harness.givenRequest(tenantId, UUID.randomUUID(), projectId, "db-01");
    }

    private VmRequestApproved approvedTrigger() {
        return new VmRequestApproved(requestId, EventMetadata.create(tenantId, adminId, UUID.randomUUID()));
    }

    private VmProvisioningStarted startedTrigger() {
        UUID vmId = VmAggregate.idForRequest(requestId);
        return (VmProvisioningStarted) harness.vmDeserializer.deserialize(harness.eventLog.load(vmId).get(0));
    }

    @Nested
    @DisplayName("VmProvisioningProcessManager")
    class ProvisioningStart {

        @Test
        @DisplayName("should start provisioning for an approved request")
        void testDispatch() {
            // Given
            harness.givenApproved(tenantId, adminId, requestId);

            // When
            ProcessStepOutcome outcome = processManager.onEvent(approvedTrigger());

            // Then
            assertThat(outcome).isEqualTo(ProcessStepOutcome.DISPATCHED);
            VmAggregate vm = harness.loadVmForRequest(requestId);
            assertThat(vm.getStatus()).isEqualTo(VmStatus.PROVISIONING);
            assertThat(vm.getTenantId()).isEqualTo(tenantId);
            assertThat(vm.getVmName().value()).isEqualTo("db-01");
            assertThat(harness.progress.findByVmId(vm.getId()))
                .hasValueSatisfying(p -> assertThat(p.stage()).isEqualTo(VmProvisioningStage.CREATED));
        }

        @Test
        @DisplayName("should skip a request that is not approved")
        void testSkipPending() {
            // When
            ProcessStepOutcome outcome = processManager.onEvent(approvedTrigger());

            // Then
            assertThat(outcome).isEqualTo(ProcessStepOutcome.SKIPPED);
            assertThat(harness.eventLog.load(VmAggregate.idForRequest(requestId))).isEmpty();
        }

        @Test
        @DisplayName("should report a missing request")
        void testSourceMissing() {
            // Given
            VmRequestApproved trigger = new VmRequestApproved(UUID.randomUUID(), EventMetadata.create(tenantId, adminId, UUID.randomUUID()));

            // When / Then
            assertThat(processManager.onEvent(trigger)).isEqualTo(ProcessStepOutcome.SOURCE_MISSING);
        }

        @Test
        @DisplayName("a redelivered approval should not create a second VM")
        void testDuplicateDelivery() {
            // Given
            harness.givenApproved(tenantId, adminId, requestId);
            processManager.onEvent(approvedTrigger());

            // When
            ProcessStepOutcome outcome = processManager.onEvent(approvedTrigger());

            // Then
            assertThat(outcome).isEqualTo(ProcessStepOutcome.DISPATCH_FAILED);
            assertThat(harness.eventTypes(VmAggregate.idForRequest(requestId))).containsExactly("VmProvisioningStarted");
        }
    }

    @Nested
    @DisplayName("VmRequestStatusUpdater")
    class StatusUpdate {

        @Test
        @DisplayName("should move the request to PROVISIONING once the VM exists")
        void testDispatch() {
            // Given
            harness.givenApproved(tenantId, adminId, requestId);
            processManager.onEvent(approvedTrigger());

            // When
            ProcessStepOutcome outcome = statusUpdater.onEvent(startedTrigger());

            // Then
            assertThat(outcome).isEqualTo(ProcessStepOutcome.DISPATCHED);
            assertThat(harness.loadRequest(requestId).getStatus()).isEqualTo(VmRequestStatus.PROVISIONING);
            assertThat(harness.requests.findById(requestId).orElseThrow().status()).isEqualTo(VmRequestStatus.PROVISIONING);
        }

        @Test
        @DisplayName("should skip when the request already moved on")
        void testSkipDuplicate() {
            // Given
            harness.givenApproved(tenantId, adminId, requestId);
            processManager.onEvent(approvedTrigger());
            statusUpdater.onEvent(startedTrigger());

            // When
            ProcessStepOutcome outcome = statusUpdater.onEvent(startedTrigger());

            // Then
            assertThat(outcome).isEqualTo(ProcessStepOutcome.SKIPPED);
            assertThat(harness.eventTypes(requestId))
                .containsExactly("VmRequestCreated", "VmRequestApproved", "VmRequestProvisioningStarted");
        }
    }
}
