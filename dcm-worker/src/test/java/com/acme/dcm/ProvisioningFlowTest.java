package com.acme.dcm;

import com.acme.dcm.application.command.ApproveVmRequestCommand;
import com.acme.dcm.application.command.RejectVmRequestCommand;
import com.acme.dcm.application.vm.HypervisorError;
import com.acme.dcm.application.vmrequest.VmRequestProjection;
import com.acme.dcm.config.ProvisioningListeners;
import com.acme.dcm.config.ProvisioningTimeouts;
import com.acme.dcm.domain.model.vm.VmAggregate;
import com.acme.dcm.domain.model.vm.VmStatus;
import com.acme.dcm.domain.model.vmrequest.VmRequestStatus;
import com.acme.dcm.infrastructure.hypervisor.SimulatedHypervisorAdapter;
import com.acme.dcm.support.DcmTestHarness;
import com.acme.sourcing.config.RetryConfig;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.AsyncEventDispatcher;
import com.acme.sourcing.resilience.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the whole chain from approval to a finished VM with events delivered on the calling thread.
 */
@DisplayName("Provisioning flow")
class ProvisioningFlowTest {

    private final List<Duration> waits = new ArrayList<>();
    private DcmTestHarness harness;
    private SimulatedHypervisorAdapter hypervisor;
    private UUID tenantId;
    private UUID adminId;
    private UUID requestId;

    @BeforeEach
    void setUp() {
        AsyncEventDispatcher dispatcher = new AsyncEventDispatcher(Runnable::run);
        harness = new DcmTestHarness(dispatcher);
        Sleeper sleeper = waits::add;
        hypervisor = new SimulatedHypervisorAdapter(new ProvisioningTimeouts(), Duration.ZERO, Duration.ZERO, sleeper);
        new ProvisioningListeners(
            dispatcher,
            harness.provisioningProcessManager(),
            harness.requestStatusUpdater(),
            harness.triggerProvisioning(hypervisor, new RetryConfig(), sleeper)
        ).subscribe();

        tenantId = UUID.randomUUID();
        adminId = UUID.randomUUID();
        UUID projectId = harness.givenProject(tenantId, adminId, "Checkout");
        requestId = harness.givenRequest(tenantId, UUID.randomUUID(), projectId, "api-01");
    }

    private Result<UUID, ?> approve() {
        return harness.approveRequest.handle(new ApproveVmRequestCommand(tenantId, adminId, UUID.randomUUID(), requestId, null));
    }

    private VmRequestProjection row() {
        return harness.requests.findById(requestId).orElseThrow();
    }

    @Test
    @DisplayName("approval should end with a ready VM and a ready request")
    void testHappyPath() {
        // When
        assertThat(approve().isSuccess()).isTrue();

        // Then
        VmAggregate vm = harness.loadVmForRequest(requestId);
        assertThat(vm.getStatus()).isEqualTo(VmStatus.READY);
        assertThat(vm.getVmwareVmId()).isEqualTo("vm-1001");
        assertThat(harness.eventTypes(vm.getId())).containsExactly(
            "VmProvisioningStarted",
            "VmProvisioningProgressUpdated",
            "VmProvisioningProgressUpdated",
            "VmProvisioningProgressUpdated",
            "VmProvisioningProgressUpdated",
            "VmProvisioningProgressUpdated",
            "VmProvisioned"
        );
        assertThat(harness.eventTypes(requestId)).containsExactly(
            "VmRequestCreated", "VmRequestApproved", "VmRequestProvisioningStarted", "VmRequestReady");
        assertThat(row().status()).isEqualTo(VmRequestStatus.READY);
        assertThat(row().vmwareVmId()).isEqualTo("vm-1001");
        assertThat(row().hostname()).isEqualTo("api-01");
        assertThat(harness.progress.findByVmId(vm.getId())).isEmpty();
        assertThat(hypervisor.getInvocationCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("transient errors should be retried until the VM is created")
    void testTransientRecovery() {
        // Given
        hypervisor.failNextCalls(
            new HypervisorError.ConnectionError("Connection reset"),
            new HypervisorError.ConnectionError("Connection reset"));

        // When
        approve();

        // Then
        assertThat(row().status()).isEqualTo(VmRequestStatus.READY);
        assertThat(hypervisor.getInvocationCount()).isEqualTo(3);
        assertThat(waits).containsExactly(Duration.ofSeconds(10), Duration.ofSeconds(20));
    }

    @Test
    @DisplayName("a missing template should fail the request without retry")
    void testPermanentFailure() {
        // Given
        hypervisor.failNextCalls(new HypervisorError.ResourceNotFound("Template", "ubuntu-22.04-template"));

        // When
        approve();

        // Then
        assertThat(harness.loadVmForRequest(requestId).getStatus()).isEqualTo(VmStatus.FAILED);
        assertThat(row().status()).isEqualTo(VmRequestStatus.FAILED);
        assertThat(row().statusReason()).isEqualTo("VM template missing. IT has been notified.");
        assertThat(hypervisor.getInvocationCount()).isEqualTo(1);
        assertThat(waits).isEmpty();
    }

    @Test
    @DisplayName("persistent transient errors should fail the request after all attempts")
    void testRetriesExhausted() {
        // Given
        for (int i = 0; i < 5; i++) {
            hypervisor.failNextCalls(new HypervisorError.ResourceExhausted("Cluster full", "memory", 8, 2));
        }

        // When
        approve();

        // Then
        VmAggregate vm = harness.loadVmForRequest(requestId);
        assertThat(vm.getStatus()).isEqualTo(VmStatus.FAILED);
        assertThat(vm.getFailureReason()).isEqualTo("Provisioning failed after 5 attempts: Cluster full");
        assertThat(row().statusReason()).isEqualTo("Cluster capacity reached. Please try a smaller size or contact support.");
        assertThat(hypervisor.getInvocationCount()).isEqualTo(5);
        assertThat(waits).hasSize(4);
    }

    @Test
    @DisplayName("a rejected request should never reach the hypervisor")
    void testRejected() {
        // When
        harness.rejectRequest.handle(new RejectVmRequestCommand(
            tenantId, adminId, UUID.randomUUID(), requestId, "Not in this quarter's budget", null));

        // Then
        assertThat(harness.eventLog.load(VmAggregate.idForRequest(requestId))).isEmpty();
        assertThat(hypervisor.getInvocationCount()).isZero();
        assertThat(row().status()).isEqualTo(VmRequestStatus.REJECTED);
    }
}
