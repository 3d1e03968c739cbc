package com.acme.dcm.domain.model.vmrequest;

import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vmrequest.VmRequestAggregate.SelfApprovalException;
import com.acme.sourcing.event.EventMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("VmRequestAggregate")
class VmRequestAggregateTest {

    private UUID tenantId;
    private UUID requesterId;
    private EventMetadata requester;
    private EventMetadata admin;
    private UUID adminId;
    private VmRequestAggregate request;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        requesterId = UUID.randomUUID();
        adminId = UUID.randomUUID();
        requester = EventMetadata.create(tenantId, requesterId, UUID.randomUUID());
        admin = EventMetadata.create(tenantId, adminId, UUID.randomUUID());
        request = VmRequestAggregate.create(
            UUID.randomUUID(), UUID.randomUUID(), VmName.of("web-01"), VmSize.M,
            "  Load testing environment  ", "dev@example.com", requester
        );
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("should start PENDING with the issuing user as requester")
        void testCreate() {
            assertThat(request.getStatus()).isEqualTo(VmRequestStatus.PENDING);
            assertThat(request.getRequesterId()).isEqualTo(requesterId);
            assertThat(request.getJustification()).isEqualTo("Load testing environment");
            assertThat(request.getVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject a short justification")
        void testShortJustification() {
            assertThatThrownBy(() -> VmRequestAggregate.create(
                UUID.randomUUID(), UUID.randomUUID(), VmName.of("web-01"), VmSize.S, "too short", null, requester
            )).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("at least 10");
        }

        @Test
        @DisplayName("VM names should be DNS-style labels")
        void testVmName() {
            assertThat(VmName.of("db-primary-2").value()).isEqualTo("db-primary-2");
            assertThatThrownBy(() -> VmName.of("Web01")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> VmName.of("web-")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> VmName.of("1web")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> VmName.of("ab")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("approval")
    class Approval {

        @Test
        @DisplayName("requester cannot approve or reject their own request")
        void testSelfApproval() {
            assertThatThrownBy(() -> request.approve(requesterId, requester))
                .isInstanceOf(SelfApprovalException.class);
            assertThatThrownBy(() -> request.reject(requesterId, "Not needed anymore", requester))
                .isInstanceOf(SelfApprovalException.class);
        }

        @Test
        @DisplayName("approve should move PENDING to APPROVED and record the approver")
        void testApprove() {
            request.approve(adminId, admin);

            assertThat(request.getStatus()).isEqualTo(VmRequestStatus.APPROVED);
            assertThat(request.getApprovedBy()).isEqualTo(adminId);
        }

        @Test
        @DisplayName("approving twice should fail with the current state")
        void testApproveTwice() {
            request.approve(adminId, admin);

            assertThatThrownBy(() -> request.approve(adminId, admin))
                .isInstanceOfSatisfying(InvalidStateException.class, e -> {
                    assertThat(e.getCurrentState()).isEqualTo("APPROVED");
                    assertThat(e.getExpectedState()).isEqualTo("PENDING");
                });
        }

        @Test
        @DisplayName("reject should require a reason of 10 to 500 characters")
        void testRejectReason() {
            assertThatThrownBy(() -> request.reject(adminId, "short", admin))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> request.reject(adminId, "x".repeat(501), admin))
                .isInstanceOf(IllegalArgumentException.class);

            request.reject(adminId, "Budget exceeded for Q3", admin);

            assertThat(request.getStatus()).isEqualTo(VmRequestStatus.REJECTED);
            assertThat(request.getRejectionReason()).isEqualTo("Budget exceeded for Q3");
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("cancelling twice should record one event")
        void testIdempotentCancel() {
            request.cancel("No longer needed", requester);
            request.cancel("Still not needed", requester);

            assertThat(request.getStatus()).isEqualTo(VmRequestStatus.CANCELLED);
            assertThat(request.getUncommittedEvents()).hasSize(2);
            assertThat(request.getCancellationReason()).isEqualTo("No longer needed");
        }

        @Test
        @DisplayName("an approved request cannot be cancelled")
        void testCancelApproved() {
            request.approve(adminId, admin);

            assertThatThrownBy(() -> request.cancel("Changed my mind", requester))
                .isInstanceOf(InvalidStateException.class);
        }
    }

    @Nested
    @DisplayName("provisioning lifecycle")
    class Provisioning {

        @Test
        @DisplayName("should go APPROVED, PROVISIONING, READY with VM details")
        void testReady() {
            request.approve(adminId, admin);
            request.markProvisioning(admin);
            request.markReady("vm-1001", "10.0.0.3", "web-01", admin);

            assertThat(request.getStatus()).isEqualTo(VmRequestStatus.READY);
            assertThat(request.getVmwareVmId()).isEqualTo("vm-1001");
            assertThat(request.getIpAddress()).isEqualTo("10.0.0.3");
        }

        @Test
        @DisplayName("should record failure reason and code")
        void testFailed() {
            request.approve(adminId, admin);
            request.markProvisioning(admin);
            request.markFailed("Storage unavailable. Please contact support.", "DATASTORE_NOT_AVAILABLE", admin);

            assertThat(request.getStatus()).isEqualTo(VmRequestStatus.FAILED);
            assertThat(request.getFailureErrorCode()).isEqualTo("DATASTORE_NOT_AVAILABLE");
        }

        @Test
        @DisplayName("provisioning should require an approved request")
        void testProvisioningRequiresApproval() {
            assertThatThrownBy(() -> request.markProvisioning(admin)).isInstanceOf(InvalidStateException.class);
            assertThatThrownBy(() -> request.markReady("vm-1", "10.0.0.2", "h", admin))
                .isInstanceOf(InvalidStateException.class);
        }
    }
}
