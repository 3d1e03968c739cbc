package com.acme.dcm.domain.model.vmrequest;

import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestApproved;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestCancelled;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestCreated;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestProvisioningFailed;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestProvisioningStarted;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestReady;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestRejected;
import com.acme.sourcing.aggregate.AggregateRoot;
import com.acme.sourcing.event.EventMetadata;
import lombok.Getter;

import java.util.List;
import java.util.UUID;

/**
 * Aggregate root for a VM request.
 *
 * <pre>
 * PENDING -> APPROVED | REJECTED | CANCELLED
 * APPROVED -> PROVISIONING -> READY | FAILED
 * </pre>
 */
@Getter
public class VmRequestAggregate extends AggregateRoot<VmRequestEvent> {
    public static final int MIN_JUSTIFICATION_LENGTH = 10;
    public static final int MIN_REJECTION_REASON_LENGTH = 10;
    public static final int MAX_REASON_LENGTH = 500;

    private final UUID id;
    private UUID tenantId;
    private UUID requesterId;
    private UUID projectId;
    private VmName vmName;
    private VmSize size;
    private String justification;
    private String requesterEmail;
    private VmRequestStatus status;
    private UUID approvedBy;
    private String rejectionReason;
    private String cancellationReason;
    private String failureReason;
    private String failureErrorCode;
    private String vmwareVmId;
    private String ipAddress;
    private String hostname;

    private VmRequestAggregate(UUID id) {
        this.id = id;
    }

    public static VmRequestAggregate create(
        UUID id,
        UUID projectId,
        VmName vmName,
        VmSize size,
        String justification,
        String requesterEmail,
        EventMetadata metadata
    ) {
        if (id == null || projectId == null) {
            throw new IllegalArgumentException("Request ID and project ID cannot be null");
        }
        if (size == null) {
            throw new IllegalArgumentException("VM size cannot be null");
        }
        if (justification == null || justification.trim().length() < MIN_JUSTIFICATION_LENGTH) {
            throw new IllegalArgumentException(
                "Justification must be at least " + MIN_JUSTIFICATION_LENGTH + " characters"
            );
        }
        VmRequestAggregate request = new VmRequestAggregate(id);
        request.applyEvent(new VmRequestCreated(
            id, projectId, vmName.value(), size, justification.trim(), requesterEmail, metadata
        ));
        return request;
    }

    public static VmRequestAggregate reconstitute(UUID id, List<VmRequestEvent> history) {
        VmRequestAggregate request = new VmRequestAggregate(id);
        request.loadFromHistory(history);
        return request;
    }

    @Override
    public String getAggregateType() {
        return VmRequestEvent.AGGREGATE_TYPE;
    }

    /**
     * Cancel a pending request. Cancelling an already cancelled request records nothing.
     */
    public void cancel(String reason, EventMetadata metadata) {
        if (status == VmRequestStatus.CANCELLED) {
            return;
        }
        requireStatus(VmRequestStatus.PENDING, "cancel");
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            throw new IllegalArgumentException("Cancellation reason must not exceed " + MAX_REASON_LENGTH + " characters");
        }
        applyEvent(new VmRequestCancelled(id, reason, metadata));
    }

    public void approve(UUID adminId, EventMetadata metadata) {
        requireNotRequester(adminId, "approve");
        requireStatus(VmRequestStatus.PENDING, "approve");
        applyEvent(new VmRequestApproved(id, metadata));
    }

    public void reject(UUID adminId, String reason, EventMetadata metadata) {
        requireNotRequester(adminId, "reject");
        requireStatus(VmRequestStatus.PENDING, "reject");
        if (reason == null || reason.trim().length() < MIN_REJECTION_REASON_LENGTH
            || reason.trim().length() > MAX_REASON_LENGTH) {
            throw new IllegalArgumentException(
                "Rejection reason must be between " + MIN_REJECTION_REASON_LENGTH + " and " + MAX_REASON_LENGTH + " characters"
            );
        }
        applyEvent(new VmRequestRejected(id, reason.trim(), metadata));
    }

    public void markProvisioning(EventMetadata metadata) {
        requireStatus(VmRequestStatus.APPROVED, "start provisioning");
        applyEvent(new VmRequestProvisioningStarted(id, metadata));
    }

    public void markReady(String vmwareVmId, String ipAddress, String hostname, EventMetadata metadata) {
        requireStatus(VmRequestStatus.PROVISIONING, "mark ready");
        applyEvent(new VmRequestReady(id, vmwareVmId, ipAddress, hostname, metadata));
    }

    public void markFailed(String reason, String errorCode, EventMetadata metadata) {
        requireStatus(VmRequestStatus.PROVISIONING, "mark failed");
        applyEvent(new VmRequestProvisioningFailed(id, reason, errorCode, metadata));
    }

    private void requireStatus(VmRequestStatus expected, String operation) {
        if (status != expected) {
            throw new InvalidStateException(String.valueOf(status), expected.name(), operation);
        }
    }

    private void requireNotRequester(UUID adminId, String operation) {
        if (requesterId.equals(adminId)) {
            throw new SelfApprovalException(id, adminId, operation);
        }
    }

    @Override
    protected void handle(VmRequestEvent event) {
        if (event instanceof VmRequestCreated) {
            VmRequestCreated e = (VmRequestCreated) event;
            tenantId = e.metadata().tenantId();
            requesterId = e.metadata().userId();
            projectId = e.projectId();
            vmName = VmName.of(e.vmName());
            size = e.size();
            justification = e.justification();
            requesterEmail = e.requesterEmail();
            status = VmRequestStatus.PENDING;
        } else if (event instanceof VmRequestCancelled) {
            cancellationReason = ((VmRequestCancelled) event).reason();
            status = VmRequestStatus.CANCELLED;
        } else if (event instanceof VmRequestApproved) {
            approvedBy = event.metadata().userId();
            status = VmRequestStatus.APPROVED;
        } else if (event instanceof VmRequestRejected) {
            rejectionReason = ((VmRequestRejected) event).reason();
            status = VmRequestStatus.REJECTED;
        } else if (event instanceof VmRequestProvisioningStarted) {
            status = VmRequestStatus.PROVISIONING;
        } else if (event instanceof VmRequestReady) {
            VmRequestReady e = (VmRequestReady) event;
            vmwareVmId = e.vmwareVmId();
            ipAddress = e.ipAddress();
            hostname = e.hostname();
            status = VmRequestStatus.READY;
        } else if (event instanceof VmRequestProvisioningFailed) {
            VmRequestProvisioningFailed e = (VmRequestProvisioningFailed) event;
            failureReason = e.reason();
            failureErrorCode = e.errorCode();
            status = VmRequestStatus.FAILED;
        }
    }

    /**
     * Exception thrown when a requester tries to approve or reject their own request
     */
    @Getter
    public static class SelfApprovalException extends RuntimeException {
        private final UUID requestId;
        private final UUID userId;

        public SelfApprovalException(UUID requestId, UUID userId, String operation) {
            super("Requester cannot " + operation + " their own request " + requestId);
            this.requestId = requestId;
            this.userId = userId;
        }
    }
}
