package com.acme.dcm.domain.model.vm;

import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vm.VmEvent.VmProvisioned;
import com.acme.dcm.domain.model.vm.VmEvent.VmProvisioningFailed;
import com.acme.dcm.domain.model.vm.VmEvent.VmProvisioningProgressUpdated;
import com.acme.dcm.domain.model.vm.VmEvent.VmProvisioningStarted;
import com.acme.dcm.domain.model.vmrequest.VmName;
import com.acme.dcm.domain.model.vmrequest.VmSize;
import com.acme.sourcing.aggregate.AggregateRoot;
import com.acme.sourcing.event.EventMetadata;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate root for a provisioned VM. There is at most one VM per request: its id is derived from
 * the request id, so a second provisioning attempt for the same request collides on the event
 * log's version check.
 */
@Getter
public class VmAggregate extends AggregateRoot<VmEvent> {
    private final UUID id;
    private UUID requestId;
    private UUID projectId;
    private UUID tenantId;
    private UUID requesterId;
    private VmName vmName;
    private VmSize size;
    private VmStatus status;
    private VmProvisioningStage stage;
    private String vmwareVmId;
    private String ipAddress;
    private String hostname;
    private String warningMessage;
    private String failureReason;

    private VmAggregate(UUID id) {
        this.id = id;
    }

    public static UUID idForRequest(UUID requestId) {
        return UUID.nameUUIDFromBytes(("vm:" + requestId).getBytes(StandardCharsets.UTF_8));
    }

    public static VmAggregate startProvisioning(
        UUID requestId,
        UUID projectId,
        VmName vmName,
        VmSize size,
        UUID requesterId,
        EventMetadata metadata
    ) {
        UUID vmId = idForRequest(requestId);
        VmAggregate vm = new VmAggregate(vmId);
        vm.applyEvent(new VmProvisioningStarted(vmId, requestId, projectId, vmName.value(), size, requesterId, metadata));
        return vm;
    }

    public static VmAggregate reconstitute(UUID id, List<VmEvent> history) {
        VmAggregate vm = new VmAggregate(id);
        vm.loadFromHistory(history);
        return vm;
    }

    @Override
    public String getAggregateType() {
        return VmEvent.AGGREGATE_TYPE;
    }

    public void updateProgress(VmProvisioningStage newStage, EventMetadata metadata) {
        requireProvisioning("update progress");
        applyEvent(new VmProvisioningProgressUpdated(
            id, requestId, newStage, "Provisioning stage updated to " + newStage, metadata
        ));
    }

    public void markProvisioned(String vmwareVmId, String ipAddress, String hostname, String warningMessage, EventMetadata metadata) {
        requireProvisioning("mark provisioned");
        applyEvent(new VmProvisioned(id, requestId, vmwareVmId, ipAddress, hostname, warningMessage, metadata));
    }

    public void markFailed(String reason, String errorCode, EventMetadata metadata) {
        requireProvisioning("mark failed");
        applyEvent(new VmProvisioningFailed(id, requestId, reason, errorCode, metadata));
    }

    private void requireProvisioning(String operation) {
        if (status != VmStatus.PROVISIONING) {
            throw new InvalidStateException(String.valueOf(status), VmStatus.PROVISIONING.name(), operation);
        }
    }

    @Override
    protected void handle(VmEvent event) {
        if (event instanceof VmProvisioningStarted) {
            VmProvisioningStarted e = (VmProvisioningStarted) event;
            requestId = e.requestId();
            projectId = e.projectId();
            tenantId = e.metadata().tenantId();
            requesterId = e.requesterId();
            vmName = VmName.of(e.vmName());
            size = e.size();
            status = VmStatus.PROVISIONING;
            stage = VmProvisioningStage.CREATED;
        } else if (event instanceof VmProvisioningProgressUpdated) {
            stage = ((VmProvisioningProgressUpdated) event).stage();
        } else if (event instanceof VmProvisioned) {
            VmProvisioned e = (VmProvisioned) event;
            vmwareVmId = e.vmwareVmId();
            ipAddress = e.ipAddress();
            hostname = e.hostname();
            warningMessage = e.warningMessage();
            stage = VmProvisioningStage.READY;
            status = VmStatus.READY;
        } else if (event instanceof VmProvisioningFailed) {
            failureReason = ((VmProvisioningFailed) event).reason();
            status = VmStatus.FAILED;
        }
    }
}
