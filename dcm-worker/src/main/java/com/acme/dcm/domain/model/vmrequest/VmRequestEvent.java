package com.acme.dcm.domain.model.vmrequest;

import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.EventMetadata;

import java.util.UUID;

/**
 * Events of the VmRequest stream.
 */
public sealed interface VmRequestEvent extends DomainEvent {

    String AGGREGATE_TYPE = "VmRequest";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }

    record VmRequestCreated(
        UUID aggregateId,
        UUID projectId,
        String vmName,
        VmSize size,
        String justification,
        String requesterEmail,
        EventMetadata metadata
    ) implements VmRequestEvent {}

    record VmRequestCancelled(UUID aggregateId, String reason, EventMetadata metadata) implements VmRequestEvent {}

    record VmRequestApproved(UUID aggregateId, EventMetadata metadata) implements VmRequestEvent {}

    record VmRequestRejected(UUID aggregateId, String reason, EventMetadata metadata) implements VmRequestEvent {}

    record VmRequestProvisioningStarted(UUID aggregateId, EventMetadata metadata) implements VmRequestEvent {}

    record VmRequestReady(
        UUID aggregateId,
        String vmwareVmId,
        String ipAddress,
        String hostname,
        EventMetadata metadata
    ) implements VmRequestEvent {}

    record VmRequestProvisioningFailed(
        UUID aggregateId,
        String reason,
        String errorCode,
        EventMetadata metadata
    ) implements VmRequestEvent {}
}
