package com.acme.dcm.domain.model.vm;

import com.acme.dcm.domain.model.vmrequest.VmSize;
import com.acme.sourcing.event.DomainEvent;
import com.acme.sourcing.event.EventMetadata;

import java.util.UUID;

/**
 * Events of the Vm stream.
 */
public sealed interface VmEvent extends DomainEvent {

    String AGGREGATE_TYPE = "Vm";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }

    UUID requestId();

    record VmProvisioningStarted(
        UUID aggregateId,
        UUID requestId,
        UUID projectId,
        String vmName,
        VmSize size,
        UUID requesterId,
        EventMetadata metadata
    ) implements VmEvent {}

    record VmProvisioningProgressUpdated(
        UUID aggregateId,
        UUID requestId,
        VmProvisioningStage stage,
        String details,
        EventMetadata metadata
    ) implements VmEvent {}

    record VmProvisioned(
        UUID aggregateId,
        UUID requestId,
        String vmwareVmId,
        String ipAddress,
        String hostname,
        String warningMessage,
        EventMetadata metadata
    ) implements VmEvent {}

    record VmProvisioningFailed(
        UUID aggregateId,
        UUID requestId,
        String reason,
        String errorCode,
        EventMetadata metadata
    ) implements VmEvent {}
}
