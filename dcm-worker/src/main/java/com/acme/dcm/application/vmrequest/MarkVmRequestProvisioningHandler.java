package com.acme.dcm.application.vmrequest;

import com.acme.dcm.application.command.MarkVmRequestProvisioningCommand;
import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vmrequest.VmRequestAggregate;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventDeserializer;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.store.EventLog;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.UUID;

/**
 * Moves an approved request to PROVISIONING once its VM aggregate exists.
 */
@Singleton
public class MarkVmRequestProvisioningHandler extends VmRequestCommandHandler<MarkVmRequestProvisioningCommand, UUID> {

    public MarkVmRequestProvisioningHandler(
        EventLog eventLog,
        EventDeserializer<VmRequestEvent> deserializer,
        EventPublisher eventPublisher,
        VmRequestProjectionUpdater projectionUpdater,
        TimelineEventProjectionUpdater timelineUpdater,
        VmRequestNotificationSender notificationSender
    ) {
        super(eventLog, deserializer, eventPublisher, projectionUpdater, timelineUpdater, notificationSender);
    }

    @Override
    protected UUID aggregateId(MarkVmRequestProvisioningCommand command) {
        return command.requestId();
    }

    @Override
    protected Result<UUID, VmRequestCommandError> execute(VmRequestAggregate request, MarkVmRequestProvisioningCommand command) {
        try {
            request.markProvisioning(command.metadata());
        } catch (InvalidStateException e) {
            return Result.failure(invalidState(e));
        }
        return Result.success(request.getId());
    }

    @Override
    protected void project(VmRequestAggregate request, MarkVmRequestProvisioningCommand command, List<VmRequestEvent> committed) {
        projectStatus(request, null, committed);
        recordTimeline(request, TimelineEventType.PROVISIONING_STARTED, null, null, committed);
    }
}
