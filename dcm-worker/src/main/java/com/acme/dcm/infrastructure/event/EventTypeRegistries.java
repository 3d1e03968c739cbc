package com.acme.dcm.infrastructure.event;

import com.acme.dcm.domain.model.project.ProjectEvent;
import com.acme.dcm.domain.model.vm.VmEvent;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent;
import com.acme.sourcing.event.EventTypeRegistry;

/**
 * The type tag of every event that can appear in the log. Tags are persisted: renaming an event
 * class needs an explicit registration under its old name.
 */
public final class EventTypeRegistries {

    private EventTypeRegistries() {}

    public static EventTypeRegistry<ProjectEvent> project() {
        return EventTypeRegistry.builder(ProjectEvent.class)
            .register(ProjectEvent.ProjectCreated.class)
            .register(ProjectEvent.ProjectUpdated.class)
            .register(ProjectEvent.ProjectArchived.class)
            .register(ProjectEvent.ProjectUnarchived.class)
            .register(ProjectEvent.UserAssignedToProject.class)
            .register(ProjectEvent.ProjectMemberRoleChanged.class)
            .register(ProjectEvent.UserRemovedFromProject.class)
            .build();
    }

    public static EventTypeRegistry<VmRequestEvent> vmRequest() {
        return EventTypeRegistry.builder(VmRequestEvent.class)
            .register(VmRequestEvent.VmRequestCreated.class)
            .register(VmRequestEvent.VmRequestCancelled.class)
            .register(VmRequestEvent.VmRequestApproved.class)
            .register(VmRequestEvent.VmRequestRejected.class)
            .register(VmRequestEvent.VmRequestProvisioningStarted.class)
            .register(VmRequestEvent.VmRequestReady.class)
            .register(VmRequestEvent.VmRequestProvisioningFailed.class)
            .build();
    }

    public static EventTypeRegistry<VmEvent> vm() {
        return EventTypeRegistry.builder(VmEvent.class)
            .register(VmEvent.VmProvisioningStarted.class)
            .register(VmEvent.VmProvisioningProgressUpdated.class)
            .register(VmEvent.VmProvisioned.class)
            .register(VmEvent.VmProvisioningFailed.class)
            .build();
    }
}
