package com.acme.dcm.config;

import com.acme.dcm.application.vm.TriggerProvisioningHandler;
import com.acme.dcm.application.vm.VmProvisioningProcessManager;
import com.acme.dcm.application.vm.VmRequestStatusUpdater;
import com.acme.dcm.domain.model.vm.VmEvent.VmProvisioningStarted;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestApproved;
import com.acme.dcm.domain.model.vmrequest.VmRequestEvent.VmRequestProvisioningStarted;
import com.acme.sourcing.event.AsyncEventDispatcher;
import io.micronaut.context.annotation.Context;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires the provisioning chain onto the event dispatcher at startup:
 * approved request, VM created, request provisioning, hypervisor call.
 */
@Slf4j
@Context
@RequiredArgsConstructor
public class ProvisioningListeners {

    private final AsyncEventDispatcher dispatcher;
    private final VmProvisioningProcessManager provisioningProcessManager;
    private final VmRequestStatusUpdater requestStatusUpdater;
    private final TriggerProvisioningHandler triggerProvisioningHandler;

    @PostConstruct
    public void subscribe() {
        dispatcher.subscribe(VmRequestApproved.class, provisioningProcessManager::onEvent);
        dispatcher.subscribe(VmProvisioningStarted.class, requestStatusUpdater::onEvent);
        dispatcher.subscribe(VmRequestProvisioningStarted.class, triggerProvisioningHandler::onEvent);
        log.info("Provisioning listeners subscribed");
    }
}
