package com.acme.dcm.config;

import com.acme.dcm.application.command.ApproveVmRequestCommand;
import com.acme.dcm.application.command.ArchiveProjectCommand;
import com.acme.dcm.application.command.AssignUserToProjectCommand;
import com.acme.dcm.application.command.CancelVmRequestCommand;
import com.acme.dcm.application.command.CreateProjectCommand;
import com.acme.dcm.application.command.CreateVmRequestCommand;
import com.acme.dcm.application.command.MarkVmFailedCommand;
import com.acme.dcm.application.command.MarkVmProvisionedCommand;
import com.acme.dcm.application.command.MarkVmRequestFailedCommand;
import com.acme.dcm.application.command.MarkVmRequestProvisioningCommand;
import com.acme.dcm.application.command.MarkVmRequestReadyCommand;
import com.acme.dcm.application.command.ProvisionVmCommand;
import com.acme.dcm.application.command.RejectVmRequestCommand;
import com.acme.dcm.application.command.RemoveUserFromProjectCommand;
import com.acme.dcm.application.command.UnarchiveProjectCommand;
import com.acme.dcm.application.command.UpdateProjectCommand;
import com.acme.dcm.application.command.UpdateVmProgressCommand;
import com.acme.dcm.application.project.ArchiveProjectHandler;
import com.acme.dcm.application.project.AssignUserToProjectHandler;
import com.acme.dcm.application.project.CreateProjectHandler;
import com.acme.dcm.application.project.RemoveUserFromProjectHandler;
import com.acme.dcm.application.project.UnarchiveProjectHandler;
import com.acme.dcm.application.project.UpdateProjectHandler;
import com.acme.dcm.application.vm.MarkVmFailedHandler;
import com.acme.dcm.application.vm.MarkVmProvisionedHandler;
import com.acme.dcm.application.vm.ProvisionVmHandler;
import com.acme.dcm.application.vm.UpdateVmProgressHandler;
import com.acme.dcm.application.vmrequest.ApproveVmRequestHandler;
import com.acme.dcm.application.vmrequest.CancelVmRequestHandler;
import com.acme.dcm.application.vmrequest.CreateVmRequestHandler;
import com.acme.dcm.application.vmrequest.MarkVmRequestFailedHandler;
import com.acme.dcm.application.vmrequest.MarkVmRequestProvisioningHandler;
import com.acme.dcm.application.vmrequest.MarkVmRequestReadyHandler;
import com.acme.dcm.application.vmrequest.RejectVmRequestHandler;
import com.acme.sourcing.command.CommandHandlerRegistry;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Registers every command handler, so process managers can dispatch through the registry.
 */
@Factory
public class CommandHandlerConfiguration {

    @Singleton
    public CommandHandlerRegistry commandHandlerRegistry(
        CreateProjectHandler createProject,
        UpdateProjectHandler updateProject,
        ArchiveProjectHandler archiveProject,
        UnarchiveProjectHandler unarchiveProject,
        AssignUserToProjectHandler assignUser,
        RemoveUserFromProjectHandler removeUser,
        CreateVmRequestHandler createVmRequest,
        ApproveVmRequestHandler approveVmRequest,
        RejectVmRequestHandler rejectVmRequest,
        CancelVmRequestHandler cancelVmRequest,
        MarkVmRequestProvisioningHandler markProvisioning,
        MarkVmRequestReadyHandler markReady,
        MarkVmRequestFailedHandler markFailed,
        ProvisionVmHandler provisionVm,
        UpdateVmProgressHandler updateVmProgress,
        MarkVmProvisionedHandler markVmProvisioned,
        MarkVmFailedHandler markVmFailed
    ) {
        CommandHandlerRegistry registry = new CommandHandlerRegistry();
        registry.registerHandler(CreateProjectCommand.class, createProject);
        registry.registerHandler(UpdateProjectCommand.class, updateProject);
        registry.registerHandler(ArchiveProjectCommand.class, archiveProject);
        registry.registerHandler(UnarchiveProjectCommand.class, unarchiveProject);
        registry.registerHandler(AssignUserToProjectCommand.class, assignUser);
        registry.registerHandler(RemoveUserFromProjectCommand.class, removeUser);
        registry.registerHandler(CreateVmRequestCommand.class, createVmRequest);
        registry.registerHandler(ApproveVmRequestCommand.class, approveVmRequest);
        registry.registerHandler(RejectVmRequestCommand.class, rejectVmRequest);
        registry.registerHandler(CancelVmRequestCommand.class, cancelVmRequest);
        registry.registerHandler(MarkVmRequestProvisioningCommand.class, markProvisioning);
        registry.registerHandler(MarkVmRequestReadyCommand.class, markReady);
        registry.registerHandler(MarkVmRequestFailedCommand.class, markFailed);
        registry.registerHandler(ProvisionVmCommand.class, provisionVm);
        registry.registerHandler(UpdateVmProgressCommand.class, updateVmProgress);
        registry.registerHandler(MarkVmProvisionedCommand.class, markVmProvisioned);
        registry.registerHandler(MarkVmFailedCommand.class, markVmFailed);
        return registry;
    }
}
