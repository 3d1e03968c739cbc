package com.acme.dcm.application.vmrequest;

import java.util.UUID;

/**
 * Message to the requester about a status change of their request.
 */
public sealed interface VmRequestNotification {

    UUID requestId();

    UUID tenantId();

    String requesterEmail();

    String vmName();

    UUID projectId();

    String templateName();

    record RequestCreated(UUID requestId, UUID tenantId, String requesterEmail, String vmName, UUID projectId)
        implements VmRequestNotification {
        @Override
        public String templateName() {
            return "vm-request-created";
        }
    }

    record RequestApproved(UUID requestId, UUID tenantId, String requesterEmail, String vmName, UUID projectId)
        implements VmRequestNotification {
        @Override
        public String templateName() {
            return "vm-request-approved";
        }
    }

    record RequestRejected(UUID requestId, UUID tenantId, String requesterEmail, String vmName, UUID projectId, String reason)
        implements VmRequestNotification {
        @Override
        public String templateName() {
            return "vm-request-rejected";
        }
    }

    record VmReady(UUID requestId, UUID tenantId, String requesterEmail, String vmName, UUID projectId, String ipAddress, String hostname)
        implements VmRequestNotification {
        @Override
        public String templateName() {
            return "vm-ready";
        }
    }

    record ProvisioningFailed(UUID requestId, UUID tenantId, String requesterEmail, String vmName, UUID projectId, String reason)
        implements VmRequestNotification {
        @Override
        public String templateName() {
            return "vm-provisioning-failed";
        }
    }
}
