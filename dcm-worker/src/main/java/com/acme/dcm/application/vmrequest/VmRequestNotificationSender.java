package com.acme.dcm.application.vmrequest;

import com.acme.sourcing.core.Result;

/**
 * Sends status notifications to the requester of a VM request.
 *
 * <p>Failures are returned, not thrown. Callers log them and carry on; a command never fails because
 * its notification did not go out.
 */
public interface VmRequestNotificationSender {

    Result<Void, VmRequestNotificationError> send(VmRequestNotification notification);
}
