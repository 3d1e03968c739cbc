package com.acme.dcm.application.vmrequest;

import com.acme.sourcing.core.Cancellation;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Fire-and-forget delivery of requester notifications after a successful commit.
 */
@Slf4j
final class RequesterNotifications {

    private RequesterNotifications() {
    }

    static void send(VmRequestNotificationSender sender, VmRequestNotification notification, UUID correlationId) {
        String email = notification.requesterEmail();
        if (email == null || email.isBlank()) {
            log.debug("No requester email, skipping '{}' notification: requestId={} correlationId={}",
                notification.templateName(), notification.requestId(), correlationId);
            return;
        }
        if (!email.contains("@")) {
            log.error("Invalid requester email, skipping notification: requestId={} email='{}' correlationId={}",
                notification.requestId(), email, correlationId);
            return;
        }
        try {
            Cancellation.checkpoint();
            sender.send(notification).onFailure(error -> logFailure(error, notification, correlationId));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Notification failed for request {}: template={} correlationId={}",
                notification.requestId(), notification.templateName(), correlationId, e);
        }
    }

    private static void logFailure(VmRequestNotificationError error, VmRequestNotification notification, UUID correlationId) {
        if (error instanceof VmRequestNotificationError.TemplateError) {
            VmRequestNotificationError.TemplateError templateError = (VmRequestNotificationError.TemplateError) error;
            log.error("Notification template error for request {}: template={}, message={}. correlationId={}",
                notification.requestId(), templateError.templateName(), templateError.message(), correlationId);
        } else {
            log.error("Notification send failure for request {}: {}. correlationId={}",
                notification.requestId(), error.message(), correlationId);
        }
    }
}
