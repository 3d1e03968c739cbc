package com.acme.dcm.infrastructure.notification;

import com.acme.dcm.application.vmrequest.VmRequestNotification;
import com.acme.dcm.application.vmrequest.VmRequestNotificationError;
import com.acme.dcm.application.vmrequest.VmRequestNotificationSender;
import com.acme.sourcing.core.Result;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes requester notifications to the log instead of a mail server.
 *
 * <p>With {@code notifications.enabled=false} every notification is skipped at DEBUG, so an operator
 * can confirm the switch is intentional.
 */
@Slf4j
@Singleton
public class LoggingVmRequestNotificationSender implements VmRequestNotificationSender {

    private final boolean enabled;

    public LoggingVmRequestNotificationSender(@Value("${notifications.enabled:true}") boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public Result<Void, VmRequestNotificationError> send(VmRequestNotification notification) {
        if (!enabled) {
            log.debug("Notifications disabled - skipping '{}' notification for request {}",
                notification.templateName(), notification.requestId());
            return Result.success(null);
        }
        log.info("Notification sent: template={} to={} requestId={} vmName={} projectId={}",
            notification.templateName(),
            notification.requesterEmail(),
            notification.requestId(),
            notification.vmName(),
            notification.projectId());
        return Result.success(null);
    }
}
