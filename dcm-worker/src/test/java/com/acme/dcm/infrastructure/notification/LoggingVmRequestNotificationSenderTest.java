package com.acme.dcm.infrastructure.notification;

import com.acme.dcm.application.vmrequest.VmRequestNotification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LoggingVmRequestNotificationSender")
class LoggingVmRequestNotificationSenderTest {

    private static final VmRequestNotification APPROVED = new VmRequestNotification.RequestApproved(
        UUID.randomUUID(), UUID.randomUUID(), "dev@example.com", "web-01", UUID.randomUUID());

    @Test
    @DisplayName("should report a logged notification as sent")
    void testEnabled() {
        assertThat(new LoggingVmRequestNotificationSender(true).send(APPROVED).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("should skip quietly when notifications are disabled")
    void testDisabled() {
        assertThat(new LoggingVmRequestNotificationSender(false).send(APPROVED).isSuccess()).isTrue();
    }
}
