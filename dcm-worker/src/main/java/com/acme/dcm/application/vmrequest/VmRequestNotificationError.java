package com.acme.dcm.application.vmrequest;

/**
 * Why a requester notification was not delivered. Never fatal to the command that caused it.
 */
public sealed interface VmRequestNotificationError {

    String message();

    record SendFailure(String message) implements VmRequestNotificationError {}

    record TemplateError(String templateName, String message) implements VmRequestNotificationError {}
}
