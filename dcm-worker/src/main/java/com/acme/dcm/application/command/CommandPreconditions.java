package com.acme.dcm.application.command;

import java.util.UUID;

final class CommandPreconditions {

    private CommandPreconditions() {}

    static void requireContext(UUID tenantId, UUID userId, UUID correlationId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("Tenant ID cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("User ID cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("Correlation ID cannot be null");
        }
    }

    static void requireId(UUID id, String name) {
        if (id == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
