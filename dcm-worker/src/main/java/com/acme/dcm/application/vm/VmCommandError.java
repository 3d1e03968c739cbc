package com.acme.dcm.application.vm;

import java.util.UUID;

/**
 * Expected failures of VM commands. {@link #kind()} allows exhaustive switches.
 */
public sealed interface VmCommandError {

    enum Kind {
        NOT_FOUND,
        INVALID_STATE,
        VALIDATION_FAILED,
        CONCURRENCY_CONFLICT,
        PERSISTENCE_FAILURE
    }

    Kind kind();

    String message();

    record NotFound(UUID vmId, String message) implements VmCommandError {
        @Override
        public Kind kind() {
            return Kind.NOT_FOUND;
        }
    }

    record InvalidState(String currentState, String message) implements VmCommandError {
        @Override
        public Kind kind() {
            return Kind.INVALID_STATE;
        }
    }

    record ValidationFailed(String message) implements VmCommandError {
        @Override
        public Kind kind() {
            return Kind.VALIDATION_FAILED;
        }
    }

    record ConcurrencyConflict(long expectedVersion, long actualVersion, String message) implements VmCommandError {
        @Override
        public Kind kind() {
            return Kind.CONCURRENCY_CONFLICT;
        }
    }

    record PersistenceFailure(String message) implements VmCommandError {
        @Override
        public Kind kind() {
            return Kind.PERSISTENCE_FAILURE;
        }
    }
}
