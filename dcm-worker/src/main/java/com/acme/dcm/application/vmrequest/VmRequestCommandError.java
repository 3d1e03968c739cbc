package com.acme.dcm.application.vmrequest;

import java.util.UUID;

/**
 * Expected failures of VM request commands. {@link #kind()} allows exhaustive switches.
 */
public sealed interface VmRequestCommandError {

    enum Kind {
        NOT_FOUND,
        FORBIDDEN,
        INVALID_STATE,
        VALIDATION_FAILED,
        PROJECT_NOT_AVAILABLE,
        CONCURRENCY_CONFLICT,
        PERSISTENCE_FAILURE
    }

    Kind kind();

    String message();

    record NotFound(UUID requestId, String message) implements VmRequestCommandError {
        @Override
        public Kind kind() {
            return Kind.NOT_FOUND;
        }
    }

    record Forbidden(String message) implements VmRequestCommandError {
        @Override
        public Kind kind() {
            return Kind.FORBIDDEN;
        }
    }

    record InvalidState(String currentState, String message) implements VmRequestCommandError {
        @Override
        public Kind kind() {
            return Kind.INVALID_STATE;
        }
    }

    record ValidationFailed(String message) implements VmRequestCommandError {
        @Override
        public Kind kind() {
            return Kind.VALIDATION_FAILED;
        }
    }

    record ProjectNotAvailable(UUID projectId, String message) implements VmRequestCommandError {
        @Override
        public Kind kind() {
            return Kind.PROJECT_NOT_AVAILABLE;
        }
    }

    record ConcurrencyConflict(long expectedVersion, long actualVersion, String message) implements VmRequestCommandError {
        @Override
        public Kind kind() {
            return Kind.CONCURRENCY_CONFLICT;
        }
    }

    record PersistenceFailure(String message) implements VmRequestCommandError {
        @Override
        public Kind kind() {
            return Kind.PERSISTENCE_FAILURE;
        }
    }
}
