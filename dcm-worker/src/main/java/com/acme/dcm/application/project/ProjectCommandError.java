package com.acme.dcm.application.project;

import java.util.UUID;

/**
 * Expected failures of project commands. {@link #kind()} allows exhaustive switches.
 */
public sealed interface ProjectCommandError {

    enum Kind {
        NOT_FOUND,
        PROJECT_ARCHIVED,
        CANNOT_REMOVE_CREATOR,
        NAME_ALREADY_EXISTS,
        VALIDATION_FAILED,
        CONCURRENCY_CONFLICT,
        PERSISTENCE_FAILURE
    }

    Kind kind();

    String message();

    record NotFound(UUID projectId, String message) implements ProjectCommandError {
        @Override
        public Kind kind() {
            return Kind.NOT_FOUND;
        }
    }

    record ProjectArchived(UUID projectId, String message) implements ProjectCommandError {
        @Override
        public Kind kind() {
            return Kind.PROJECT_ARCHIVED;
        }
    }

    record CannotRemoveCreator(UUID projectId, UUID userId, String message) implements ProjectCommandError {
        @Override
        public Kind kind() {
            return Kind.CANNOT_REMOVE_CREATOR;
        }
    }

    record NameAlreadyExists(String name, String message) implements ProjectCommandError {
        @Override
        public Kind kind() {
            return Kind.NAME_ALREADY_EXISTS;
        }
    }

    record ValidationFailed(String message) implements ProjectCommandError {
        @Override
        public Kind kind() {
            return Kind.VALIDATION_FAILED;
        }
    }

    record ConcurrencyConflict(long expectedVersion, long actualVersion, String message) implements ProjectCommandError {
        @Override
        public Kind kind() {
            return Kind.CONCURRENCY_CONFLICT;
        }
    }

    record PersistenceFailure(String message) implements ProjectCommandError {
        @Override
        public Kind kind() {
            return Kind.PERSISTENCE_FAILURE;
        }
    }
}
