package com.acme.sourcing.command;

import com.acme.sourcing.core.Result;

/**
 * Handles one command type.
 *
 * @param <C> command type
 * @param <T> success value
 * @param <X> error type
 */
@FunctionalInterface
public interface CommandHandler<C extends DomainCommand, T, X> {

  Result<T, X> handle(C command);
}
