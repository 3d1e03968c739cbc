package com.acme.sourcing.command;

import com.acme.sourcing.core.Result;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for command handlers - maps command classes to their handlers. Used by process managers
 * to dispatch follow-up commands through the same pipeline as user commands. Pure POJO - no
 * framework dependencies.
 */
public class CommandHandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(CommandHandlerRegistry.class);

  private final Map<Class<?>, CommandHandler<?, ?, ?>> handlers = new ConcurrentHashMap<>();

  /**
   * Register a handler for a specific command type
   *
   * @throws IllegalStateException if a handler is already registered for this command type
   */
  public <C extends DomainCommand> void registerHandler(
      Class<C> commandType, CommandHandler<C, ?, ?> handler) {
    if (handlers.putIfAbsent(commandType, handler) != null) {
      String error = "Handler already registered for command type: " + commandType.getSimpleName();
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registering handler for command type: {}", commandType.getSimpleName());
  }

  public boolean hasHandler(Class<? extends DomainCommand> commandType) {
    return handlers.containsKey(commandType);
  }

  /**
   * Handle a command by delegating to the registered handler
   *
   * @throws IllegalStateException if no handler is registered for the command's class
   */
  @SuppressWarnings("unchecked")
  public <C extends DomainCommand> Result<?, ?> dispatch(C command) {
    CommandHandler<C, ?, ?> handler = (CommandHandler<C, ?, ?>) handlers.get(command.getClass());
    if (handler == null) {
      String error =
          "No handler registered for command type: " + command.getClass().getSimpleName();
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.debug("Dispatching command: {}", command.getClass().getSimpleName());
    return handler.handle(command);
  }
}
