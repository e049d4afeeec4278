package com.codeheadsystems.bastion.server.dispatch;

import com.codeheadsystems.bastion.server.exception.UnroutableCommandException;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routing table from {@link CommandType} to its single handler, so transport adapters depend
 * only on command and result shapes.
 * <p>
 * Registration is last-write-wins per type and binds the type to one command class.
 * Dispatching a type with no handler, or a command of another class under that type, is a
 * wiring error and fails with {@link UnroutableCommandException}.
 */
public class RequestDispatcher {

  private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

  private final ConcurrentHashMap<CommandType, Route<?, ?>> routes = new ConcurrentHashMap<>();

  /**
   * Registers the handler for a command type, replacing any previous one. The handler only
   * receives commands of {@code commandClass}.
   *
   * @param type         the command type
   * @param commandClass the command class carried under this type
   * @param handler      the handler
   * @param <C>          the command
   * @param <R>          the result
   */
  public <C extends Command<R>, R> void register(CommandType type,
                                                 Class<C> commandClass,
                                                 CommandHandler<C, R> handler) {
    Route<?, ?> previous = routes.put(type, new Route<>(commandClass, handler));
    if (previous != null) {
      log.debug("Replaced handler for {}", type);
    }
  }

  /**
   * Whether a handler is registered for the type.
   *
   * @param type the type
   * @return true if registered
   */
  public boolean isRegistered(CommandType type) {
    return routes.containsKey(type);
  }

  /**
   * Invokes the handler registered for the command's type.
   *
   * @param command the command
   * @param <R>     the result
   * @return the handler's result
   * @throws UnroutableCommandException if no handler is registered, or the registered handler
   *                                    takes a different command class
   */
  public <R> R dispatch(Command<R> command) {
    Route<?, ?> route = routes.get(command.type());
    if (route == null) {
      log.error("No handler registered for {}", command.type());
      throw new UnroutableCommandException(command.type());
    }
    if (!route.accepts(command)) {
      log.error("Handler for {} takes {}, not {}", command.type(),
          route.commandClass().getSimpleName(), command.getClass().getSimpleName());
      throw new UnroutableCommandException(command.type());
    }
    return resultOf(command, route.handle(command));
  }

  // A command class implements Command<R> for exactly one R, so a handler accepting it yields an R.
  @SuppressWarnings("unchecked")
  private static <R> R resultOf(Command<R> command, Object result) {
    return (R) result;
  }

  private record Route<C extends Command<R>, R>(Class<C> commandClass,
                                                CommandHandler<C, R> handler) {

    boolean accepts(Command<?> command) {
      return commandClass.isInstance(command);
    }

    R handle(Command<?> command) {
      return handler.handle(commandClass.cast(command));
    }
  }
}
