package com.codeheadsystems.bastion.server.exception;

import com.codeheadsystems.bastion.server.dispatch.CommandType;

/**
 * No handler is registered for the dispatched command type.
 */
public class UnroutableCommandException extends BastionException {

  private final CommandType commandType;

  public UnroutableCommandException(CommandType commandType) {
    super("No handler registered for command " + commandType);
    this.commandType = commandType;
  }

  /**
   * Gets the command type that could not be routed.
   *
   * @return the command type
   */
  public CommandType getCommandType() {
    return commandType;
  }
}
