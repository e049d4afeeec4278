package com.codeheadsystems.bastion.server.dispatch.command;

import com.codeheadsystems.bastion.server.dispatch.Command;
import com.codeheadsystems.bastion.server.dispatch.CommandType;
import com.codeheadsystems.bastion.server.token.TokenPair;

/**
 * Password grant: authenticates and issues a token pair.
 *
 * @param username the username
 * @param password the plaintext password
 */
public record LoginCommand(String username, String password) implements Command<TokenPair> {

  @Override
  public CommandType type() {
    return CommandType.LOGIN;
  }

  @Override
  public String toString() {
    return "LoginCommand[username=" + username + "]";
  }
}
