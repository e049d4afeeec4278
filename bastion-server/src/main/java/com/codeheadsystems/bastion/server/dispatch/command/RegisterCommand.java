package com.codeheadsystems.bastion.server.dispatch.command;

import com.codeheadsystems.bastion.server.dispatch.Command;
import com.codeheadsystems.bastion.server.dispatch.CommandType;
import com.codeheadsystems.bastion.server.model.Principal;
import java.util.List;

/**
 * Registers a new principal.
 *
 * @param username the username
 * @param email    the email
 * @param password the plaintext password
 * @param roles    initial roles, may be null
 */
public record RegisterCommand(String username, String email, String password, List<String> roles)
    implements Command<Principal> {

  @Override
  public CommandType type() {
    return CommandType.REGISTER;
  }

  @Override
  public String toString() {
    return "RegisterCommand[username=" + username + ", roles=" + roles + "]";
  }
}
