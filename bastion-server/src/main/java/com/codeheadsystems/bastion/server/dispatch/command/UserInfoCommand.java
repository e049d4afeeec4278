package com.codeheadsystems.bastion.server.dispatch.command;

import com.codeheadsystems.bastion.server.dispatch.Command;
import com.codeheadsystems.bastion.server.dispatch.CommandType;
import com.codeheadsystems.bastion.server.model.Principal;

/**
 * Resolves the principal behind an access token.
 *
 * @param accessToken the bearer access token
 */
public record UserInfoCommand(String accessToken) implements Command<Principal> {

  @Override
  public CommandType type() {
    return CommandType.USER_INFO;
  }

  @Override
  public String toString() {
    return "UserInfoCommand";
  }
}
