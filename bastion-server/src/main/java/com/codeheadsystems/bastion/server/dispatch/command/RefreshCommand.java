package com.codeheadsystems.bastion.server.dispatch.command;

import com.codeheadsystems.bastion.server.dispatch.Command;
import com.codeheadsystems.bastion.server.dispatch.CommandType;
import com.codeheadsystems.bastion.server.token.TokenPair;

/**
 * Exchanges a refresh token for a new access token.
 *
 * @param refreshToken the refresh token
 */
public record RefreshCommand(String refreshToken) implements Command<TokenPair> {

  @Override
  public CommandType type() {
    return CommandType.REFRESH;
  }

  @Override
  public String toString() {
    return "RefreshCommand";
  }
}
