package com.codeheadsystems.bastion.server.dispatch.command;

import com.codeheadsystems.bastion.server.dispatch.Command;
import com.codeheadsystems.bastion.server.dispatch.CommandType;
import com.codeheadsystems.bastion.server.token.TokenClaims;
import java.util.Optional;

/**
 * Reports whether a token is active and, if so, its claims.
 *
 * @param token any token
 */
public record IntrospectCommand(String token) implements Command<Optional<TokenClaims>> {

  @Override
  public CommandType type() {
    return CommandType.INTROSPECT;
  }

  @Override
  public String toString() {
    return "IntrospectCommand";
  }
}
