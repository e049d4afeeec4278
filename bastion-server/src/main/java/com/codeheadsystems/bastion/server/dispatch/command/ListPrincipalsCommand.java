package com.codeheadsystems.bastion.server.dispatch.command;

import com.codeheadsystems.bastion.server.dispatch.Command;
import com.codeheadsystems.bastion.server.dispatch.CommandType;
import com.codeheadsystems.bastion.server.model.Principal;
import java.util.List;

/**
 * Lists all principals. Admin only.
 *
 * @param accessToken the caller's bearer access token
 */
public record ListPrincipalsCommand(String accessToken) implements Command<List<Principal>> {

  @Override
  public CommandType type() {
    return CommandType.LIST_PRINCIPALS;
  }

  @Override
  public String toString() {
    return "ListPrincipalsCommand";
  }
}
