package com.codeheadsystems.bastion.server.dispatch.command;

import com.codeheadsystems.bastion.server.dispatch.Command;
import com.codeheadsystems.bastion.server.dispatch.CommandType;
import com.codeheadsystems.bastion.server.model.Principal;

/**
 * Grants a role. Admin only.
 *
 * @param accessToken the caller's bearer access token
 * @param principalId the target principal
 * @param role        the role
 */
public record GrantRoleCommand(String accessToken, String principalId, String role)
    implements Command<Principal> {

  @Override
  public CommandType type() {
    return CommandType.GRANT_ROLE;
  }

  @Override
  public String toString() {
    return "GrantRoleCommand[principalId=" + principalId + ", role=" + role + "]";
  }
}
