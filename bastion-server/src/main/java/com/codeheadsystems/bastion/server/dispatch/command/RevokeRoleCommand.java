package com.codeheadsystems.bastion.server.dispatch.command;

import com.codeheadsystems.bastion.server.dispatch.Command;
import com.codeheadsystems.bastion.server.dispatch.CommandType;
import com.codeheadsystems.bastion.server.model.Principal;

/**
 * Revokes a role. Admin only.
 *
 * @param accessToken the caller's bearer access token
 * @param principalId the target principal
 * @param role        the role
 */
public record RevokeRoleCommand(String accessToken, String principalId, String role)
    implements Command<Principal> {

  @Override
  public CommandType type() {
    return CommandType.REVOKE_ROLE;
  }

  @Override
  public String toString() {
    return "RevokeRoleCommand[principalId=" + principalId + ", role=" + role + "]";
  }
}
