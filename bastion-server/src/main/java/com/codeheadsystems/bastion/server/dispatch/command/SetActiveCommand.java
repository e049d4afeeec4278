package com.codeheadsystems.bastion.server.dispatch.command;

import com.codeheadsystems.bastion.server.dispatch.Command;
import com.codeheadsystems.bastion.server.dispatch.CommandType;
import com.codeheadsystems.bastion.server.model.Principal;

/**
 * Activates or deactivates a principal. Admin only.
 *
 * @param accessToken the caller's bearer access token
 * @param principalId the target principal
 * @param active      the new state
 */
public record SetActiveCommand(String accessToken, String principalId, boolean active)
    implements Command<Principal> {

  @Override
  public CommandType type() {
    return CommandType.SET_ACTIVE;
  }

  @Override
  public String toString() {
    return "SetActiveCommand[principalId=" + principalId + ", active=" + active + "]";
  }
}
