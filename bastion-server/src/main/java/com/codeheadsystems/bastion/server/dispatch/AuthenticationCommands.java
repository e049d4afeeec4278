package com.codeheadsystems.bastion.server.dispatch;

import com.codeheadsystems.bastion.server.dispatch.command.GrantRoleCommand;
import com.codeheadsystems.bastion.server.dispatch.command.IntrospectCommand;
import com.codeheadsystems.bastion.server.dispatch.command.ListPrincipalsCommand;
import com.codeheadsystems.bastion.server.dispatch.command.LoginCommand;
import com.codeheadsystems.bastion.server.dispatch.command.RefreshCommand;
import com.codeheadsystems.bastion.server.dispatch.command.RegisterCommand;
import com.codeheadsystems.bastion.server.dispatch.command.RevokeRoleCommand;
import com.codeheadsystems.bastion.server.dispatch.command.SetActiveCommand;
import com.codeheadsystems.bastion.server.dispatch.command.UserInfoCommand;
import com.codeheadsystems.bastion.server.manager.AuthenticationEngine;

/**
 * Wires every {@link CommandType} to the {@link AuthenticationEngine} operation that serves it.
 */
public final class AuthenticationCommands {

  private AuthenticationCommands() {
  }

  /**
   * Registers a handler for every command type.
   *
   * @param dispatcher the dispatcher
   * @param engine     the engine
   * @return the dispatcher
   */
  public static RequestDispatcher registerAll(RequestDispatcher dispatcher,
                                              AuthenticationEngine engine) {
    dispatcher.register(CommandType.REGISTER, RegisterCommand.class,
        c -> engine.register(c.username(), c.email(), c.password(), c.roles()));
    dispatcher.register(CommandType.LOGIN, LoginCommand.class,
        c -> engine.issueTokenPair(engine.login(c.username(), c.password())));
    dispatcher.register(CommandType.REFRESH, RefreshCommand.class,
        c -> engine.refresh(c.refreshToken()));
    dispatcher.register(CommandType.INTROSPECT, IntrospectCommand.class,
        c -> engine.introspect(c.token()));
    dispatcher.register(CommandType.USER_INFO, UserInfoCommand.class,
        c -> engine.currentPrincipal(c.accessToken()));
    dispatcher.register(CommandType.LIST_PRINCIPALS, ListPrincipalsCommand.class,
        c -> engine.listPrincipals(engine.currentPrincipal(c.accessToken())));
    dispatcher.register(CommandType.SET_ACTIVE, SetActiveCommand.class,
        c -> engine.setActive(engine.currentPrincipal(c.accessToken()), c.principalId(), c.active()));
    dispatcher.register(CommandType.GRANT_ROLE, GrantRoleCommand.class,
        c -> engine.grantRole(engine.currentPrincipal(c.accessToken()), c.principalId(), c.role()));
    dispatcher.register(CommandType.REVOKE_ROLE, RevokeRoleCommand.class,
        c -> engine.revokeRole(engine.currentPrincipal(c.accessToken()), c.principalId(), c.role()));
    return dispatcher;
  }
}
