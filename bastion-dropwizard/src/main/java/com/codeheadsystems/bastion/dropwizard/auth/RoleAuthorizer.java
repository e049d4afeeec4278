package com.codeheadsystems.bastion.dropwizard.auth;

import io.dropwizard.auth.Authorizer;
import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Backs {@code @RolesAllowed} on downstream resources with the principal's role labels.
 */
public class RoleAuthorizer implements Authorizer<AuthenticatedPrincipal> {

  @Override
  public boolean authorize(AuthenticatedPrincipal principal, String role,
                           ContainerRequestContext requestContext) {
    return principal.roles().contains(role);
  }
}
