package com.codeheadsystems.bastion.dropwizard.auth;

import java.security.Principal;
import java.util.Set;

/**
 * Principal representing the caller behind a verified bearer access token.
 *
 * @param id       principal identifier from the token subject
 * @param username the username
 * @param roles    current role labels
 */
public record AuthenticatedPrincipal(String id, String username, Set<String> roles)
    implements Principal {

  public AuthenticatedPrincipal {
    roles = Set.copyOf(roles);
  }

  @Override
  public String getName() {
    return username;
  }
}
