package com.codeheadsystems.bastion.testserver;

import com.codeheadsystems.bastion.dropwizard.auth.AuthenticatedPrincipal;
import io.dropwizard.auth.Auth;
import jakarta.annotation.security.RolesAllowed;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import java.util.Map;

/**
 * Bearer-protected endpoints showing how a relying resource consumes access tokens: obtain a
 * token from {@code POST /api/v1/auth/token}, then call {@code GET /api/whoami} with it.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  /**
   * Returns the identity carried by the access token.
   *
   * @param principal the principal injected by the Dropwizard auth filter
   * @return a map containing {@code id}, {@code username} and {@code roles}
   */
  @GET
  public Map<String, Object> whoAmI(@Auth AuthenticatedPrincipal principal) {
    return Map.of(
        "id", principal.id(),
        "username", principal.getName(),
        "roles", List.copyOf(principal.roles()));
  }

  /**
   * Admin-only variant.
   *
   * @param principal the principal
   * @return a map containing {@code admin}
   */
  @GET
  @Path("/admin")
  @RolesAllowed("admin")
  public Map<String, String> admin(@Auth AuthenticatedPrincipal principal) {
    return Map.of("admin", principal.getName());
  }
}
