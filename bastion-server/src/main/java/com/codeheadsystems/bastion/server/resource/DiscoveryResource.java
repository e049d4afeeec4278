package com.codeheadsystems.bastion.server.resource;

import com.codeheadsystems.bastion.model.discovery.JsonWebKeySet;
import com.codeheadsystems.bastion.model.discovery.OpenIdConfiguration;
import com.codeheadsystems.bastion.server.key.KeyManager;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;

/**
 * Publishes the verification key set and the discovery document so relying services can
 * verify tokens without calling back into this service.
 */
@Path("/.well-known")
@Produces(MediaType.APPLICATION_JSON)
public class DiscoveryResource {

  private final KeyManager keyManager;
  private final OpenIdConfiguration configuration;

  public DiscoveryResource(KeyManager keyManager, String issuer, List<String> scopes) {
    this.keyManager = keyManager;
    this.configuration = OpenIdConfiguration.forIssuer(stripTrailingSlash(issuer), scopes);
  }

  @GET
  @Path("/jwks.json")
  public JsonWebKeySet jwks() {
    return keyManager.jwks();
  }

  @GET
  @Path("/openid-configuration")
  public OpenIdConfiguration openIdConfiguration() {
    return configuration;
  }

  private static String stripTrailingSlash(String issuer) {
    return issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer;
  }
}
