package com.codeheadsystems.bastion.model.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Subset of the OpenID Connect discovery document this provider supports.
 */
public record OpenIdConfiguration(
    @JsonProperty("issuer") String issuer,
    @JsonProperty("token_endpoint") String tokenEndpoint,
    @JsonProperty("userinfo_endpoint") String userinfoEndpoint,
    @JsonProperty("jwks_uri") String jwksUri,
    @JsonProperty("introspection_endpoint") String introspectionEndpoint,
    @JsonProperty("registration_endpoint") String registrationEndpoint,
    @JsonProperty("response_types_supported") List<String> responseTypesSupported,
    @JsonProperty("grant_types_supported") List<String> grantTypesSupported,
    @JsonProperty("subject_types_supported") List<String> subjectTypesSupported,
    @JsonProperty("id_token_signing_alg_values_supported") List<String> signingAlgValuesSupported,
    @JsonProperty("scopes_supported") List<String> scopesSupported,
    @JsonProperty("token_endpoint_auth_methods_supported") List<String> tokenEndpointAuthMethodsSupported,
    @JsonProperty("claims_supported") List<String> claimsSupported) {

  /**
   * Builds the discovery document for an issuer base URL.
   *
   * @param issuer the issuer base URL, without trailing slash
   * @param scopes the scopes granted to access tokens
   * @return the document
   */
  public static OpenIdConfiguration forIssuer(String issuer, List<String> scopes) {
    return new OpenIdConfiguration(
        issuer,
        issuer + "/api/v1/auth/token",
        issuer + "/api/v1/auth/userinfo",
        issuer + "/.well-known/jwks.json",
        issuer + "/api/v1/auth/introspect",
        issuer + "/api/v1/users/register",
        List.of("token"),
        List.of("password", "refresh_token"),
        List.of("public"),
        List.of("RS256"),
        List.copyOf(scopes),
        List.of("client_secret_post", "none"),
        List.of("sub", "username", "email", "roles", "scopes", "type", "iat", "exp"));
  }
}
