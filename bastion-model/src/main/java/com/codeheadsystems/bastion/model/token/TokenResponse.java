package com.codeheadsystems.bastion.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token endpoint response: { access_token, refresh_token, token_type, expires_in }.
 *
 * @param accessToken  signed RS256 access token
 * @param refreshToken signed RS256 refresh token
 * @param tokenType    always {@code Bearer}
 * @param expiresIn    lifetime of the access token in seconds
 */
public record TokenResponse(@JsonProperty("access_token") String accessToken,
                            @JsonProperty("refresh_token") String refreshToken,
                            @JsonProperty("token_type") String tokenType,
                            @JsonProperty("expires_in") long expiresIn) {

  /**
   * The token type every response carries.
   */
  public static final String BEARER = "Bearer";

  public TokenResponse(String accessToken, String refreshToken, long expiresIn) {
    this(accessToken, refreshToken, BEARER, expiresIn);
  }
}
