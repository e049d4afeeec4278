package com.codeheadsystems.bastion.server.token;

import java.time.Duration;

/**
 * An access token and the refresh token that accompanies it.
 *
 * @param accessToken  signed access token
 * @param refreshToken signed refresh token
 * @param accessTtl    lifetime of the access token
 */
public record TokenPair(String accessToken, String refreshToken, Duration accessTtl) {

  /**
   * Access token lifetime in whole seconds.
   *
   * @return seconds until the access token expires, from mint time
   */
  public long expiresInSeconds() {
    return accessTtl.getSeconds();
  }
}
