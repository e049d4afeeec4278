package com.codeheadsystems.bastion.server.resource;

import com.codeheadsystems.bastion.server.exception.TokenInvalidException;

/**
 * Extracts the token from an {@code Authorization: Bearer <token>} header.
 */
final class BearerTokens {

  private static final String PREFIX = "Bearer ";

  private BearerTokens() {
  }

  static String extract(String authorizationHeader) {
    if (authorizationHeader == null
        || !authorizationHeader.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      throw new TokenInvalidException("Missing bearer token");
    }
    String token = authorizationHeader.substring(PREFIX.length()).trim();
    if (token.isEmpty()) {
      throw new TokenInvalidException("Missing bearer token");
    }
    return token;
  }
}
