package com.codeheadsystems.bastion.server.token;

import java.time.Instant;
import java.util.List;

/**
 * Verified contents of a token. Identity fields are null and lists are empty for refresh
 * tokens.
 *
 * @param subject   principal identifier ({@code sub})
 * @param kind      token kind
 * @param issuedAt  issue time ({@code iat})
 * @param expiresAt expiry ({@code exp})
 * @param username  principal username
 * @param email     principal email
 * @param roles     principal roles at mint time
 * @param scopes    granted scopes
 */
public record TokenClaims(String subject,
                          TokenKind kind,
                          Instant issuedAt,
                          Instant expiresAt,
                          String username,
                          String email,
                          List<String> roles,
                          List<String> scopes) {

  public TokenClaims {
    roles = roles == null ? List.of() : List.copyOf(roles);
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
  }
}
