package com.codeheadsystems.bastion.server.token;

import java.util.Optional;

/**
 * The two token kinds, carried in the {@code type} claim.
 */
public enum TokenKind {
  ACCESS("access_token"),
  REFRESH("refresh_token");

  private final String claimValue;

  TokenKind(String claimValue) {
    this.claimValue = claimValue;
  }

  /**
   * Claim value string.
   *
   * @return the value written to the {@code type} claim
   */
  public String claimValue() {
    return claimValue;
  }

  /**
   * Resolves a {@code type} claim value.
   *
   * @param value the claim value, may be null
   * @return the kind, or empty if unknown
   */
  public static Optional<TokenKind> fromClaim(String value) {
    for (TokenKind kind : values()) {
      if (kind.claimValue.equals(value)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
