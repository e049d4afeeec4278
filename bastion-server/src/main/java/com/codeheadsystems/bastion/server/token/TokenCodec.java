package com.codeheadsystems.bastion.server.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.bastion.server.exception.TokenExpiredException;
import com.codeheadsystems.bastion.server.exception.TokenInvalidException;
import com.codeheadsystems.bastion.server.key.KeyManager;
import com.codeheadsystems.bastion.server.model.Principal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints and verifies RS256-signed bearer tokens.
 * <p>
 * Signing uses the private key held by {@link KeyManager}; verification uses only the public
 * key, so any holder of the published JWK can verify independently. Every token carries the
 * key id in its {@code kid} header and its kind in the {@code type} claim. Access tokens add
 * the principal's username, email, roles and scopes; refresh tokens carry no role or scope
 * claims.
 */
public class TokenCodec {

  private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);

  public static final Duration DEFAULT_ACCESS_TTL = Duration.ofMinutes(30);
  public static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(7);
  public static final List<String> DEFAULT_SCOPES = List.of("read", "write");

  static final String CLAIM_TYPE = "type";
  static final String CLAIM_USERNAME = "username";
  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_ROLES = "roles";
  static final String CLAIM_SCOPES = "scopes";

  private final Algorithm signingAlgorithm;
  private final JWTVerifier verifier;
  private final String keyId;
  private final String issuer;
  private final Clock clock;
  private final Duration accessTtl;
  private final Duration refreshTtl;
  private final List<String> defaultScopes;

  /**
   * Creates a codec with default lifetimes and scopes.
   *
   * @param keyManager source of the signing key pair
   * @param issuer     issuer claim
   * @param clock      time source
   */
  public TokenCodec(KeyManager keyManager, String issuer, Clock clock) {
    this(keyManager, issuer, clock, DEFAULT_ACCESS_TTL, DEFAULT_REFRESH_TTL, DEFAULT_SCOPES);
  }

  /**
   * Creates a codec.
   *
   * @param keyManager    source of the signing key pair
   * @param issuer        issuer claim
   * @param clock         time source, read once per call
   * @param accessTtl     access token lifetime, at least one second
   * @param refreshTtl    refresh token lifetime, at least one second
   * @param defaultScopes scopes granted when the caller supplies none
   */
  public TokenCodec(KeyManager keyManager, String issuer, Clock clock,
                    Duration accessTtl, Duration refreshTtl, List<String> defaultScopes) {
    requirePositive(accessTtl, "accessTtl");
    requirePositive(refreshTtl, "refreshTtl");
    this.signingAlgorithm = Algorithm.RSA256(keyManager.publicKey(), keyManager.privateKey());
    Algorithm verifyOnly = Algorithm.RSA256(keyManager.publicKey(), null);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(verifyOnly).withIssuer(issuer))
        .build(clock);
    this.keyId = keyManager.keyId();
    this.issuer = issuer;
    this.clock = clock;
    this.accessTtl = accessTtl;
    this.refreshTtl = refreshTtl;
    this.defaultScopes = List.copyOf(defaultScopes);
  }

  /**
   * Mints an access token with the default scopes.
   *
   * @param principal the subject
   * @return compact JWS
   */
  public String mintAccess(Principal principal) {
    return mint(principal, TokenKind.ACCESS, defaultScopes);
  }

  /**
   * Mints a refresh token.
   *
   * @param principal the subject
   * @return compact JWS
   */
  public String mintRefresh(Principal principal) {
    return mint(principal, TokenKind.REFRESH, null);
  }

  /**
   * Mints a token of the given kind. {@code exp} is {@code iat} plus the kind's lifetime.
   *
   * @param principal the subject
   * @param kind      token kind
   * @param scopes    scopes for access tokens; defaults apply when null; ignored for refresh
   * @return compact JWS
   */
  public String mint(Principal principal, TokenKind kind, List<String> scopes) {
    Instant now = clock.instant();
    JWTCreator.Builder builder = JWT.create()
        .withKeyId(keyId)
        .withIssuer(issuer)
        .withJWTId(UUID.randomUUID().toString())
        .withSubject(principal.id())
        .withIssuedAt(now)
        .withExpiresAt(now.plus(ttl(kind)))
        .withClaim(CLAIM_TYPE, kind.claimValue());
    if (kind == TokenKind.ACCESS) {
      builder.withClaim(CLAIM_USERNAME, principal.username())
          .withClaim(CLAIM_EMAIL, principal.email())
          .withClaim(CLAIM_ROLES, List.copyOf(principal.roles()))
          .withClaim(CLAIM_SCOPES, scopes == null ? defaultScopes : List.copyOf(scopes));
    }
    String token = builder.sign(signingAlgorithm);
    log.debug("Minted {} for subject={}", kind, principal.id());
    return token;
  }

  /**
   * Verifies signature, issuer and expiry, then decodes the claims.
   *
   * @param token compact JWS
   * @return the verified claims
   * @throws TokenExpiredException if the signature is valid but the token has expired
   * @throws TokenInvalidException on malformed structure or claims, a bad signature or an unknown kind
   */
  public TokenClaims verify(String token) {
    if (token == null || token.isBlank()) {
      throw new TokenInvalidException("Token is missing");
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (com.auth0.jwt.exceptions.TokenExpiredException e) {
      log.debug("Token expired: {}", e.getMessage());
      throw new TokenExpiredException("Token has expired", e);
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      throw new TokenInvalidException("Token is invalid", e);
    }
    TokenKind kind = TokenKind.fromClaim(decoded.getClaim(CLAIM_TYPE).asString())
        .orElseThrow(() -> new TokenInvalidException("Token type is unknown"));
    try {
      Instant issuedAt = decoded.getIssuedAtAsInstant();
      Instant expiresAt = decoded.getExpiresAtAsInstant();
      if (issuedAt == null || expiresAt == null) {
        throw new TokenInvalidException("Token is missing iat or exp");
      }
      return new TokenClaims(
          decoded.getSubject(),
          kind,
          issuedAt,
          expiresAt,
          decoded.getClaim(CLAIM_USERNAME).asString(),
          decoded.getClaim(CLAIM_EMAIL).asString(),
          decoded.getClaim(CLAIM_ROLES).asList(String.class),
          decoded.getClaim(CLAIM_SCOPES).asList(String.class));
    } catch (JWTDecodeException e) {
      log.debug("Token claims malformed: {}", e.getMessage());
      throw new TokenInvalidException("Token claims are malformed", e);
    }
  }

  /**
   * Lifetime of a token kind.
   *
   * @param kind the kind
   * @return the lifetime
   */
  public Duration ttl(TokenKind kind) {
    return kind == TokenKind.ACCESS ? accessTtl : refreshTtl;
  }

  private static void requirePositive(Duration ttl, String name) {
    if (ttl == null || ttl.compareTo(Duration.ofSeconds(1)) < 0) {
      throw new IllegalArgumentException(name + " must be at least one second");
    }
  }
}
