package com.codeheadsystems.bastion.server.manager;

import com.codeheadsystems.bastion.server.crypto.PasswordHasher;
import com.codeheadsystems.bastion.server.exception.AccessDeniedException;
import com.codeheadsystems.bastion.server.exception.AccountInactiveException;
import com.codeheadsystems.bastion.server.exception.AuthenticationFailedException;
import com.codeheadsystems.bastion.server.exception.DuplicateAddressException;
import com.codeheadsystems.bastion.server.exception.DuplicateHandleException;
import com.codeheadsystems.bastion.server.exception.PrincipalNotFoundException;
import com.codeheadsystems.bastion.server.exception.TokenInvalidException;
import com.codeheadsystems.bastion.server.exception.TokenVerificationException;
import com.codeheadsystems.bastion.server.exception.ValidationFailedException;
import com.codeheadsystems.bastion.server.model.Principal;
import com.codeheadsystems.bastion.server.store.CredentialStore;
import com.codeheadsystems.bastion.server.token.TokenClaims;
import com.codeheadsystems.bastion.server.token.TokenCodec;
import com.codeheadsystems.bastion.server.token.TokenKind;
import com.codeheadsystems.bastion.server.token.TokenPair;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing credential exchange, token issuance, the refresh
 * exchange and registration, plus principal administration.
 * <p>
 * Stateless between calls: nothing is tracked per token, so a minted token stays valid until
 * its own expiry regardless of later account changes.
 * <p>
 * <strong>Exception contract</strong> (transport adapters map these to responses):
 * <ul>
 *   <li>{@link ValidationFailedException}: bad input shape, every violation listed</li>
 *   <li>{@link DuplicateHandleException} / {@link DuplicateAddressException}: registration conflict</li>
 *   <li>{@link AuthenticationFailedException}: unknown username or wrong password, indistinguishable</li>
 *   <li>{@link AccountInactiveException}: the principal is deactivated</li>
 *   <li>{@link TokenInvalidException} and its subtype {@code TokenExpiredException}: unusable token</li>
 *   <li>{@link TokenVerificationException}: wrong token kind, or the subject no longer exists</li>
 *   <li>{@link AccessDeniedException}: admin operation by a non-admin</li>
 *   <li>{@link PrincipalNotFoundException}: admin operation on an unknown identifier</li>
 *   <li>{@code StoreUnavailableException}: propagated from the store, never retried</li>
 * </ul>
 */
@Singleton
public class AuthenticationEngine {

  private static final Logger log = LoggerFactory.getLogger(AuthenticationEngine.class);

  public static final int MIN_USERNAME_LENGTH = 3;
  public static final int MIN_PASSWORD_LENGTH = 6;
  public static final Set<String> KNOWN_ROLES =
      Set.of(Principal.ROLE_ADMIN, Principal.ROLE_USER, Principal.ROLE_GUEST);

  private static final String INVALID_CREDENTIALS = "Invalid username or password";
  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

  private final CredentialStore credentialStore;
  private final PasswordHasher passwordHasher;
  private final TokenCodec tokenCodec;
  private final Clock clock;

  /**
   * Verified against when the username is unknown, so that path costs one hash like the
   * wrong-password path.
   */
  private final String dummyHash;

  /**
   * Instantiates a new Authentication engine.
   *
   * @param credentialStore the credential store
   * @param passwordHasher  the password hasher
   * @param tokenCodec      the token codec
   * @param clock           the clock used for principal timestamps
   */
  @Inject
  public AuthenticationEngine(CredentialStore credentialStore,
                              PasswordHasher passwordHasher,
                              TokenCodec tokenCodec,
                              Clock clock) {
    this.credentialStore = credentialStore;
    this.passwordHasher = passwordHasher;
    this.tokenCodec = tokenCodec;
    this.clock = clock;
    this.dummyHash = passwordHasher.hash(UUID.randomUUID().toString());
  }

  // ── Credential exchange ───────────────────────────────────────────────────

  /**
   * Authenticates a principal by username and password.
   *
   * @param username the username
   * @param password the plaintext password
   * @return the authenticated principal
   * @throws AuthenticationFailedException if the username is unknown or the password is wrong
   * @throws AccountInactiveException      if the principal is deactivated
   */
  public Principal login(String username, String password) {
    log.debug("login()");
    if (username == null || password == null) {
      throw new AuthenticationFailedException(INVALID_CREDENTIALS);
    }
    Optional<Principal> found = credentialStore.findByUsername(username);
    if (found.isEmpty()) {
      passwordHasher.verify(password, dummyHash);
      throw new AuthenticationFailedException(INVALID_CREDENTIALS);
    }
    Principal principal = found.get();
    if (!principal.active()) {
      throw new AccountInactiveException("User account is inactive");
    }
    if (!passwordHasher.verify(password, principal.passwordHash())) {
      log.debug("Password mismatch for principal id={}", principal.id());
      throw new AuthenticationFailedException(INVALID_CREDENTIALS);
    }
    return principal;
  }

  /**
   * Mints an access token carrying the principal's roles and default scopes, and a refresh
   * token. Nothing is persisted.
   *
   * @param principal the principal
   * @return the token pair
   */
  public TokenPair issueTokenPair(Principal principal) {
    String access = tokenCodec.mintAccess(principal);
    String refresh = tokenCodec.mintRefresh(principal);
    return new TokenPair(access, refresh, tokenCodec.ttl(TokenKind.ACCESS));
  }

  /**
   * Exchanges a refresh token for a new access token bound to the principal's current roles.
   * The refresh token itself is returned unchanged.
   *
   * @param refreshToken the refresh token
   * @return the new access token and the original refresh token
   * @throws TokenInvalidException       if the token does not verify or has expired
   * @throws TokenVerificationException  if the token is not a refresh token or its subject is gone
   * @throws AccountInactiveException    if the principal has been deactivated
   */
  public TokenPair refresh(String refreshToken) {
    TokenClaims claims = tokenCodec.verify(refreshToken);
    // Kind is checked before any lookup.
    if (claims.kind() != TokenKind.REFRESH) {
      throw new TokenVerificationException("Invalid token type");
    }
    if (claims.subject() == null) {
      throw new TokenVerificationException("Invalid token payload");
    }
    Principal principal = credentialStore.findById(claims.subject())
        .orElseThrow(() -> new TokenVerificationException("Principal not found"));
    if (!principal.active()) {
      throw new AccountInactiveException("User account is inactive");
    }
    log.debug("Refreshing access token for principal id={}", principal.id());
    String access = tokenCodec.mintAccess(principal);
    return new TokenPair(access, refreshToken, tokenCodec.ttl(TokenKind.ACCESS));
  }

  /**
   * Verifies any token without failing.
   *
   * @param token the token
   * @return the claims if the token verifies and is unexpired, empty otherwise
   */
  public Optional<TokenClaims> introspect(String token) {
    try {
      return Optional.of(tokenCodec.verify(token));
    } catch (TokenInvalidException e) {
      log.debug("Introspected token is not active: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Resolves the principal an access token was issued to.
   *
   * @param accessToken the access token
   * @return the current principal
   * @throws TokenInvalidException      if the token does not verify
   * @throws TokenVerificationException if the token is not an access token or the principal is gone
   * @throws AccountInactiveException   if the principal has been deactivated
   */
  public Principal currentPrincipal(String accessToken) {
    TokenClaims claims = tokenCodec.verify(accessToken);
    if (claims.kind() != TokenKind.ACCESS) {
      throw new TokenVerificationException("Invalid token type");
    }
    if (claims.subject() == null) {
      throw new TokenVerificationException("Invalid token payload");
    }
    Principal principal = credentialStore.findById(claims.subject())
        .orElseThrow(() -> new TokenVerificationException("Principal not found"));
    if (!principal.active()) {
      throw new AccountInactiveException("User account is inactive");
    }
    return principal;
  }

  // ── Registration ──────────────────────────────────────────────────────────

  /**
   * Registers a new principal.
   *
   * @param username the username, at least three characters
   * @param email    the email address
   * @param password the plaintext password, at least six characters
   * @param roles    initial roles; {@code user} when null or empty
   * @return the created principal
   * @throws ValidationFailedException if any input rule is violated
   * @throws DuplicateHandleException  if the username is taken
   * @throws DuplicateAddressException if the email is taken
   */
  public Principal register(String username, String email, String password,
                            Collection<String> roles) {
    List<String> violations = new ArrayList<>();
    if (username == null || username.length() < MIN_USERNAME_LENGTH) {
      violations.add("Username must be at least " + MIN_USERNAME_LENGTH + " characters long");
    }
    if (email == null || !EMAIL.matcher(email).matches()) {
      violations.add("Email must be a valid address");
    }
    if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
      violations.add("Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
    }
    if (roles != null) {
      roles.stream()
          .filter(role -> !isKnownRole(role))
          .forEach(role -> violations.add("Unknown role: " + role));
    }
    if (!violations.isEmpty()) {
      throw new ValidationFailedException(violations);
    }
    if (credentialStore.existsByUsername(username)) {
      throw new DuplicateHandleException("Username already registered");
    }
    if (credentialStore.existsByEmail(email)) {
      throw new DuplicateAddressException("Email already registered");
    }
    Collection<String> initialRoles = roles == null || roles.isEmpty()
        ? List.of(Principal.ROLE_USER) : roles;
    Principal created = credentialStore.create(
        Principal.create(username, email, passwordHasher.hash(password), initialRoles, clock.instant()));
    log.info("Registered principal id={} roles={}", created.id(), created.roles());
    return created;
  }

  // ── Administration ────────────────────────────────────────────────────────

  /**
   * Lists every principal.
   *
   * @param actor the calling principal, must hold {@code admin}
   * @return all principals
   */
  public List<Principal> listPrincipals(Principal actor) {
    requireAdmin(actor);
    return credentialStore.listAll();
  }

  /**
   * Activates or deactivates a principal. Tokens already issued stay valid until expiry.
   *
   * @param actor       the calling principal, must hold {@code admin}
   * @param principalId the target
   * @param active      the new state
   * @return the updated principal
   */
  public Principal setActive(Principal actor, String principalId, boolean active) {
    requireAdmin(actor);
    Principal target = load(principalId);
    Principal updated = active ? target.activate(clock.instant()) : target.deactivate(clock.instant());
    log.info("Principal id={} active={} (by {})", principalId, active, actor.id());
    return credentialStore.update(updated);
  }

  /**
   * Grants a role. The change reaches access tokens on the next refresh.
   *
   * @param actor       the calling principal, must hold {@code admin}
   * @param principalId the target
   * @param role        a known role
   * @return the updated principal
   */
  public Principal grantRole(Principal actor, String principalId, String role) {
    requireAdmin(actor);
    requireKnownRole(role);
    Principal updated = load(principalId).grantRole(role, clock.instant());
    log.info("Granted role {} to principal id={} (by {})", role, principalId, actor.id());
    return credentialStore.update(updated);
  }

  /**
   * Revokes a role.
   *
   * @param actor       the calling principal, must hold {@code admin}
   * @param principalId the target
   * @param role        the role to remove
   * @return the updated principal
   * @throws ValidationFailedException if the role is the principal's last one
   */
  public Principal revokeRole(Principal actor, String principalId, String role) {
    requireAdmin(actor);
    Principal updated;
    try {
      updated = load(principalId).revokeRole(role, clock.instant());
    } catch (IllegalStateException e) {
      throw new ValidationFailedException(List.of(e.getMessage()));
    }
    log.info("Revoked role {} from principal id={} (by {})", role, principalId, actor.id());
    return credentialStore.update(updated);
  }

  private Principal load(String principalId) {
    return credentialStore.findById(principalId)
        .orElseThrow(() -> new PrincipalNotFoundException("Principal not found"));
  }

  private static void requireAdmin(Principal actor) {
    if (actor == null || !actor.isAdmin()) {
      throw new AccessDeniedException("Admin role required");
    }
  }

  private static boolean isKnownRole(String role) {
    return role != null && KNOWN_ROLES.contains(role);
  }

  private static void requireKnownRole(String role) {
    if (!isKnownRole(role)) {
      throw new ValidationFailedException(List.of("Unknown role: " + role));
    }
  }
}
