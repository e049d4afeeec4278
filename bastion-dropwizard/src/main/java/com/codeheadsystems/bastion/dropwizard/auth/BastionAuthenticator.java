package com.codeheadsystems.bastion.dropwizard.auth;

import com.codeheadsystems.bastion.server.exception.AccountInactiveException;
import com.codeheadsystems.bastion.server.exception.StoreUnavailableException;
import com.codeheadsystems.bastion.server.exception.TokenInvalidException;
import com.codeheadsystems.bastion.server.exception.TokenVerificationException;
import com.codeheadsystems.bastion.server.manager.AuthenticationEngine;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that resolves bearer access tokens through
 * {@link AuthenticationEngine}. Refresh tokens, expired tokens and deactivated principals are
 * rejected.
 */
public class BastionAuthenticator implements Authenticator<String, AuthenticatedPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(BastionAuthenticator.class);

  private final AuthenticationEngine authenticationEngine;

  /**
   * Instantiates a new Bastion authenticator.
   *
   * @param authenticationEngine the authentication engine
   */
  public BastionAuthenticator(AuthenticationEngine authenticationEngine) {
    this.authenticationEngine = authenticationEngine;
  }

  @Override
  public Optional<AuthenticatedPrincipal> authenticate(String token) throws AuthenticationException {
    try {
      return Optional.of(authenticationEngine.currentPrincipal(token))
          .map(p -> new AuthenticatedPrincipal(p.id(), p.username(), p.roles()));
    } catch (TokenInvalidException | TokenVerificationException | AccountInactiveException e) {
      log.debug("Bearer token rejected: {}", e.getMessage());
      return Optional.empty();
    } catch (StoreUnavailableException e) {
      throw new AuthenticationException("Credential store unavailable", e);
    }
  }
}
