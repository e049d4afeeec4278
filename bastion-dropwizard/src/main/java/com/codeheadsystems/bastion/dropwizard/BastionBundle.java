package com.codeheadsystems.bastion.dropwizard;

import com.codeheadsystems.bastion.dropwizard.auth.AuthenticatedPrincipal;
import com.codeheadsystems.bastion.dropwizard.auth.BastionAuthenticator;
import com.codeheadsystems.bastion.dropwizard.auth.RoleAuthorizer;
import com.codeheadsystems.bastion.dropwizard.health.SigningKeyHealthCheck;
import com.codeheadsystems.bastion.server.crypto.PasswordHasher;
import com.codeheadsystems.bastion.server.dispatch.AuthenticationCommands;
import com.codeheadsystems.bastion.server.dispatch.RequestDispatcher;
import com.codeheadsystems.bastion.server.exception.DuplicateAddressException;
import com.codeheadsystems.bastion.server.exception.DuplicateHandleException;
import com.codeheadsystems.bastion.server.key.KeyManager;
import com.codeheadsystems.bastion.server.manager.AuthenticationEngine;
import com.codeheadsystems.bastion.server.resource.AuthResource;
import com.codeheadsystems.bastion.server.resource.BastionExceptionMapper;
import com.codeheadsystems.bastion.server.resource.DiscoveryResource;
import com.codeheadsystems.bastion.server.resource.UserResource;
import com.codeheadsystems.bastion.server.store.CredentialStore;
import com.codeheadsystems.bastion.server.store.InMemoryCredentialStore;
import com.codeheadsystems.bastion.server.token.TokenCodec;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Paths;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import org.glassfish.jersey.server.filter.RolesAllowedDynamicFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the bastion identity provider into an existing Dropwizard
 * application. This is the composition root: it builds
 * {@link KeyManager} → {@link TokenCodec} → {@link AuthenticationEngine} →
 * {@link RequestDispatcher} once and hands them to the resources.
 * <p>
 * Registers the token, user and discovery resources, the exception mapper, a signing-key health
 * check, and a bearer-token auth filter so application resources can use {@code @Auth} and
 * {@code @RolesAllowed}. Requires a {@link BastionConfiguration} in the application's YAML.
 * <p>
 * Embed in your application with an in-memory store (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new BastionBundle<>());
 * }</pre>
 * <p>
 * Or supply a persistent store:
 * <pre>{@code
 *   bootstrap.addBundle(new BastionBundle<>(myCredentialStore));
 * }</pre>
 */
@Singleton
public class BastionBundle<C extends BastionConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(BastionBundle.class);

  private final CredentialStore credentialStore;
  private final Clock clock;

  /**
   * Creates a bundle backed by an in-memory credential store. All principals are lost on
   * restart; do not use in production.
   */
  public BastionBundle() {
    this(new InMemoryCredentialStore(), Clock.systemUTC());
    log.warn("""
        #################################################################
        # WARNING: Using an in-memory credential store. All principals #
        # will be lost on restart. Do not use in production.           #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied store.
   *
   * @param credentialStore the credential store
   */
  @Inject
  public BastionBundle(CredentialStore credentialStore) {
    this(credentialStore, Clock.systemUTC());
  }

  /**
   * Creates a bundle backed by the supplied store and clock.
   *
   * @param credentialStore the credential store
   * @param clock           time source for tokens and principal timestamps
   */
  public BastionBundle(CredentialStore credentialStore, Clock clock) {
    this.credentialStore = credentialStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    KeyManager keyManager = new KeyManager(
        Paths.get(configuration.getKeysDirectory()),
        configuration.getRsaKeySize(),
        configuration.getKeyId(),
        new SecureRandom());
    keyManager.ensureKeys();

    TokenCodec tokenCodec = new TokenCodec(
        keyManager,
        configuration.getIssuer(),
        clock,
        Duration.ofSeconds(configuration.getAccessTokenTtlSeconds()),
        Duration.ofSeconds(configuration.getRefreshTokenTtlSeconds()),
        configuration.getDefaultScopes());
    PasswordHasher passwordHasher = new PasswordHasher(
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism());
    AuthenticationEngine authenticationEngine =
        new AuthenticationEngine(credentialStore, passwordHasher, tokenCodec, clock);
    RequestDispatcher dispatcher =
        AuthenticationCommands.registerAll(new RequestDispatcher(), authenticationEngine);

    seedBootstrapPrincipals(configuration, authenticationEngine);

    environment.jersey().register(new AuthResource(dispatcher));
    environment.jersey().register(new UserResource(dispatcher));
    environment.jersey().register(new DiscoveryResource(
        keyManager, configuration.getIssuer(), configuration.getDefaultScopes()));
    environment.jersey().register(new BastionExceptionMapper());
    environment.healthChecks().register("signing-key", new SigningKeyHealthCheck(keyManager));

    // Bearer auth for application resources using @Auth / @RolesAllowed
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<AuthenticatedPrincipal>()
            .setAuthenticator(new BastionAuthenticator(authenticationEngine))
            .setAuthorizer(new RoleAuthorizer())
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(RolesAllowedDynamicFeature.class);
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(AuthenticatedPrincipal.class));
  }

  private void seedBootstrapPrincipals(C configuration, AuthenticationEngine authenticationEngine) {
    for (BootstrapPrincipal bootstrapPrincipal : configuration.getBootstrapPrincipals()) {
      try {
        authenticationEngine.register(
            bootstrapPrincipal.getUsername(),
            bootstrapPrincipal.getEmail(),
            bootstrapPrincipal.getPassword(),
            bootstrapPrincipal.getRoles());
        log.info("Seeded bootstrap principal {}", bootstrapPrincipal.getUsername());
      } catch (DuplicateHandleException | DuplicateAddressException e) {
        log.info("Bootstrap principal {} already present, skipping", bootstrapPrincipal.getUsername());
      }
    }
  }
}
