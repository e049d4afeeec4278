package com.codeheadsystems.bastion.testserver;

import com.codeheadsystems.bastion.dropwizard.BastionBundle;
import com.codeheadsystems.bastion.dropwizard.BastionConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard identity server for local development against relying services.
 * Principals live in memory (lost on restart) but the signing key pair is read from, or
 * generated into, the configured {@code keysDirectory}, so tokens and the published JWKS stay
 * stable across restarts.
 * <p>
 * Run with {@code server config/config.yml} from the bastion-testserver directory.
 */
public class BastionTestServerApplication extends Application<BastionConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new BastionTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "bastion-testserver";
  }

  @Override
  public void initialize(Bootstrap<BastionConfiguration> bootstrap) {
    // Allow ${ENV_VAR:-default} substitution so individual keys can be overridden without
    // replacing the whole config file.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new BastionBundle<>());
  }

  @Override
  public void run(BastionConfiguration configuration, Environment environment) {
    // Sample relying endpoints guarded by the bundle's bearer auth filter.
    environment.jersey().register(new WhoAmIResource());
  }
}
