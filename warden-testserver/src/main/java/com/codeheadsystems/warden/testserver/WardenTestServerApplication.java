package com.codeheadsystems.warden.testserver;

import com.codeheadsystems.warden.dropwizard.WardenBundle;
import com.codeheadsystems.warden.dropwizard.WardenConfiguration;
import com.codeheadsystems.warden.issuer.store.InMemoryIssuanceLedger;
import com.codeheadsystems.warden.issuer.store.InMemoryRevocationStore;
import com.codeheadsystems.warden.testserver.task.IssueLicenseTask;
import com.codeheadsystems.warden.testserver.task.RevokeLicenseTask;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local developer testing of license clients.
 * Uses in-memory issuance ledger and revocation store (data lost on restart), but reads the
 * signing keys and audit settings from {@code config/config.yml} so that issued licenses keep
 * verifying across restarts as long as the key directory is kept.
 * <p>
 * Licenses are issued and revoked through admin tasks:
 * <pre>
 *   curl -X POST 'http://localhost:8081/tasks/issue-license?tier=gamer&amp;days=30'
 *   curl -X POST 'http://localhost:8081/tasks/revoke-license?serial=7KQ2M9X0B4T'
 * </pre>
 */
public class WardenTestServerApplication extends Application<WardenConfiguration> {

  private final WardenBundle<WardenConfiguration> bundle =
      new WardenBundle<>(new InMemoryIssuanceLedger(), new InMemoryRevocationStore());

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new WardenTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "warden-testserver";
  }

  @Override
  public void initialize(Bootstrap<WardenConfiguration> bootstrap) {
    // Allow ${ENV_VAR:-default} substitution in config YAML files so Docker
    // environment variables can override individual keys without replacing the
    // entire config file.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(bundle);
  }

  @Override
  public void run(WardenConfiguration configuration, Environment environment) {
    environment.admin().addTask(new IssueLicenseTask(bundle.licenseIssuer(), environment.getObjectMapper()));
    environment.admin().addTask(new RevokeLicenseTask(bundle.revocationManager()));
  }

  public WardenBundle<WardenConfiguration> bundle() {
    return bundle;
  }
}
