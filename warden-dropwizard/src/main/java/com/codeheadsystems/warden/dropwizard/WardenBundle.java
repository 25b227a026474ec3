package com.codeheadsystems.warden.dropwizard;

import com.codeheadsystems.warden.core.audit.AuditLogger;
import com.codeheadsystems.warden.core.audit.AuditStore;
import com.codeheadsystems.warden.core.audit.FileAuditStore;
import com.codeheadsystems.warden.core.audit.InMemoryAuditStore;
import com.codeheadsystems.warden.core.common.RandomProvider;
import com.codeheadsystems.warden.core.key.KeyManager;
import com.codeheadsystems.warden.core.key.KeyManagerConfig;
import com.codeheadsystems.warden.core.key.SigningKeyPair;
import com.codeheadsystems.warden.dropwizard.health.AuditChainHealthCheck;
import com.codeheadsystems.warden.dropwizard.health.KeyRingHealthCheck;
import com.codeheadsystems.warden.issuer.key.FileKeyRepository;
import com.codeheadsystems.warden.issuer.manager.LicenseIssuer;
import com.codeheadsystems.warden.issuer.manager.RevocationManager;
import com.codeheadsystems.warden.issuer.resource.PublicKeyResource;
import com.codeheadsystems.warden.issuer.resource.RevocationResource;
import com.codeheadsystems.warden.issuer.store.InMemoryIssuanceLedger;
import com.codeheadsystems.warden.issuer.store.InMemoryRevocationStore;
import com.codeheadsystems.warden.issuer.store.IssuanceLedger;
import com.codeheadsystems.warden.issuer.store.RevocationStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the warden license server into an existing Dropwizard application.
 * <p>
 * Registers the revocation check and public key resources plus the key ring and audit chain
 * health checks. Requires a {@link WardenConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new WardenBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new WardenBundle<>(myIssuanceLedger, myRevocationStore));
 * }</pre>
 * The managers built in {@link #run} are exposed afterwards so the host application can issue
 * and revoke licenses from its own resources or tasks.
 */
@Singleton
public class WardenBundle<C extends WardenConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(WardenBundle.class);

  static final int MIN_AUDIT_KEY_BYTES = 32;

  private final IssuanceLedger issuanceLedger;
  private final RevocationStore revocationStore;
  private final Clock clock;

  private KeyManager keyManager;
  private AuditLogger auditLogger;
  private LicenseIssuer licenseIssuer;
  private RevocationManager revocationManager;

  /**
   * Creates a bundle backed by an in-memory issuance ledger and revocation store.
   * <p>
   * For dev/test only: issued serials and revocations are lost on restart.
   */
  public WardenBundle() {
    this(new InMemoryIssuanceLedger(), new InMemoryRevocationStore(), Clock.systemUTC());
    log.warn("""
        #################################################################
        # WARNING: Using in-memory issuance ledger and revocation store.#
        # Issued serials and revocations will be lost on restart.       #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param issuanceLedger  the issuance ledger
   * @param revocationStore the revocation store
   */
  @Inject
  public WardenBundle(IssuanceLedger issuanceLedger, RevocationStore revocationStore) {
    this(issuanceLedger, revocationStore, Clock.systemUTC());
  }

  WardenBundle(IssuanceLedger issuanceLedger, RevocationStore revocationStore, Clock clock) {
    this.issuanceLedger = issuanceLedger;
    this.revocationStore = revocationStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    keyManager = buildKeyManager(configuration);
    auditLogger = new AuditLogger(buildAuditKey(configuration), buildAuditStore(configuration), clock);
    licenseIssuer = new LicenseIssuer(keyManager, issuanceLedger, auditLogger, new RandomProvider(), clock);
    revocationManager = new RevocationManager(issuanceLedger, revocationStore, auditLogger, clock);

    environment.jersey().register(new RevocationResource(revocationManager));
    environment.jersey().register(new PublicKeyResource(keyManager));
    environment.healthChecks().register("key-ring", new KeyRingHealthCheck(keyManager));
    environment.healthChecks().register("audit-chain", new AuditChainHealthCheck(auditLogger));
  }

  public KeyManager keyManager() {
    return requireRunning(keyManager);
  }

  public AuditLogger auditLogger() {
    return requireRunning(auditLogger);
  }

  public LicenseIssuer licenseIssuer() {
    return requireRunning(licenseIssuer);
  }

  public RevocationManager revocationManager() {
    return requireRunning(revocationManager);
  }

  private static <T> T requireRunning(T component) {
    if (component == null) {
      throw new IllegalStateException("WardenBundle has not been run yet");
    }
    return component;
  }

  private KeyManager buildKeyManager(C configuration) {
    KeyManagerConfig keyConfig = new KeyManagerConfig(configuration.getKeySizeBits(),
        configuration.getKeyRetention(), RandomProvider.strong());
    String directory = configuration.getKeyDirectory();
    if (directory == null || directory.isEmpty()) {
      log.warn("No key directory configured; generating an ephemeral signing key. "
          + "Licenses issued now will not verify after a restart. Do not use in production.");
      KeyManager ephemeral = new KeyManager(keyConfig);
      ephemeral.rotate();
      return ephemeral;
    }

    FileKeyRepository repository = new FileKeyRepository(Path.of(directory));
    List<SigningKeyPair> existing = repository.loadAll();
    if (!existing.isEmpty()) {
      return new KeyManager(keyConfig, existing);
    }
    if (!configuration.isGenerateKeyIfMissing()) {
      throw new IllegalStateException("No signing keys in " + directory
          + " and generateKeyIfMissing is false. Generate one with the keygen command.");
    }
    KeyManager generated = new KeyManager(keyConfig);
    generated.rotate();
    repository.save(generated.current());
    log.info("Generated signing key version {} in {}", generated.current().keyVersion(), directory);
    return generated;
  }

  private AuditStore buildAuditStore(C configuration) {
    String path = configuration.getAuditLogPath();
    if (path == null || path.isEmpty()) {
      return new InMemoryAuditStore();
    }
    return new FileAuditStore(Path.of(path));
  }

  private byte[] buildAuditKey(C configuration) {
    String keyHex = configuration.getAuditKeyHex();
    if (keyHex == null || keyHex.isEmpty()) {
      log.warn("No audit key configured; generating randomly. "
          + "The audit chain cannot be verified after a restart. Do not use in production.");
      return RandomProvider.strong().randomBytes(MIN_AUDIT_KEY_BYTES);
    }
    final byte[] key;
    try {
      key = Hex.decode(keyHex);
    } catch (DecoderException e) {
      throw new IllegalStateException("auditKeyHex is not valid hex", e);
    }
    if (key.length < MIN_AUDIT_KEY_BYTES) {
      throw new IllegalStateException("auditKeyHex must encode at least " + MIN_AUDIT_KEY_BYTES
          + " bytes. Generate a value with: openssl rand -hex 32");
    }
    return key;
  }
}
