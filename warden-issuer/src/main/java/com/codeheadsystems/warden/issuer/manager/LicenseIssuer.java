package com.codeheadsystems.warden.issuer.manager;

import com.codeheadsystems.warden.core.audit.AuditEvent;
import com.codeheadsystems.warden.core.audit.AuditEventType;
import com.codeheadsystems.warden.core.audit.AuditLogger;
import com.codeheadsystems.warden.core.common.RandomProvider;
import com.codeheadsystems.warden.core.fingerprint.FingerprintHash;
import com.codeheadsystems.warden.core.key.KeyManager;
import com.codeheadsystems.warden.core.key.SigningKeyPair;
import com.codeheadsystems.warden.core.license.InvalidValidityWindowException;
import com.codeheadsystems.warden.core.license.LicenseKeyCodec;
import com.codeheadsystems.warden.core.license.LicenseRecord;
import com.codeheadsystems.warden.core.license.Tier;
import com.codeheadsystems.warden.core.license.ValidityWindow;
import com.codeheadsystems.warden.issuer.store.IssuanceLedger;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates signed licenses.
 * <p>
 * Issuance reads the current signing key once, so a concurrent {@link KeyManager#rotate()} never
 * produces a record whose key version and signature disagree.
 */
@Singleton
public class LicenseIssuer {

  private static final Logger log = LoggerFactory.getLogger(LicenseIssuer.class);
  private static final int MAX_SERIAL_ATTEMPTS = 32;

  private final KeyManager keyManager;
  private final IssuanceLedger ledger;
  private final AuditLogger auditLogger;
  private final RandomProvider randomProvider;
  private final Clock clock;

  /**
   * Instantiates a new License issuer.
   *
   * @param keyManager     the key manager
   * @param ledger         the ledger
   * @param auditLogger    the audit logger
   * @param randomProvider serial randomness
   * @param clock          the clock
   */
  @Inject
  public LicenseIssuer(final KeyManager keyManager,
                       final IssuanceLedger ledger,
                       final AuditLogger auditLogger,
                       final RandomProvider randomProvider,
                       final Clock clock) {
    this.keyManager = keyManager;
    this.ledger = ledger;
    this.auditLogger = auditLogger;
    this.randomProvider = randomProvider;
    this.clock = clock;
    log.info("LicenseIssuer({}, {})", keyManager, ledger.getClass().getSimpleName());
  }

  /**
   * Issues a license for a tier given by name.
   *
   * @param tierName    the tier name, e.g. {@code basic} or {@code AI_DEVELOPER}
   * @param window      the validity window
   * @param fingerprint the machine to bind to, empty for a floating license
   * @return the issued license
   * @throws com.codeheadsystems.warden.core.license.UnknownTierException if the tier is unknown
   * @throws InvalidValidityWindowException                               if the window is missing
   */
  public IssuedLicense issue(final String tierName,
                             final ValidityWindow window,
                             final Optional<FingerprintHash> fingerprint) {
    return issue(Tier.fromName(tierName), window, fingerprint);
  }

  /**
   * Issues a license.
   *
   * @param tier        the tier
   * @param window      the validity window
   * @param fingerprint the machine to bind to, empty for a floating license
   * @return the issued license
   */
  public IssuedLicense issue(final Tier tier,
                             final ValidityWindow window,
                             final Optional<FingerprintHash> fingerprint) {
    if (window == null) {
      throw new InvalidValidityWindowException("Validity window is required");
    }
    final SigningKeyPair signingKey = keyManager.current();
    final Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    final String serial = reserveSerial();
    final LicenseRecord unsigned = new LicenseRecord(tier, serial, issuedAt,
        window.expiresAt(issuedAt).orElse(null),
        fingerprint.map(FingerprintHash::value).orElse(null),
        signingKey.keyVersion(), null);
    final LicenseRecord signed = unsigned.withSignature(signingKey.sign(unsigned.canonicalPayload()));
    ledger.record(signed);
    auditLogger.append(new AuditEvent(AuditEventType.ISSUED, serial,
        "tier=" + tier.name() + " keyVersion=" + signingKey.keyVersion()
            + " expiresAt=" + (signed.expiresAt() == null ? "never" : signed.expiresAt())
            + " bound=" + fingerprint.isPresent()));
    log.debug("issue({}, {}): serial={}, keyVersion={}", tier, window, serial, signingKey.keyVersion());
    return new IssuedLicense(signed.licenseKey().toKeyString(), signed);
  }

  private String reserveSerial() {
    for (int attempt = 0; attempt < MAX_SERIAL_ATTEMPTS; attempt++) {
      final String serial = LicenseKeyCodec.randomSerial(randomProvider);
      if (ledger.reserve(serial)) {
        return serial;
      }
    }
    throw new IllegalStateException("Unable to reserve a unique serial after " + MAX_SERIAL_ATTEMPTS + " attempts");
  }
}
