package com.codeheadsystems.warden.client.manager;

import com.codeheadsystems.warden.client.cache.ValidationCache;
import com.codeheadsystems.warden.client.cache.ValidationCacheEntry;
import com.codeheadsystems.warden.client.config.VerifierConfig;
import com.codeheadsystems.warden.client.exceptions.ValidationCacheException;
import com.codeheadsystems.warden.client.model.ReconcileResult;
import com.codeheadsystems.warden.client.model.VerificationResult;
import com.codeheadsystems.warden.client.model.VerificationStatus;
import com.codeheadsystems.warden.core.audit.AuditEvent;
import com.codeheadsystems.warden.core.audit.AuditEventType;
import com.codeheadsystems.warden.core.audit.AuditLogger;
import com.codeheadsystems.warden.core.fingerprint.FingerprintHash;
import com.codeheadsystems.warden.core.key.KeyRing;
import com.codeheadsystems.warden.core.license.LicenseKey;
import com.codeheadsystems.warden.core.license.LicenseRecord;
import com.codeheadsystems.warden.core.license.LicenseSignature;
import com.codeheadsystems.warden.core.license.MalformedLicenseKeyException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies a license without the network. The checks run in a fixed order and the first failure
 * decides the result: key format, signature, expiry and clock, hardware binding, revocation.
 * Every result is written to the audit log before it is returned.
 */
@Singleton
public class OfflineVerifier {

  private static final Logger log = LoggerFactory.getLogger(OfflineVerifier.class);

  private final KeyRing keyRing;
  private final ValidationCache cache;
  private final AuditLogger auditLogger;
  private final Optional<OnlineReconciler> reconciler;
  private final VerifierConfig config;
  private final Clock clock;

  /**
   * Instantiates a new Offline verifier.
   *
   * @param keyRing     the public keys this build trusts
   * @param cache       the local validation cache
   * @param auditLogger the audit logger
   * @param reconciler  the online reconciler, empty for a purely offline verifier
   * @param config      the config
   * @param clock       the clock
   */
  @Inject
  public OfflineVerifier(final KeyRing keyRing,
                         final ValidationCache cache,
                         final AuditLogger auditLogger,
                         final Optional<OnlineReconciler> reconciler,
                         final VerifierConfig config,
                         final Clock clock) {
    log.info("OfflineVerifier({}, online={})", keyRing, reconciler.isPresent());
    this.keyRing = keyRing;
    this.cache = cache;
    this.auditLogger = auditLogger;
    this.reconciler = reconciler;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Verify a license.
   *
   * @param keyString        the license key string as typed or stored
   * @param signature        the contents of the license file
   * @param localFingerprint this machine's fingerprint
   * @return the verification result
   * @throws com.codeheadsystems.warden.core.audit.AuditStoreException if the outcome cannot be audited
   * @throws ValidationCacheException if the local cache cannot be read or written; this is
   *                                  audited as an error before it is thrown
   */
  public VerificationResult verify(final String keyString,
                                   final LicenseSignature signature,
                                   final FingerprintHash localFingerprint) {
    final Instant now = clock.instant();

    final LicenseKey key;
    try {
      key = LicenseKey.parse(keyString);
    } catch (MalformedLicenseKeyException e) {
      VerificationStatus status = e.reason() == MalformedLicenseKeyException.Reason.CHECKSUM_MISMATCH
          ? VerificationStatus.CHECKSUM_MISMATCH
          : VerificationStatus.MALFORMED_KEY;
      return audited(AuditEvent.UNKNOWN_SUBJECT, VerificationResult.rejected(status, null, e.getMessage()));
    }
    final String serial = key.serial();

    if (signature == null) {
      return audited(serial, VerificationResult.rejected(VerificationStatus.SIGNATURE_INVALID, key.tier(),
          "license file missing"));
    }
    final LicenseRecord record = LicenseRecord.of(key, signature);
    if (!keyRing.contains(record.keyVersion())) {
      return audited(serial, VerificationResult.rejected(VerificationStatus.SIGNATURE_INVALID, key.tier(),
          "key version " + record.keyVersion() + " not trusted"));
    }
    if (!keyRing.verify(record.keyVersion(), record.canonicalPayload(), record.signature())) {
      return audited(serial, VerificationResult.rejected(VerificationStatus.SIGNATURE_INVALID, key.tier(),
          "signature does not verify"));
    }

    try {
      return checkValidity(key, record, localFingerprint, now);
    } catch (ValidationCacheException e) {
      auditLogger.append(new AuditEvent(AuditEventType.REJECTED, serial,
          "ERROR tier=" + key.tier().name() + " reason=" + e.getMessage()));
      throw e;
    }
  }

  private VerificationResult checkValidity(final LicenseKey key,
                                           final LicenseRecord record,
                                           final FingerprintHash localFingerprint,
                                           final Instant now) {
    final String serial = key.serial();
    if (record.isExpiredAt(now)) {
      return audited(serial, VerificationResult.rejected(VerificationStatus.EXPIRED, key.tier(),
          "expired at " + record.expiresAt()));
    }
    final Optional<ValidationCacheEntry> cached = cache.find(serial);
    if (cached.isPresent() && now.isBefore(cached.get().lastSeenAt().minus(config.clockSkewTolerance()))) {
      return audited(serial, VerificationResult.rejected(VerificationStatus.CLOCK_TAMPER_SUSPECTED, key.tier(),
          "clock " + now + " is before last seen " + cached.get().lastSeenAt()));
    }

    if (record.hardwareBinding() != null
        && (localFingerprint == null || !localFingerprint.matches(record.hardwareBinding()))) {
      return audited(serial, VerificationResult.rejected(VerificationStatus.HARDWARE_MISMATCH, key.tier(),
          "hardware binding does not match"));
    }

    Instant confirmedOnlineAt = null;
    Optional<ReconcileResult> online = reconciler.map(r -> r.reconcile(serial));
    if (online.isPresent() && online.get().isReachable()) {
      if (online.get().revoked()) {
        cache.recordRevocation(record, now);
        return audited(serial, VerificationResult.rejected(VerificationStatus.REVOKED, key.tier(),
            "revoked by server"));
      }
      confirmedOnlineAt = now;
    } else {
      // Offline: fall back to what the cache last knew.
      if (cached.map(ValidationCacheEntry::revoked).orElse(false)) {
        return audited(serial, VerificationResult.rejected(VerificationStatus.REVOKED, key.tier(),
            "revoked when last online"));
      }
      if (online.isPresent()) {
        Instant anchor = cached.flatMap(ValidationCacheEntry::lastOnline).orElse(record.issuedAt());
        if (now.isAfter(anchor.plus(config.gracePeriod()))) {
          return audited(serial, VerificationResult.rejected(VerificationStatus.NETWORK_REQUIRED, key.tier(),
              "offline since " + anchor + ": " + online.get().reason()));
        }
      }
    }

    cache.recordVerification(record, now, confirmedOnlineAt);
    return audited(serial, VerificationResult.valid(key.tier()));
  }

  private VerificationResult audited(String subject, VerificationResult result) {
    AuditEventType type = result.isValid() ? AuditEventType.VERIFIED : AuditEventType.REJECTED;
    String detail = result.status().name()
        + (result.tier() == null ? "" : " tier=" + result.tier().name())
        + (result.isValid() ? "" : " reason=" + result.detail());
    auditLogger.append(new AuditEvent(type, subject, detail));
    log.debug("verify({}): {}", subject, result.status());
    return result;
  }
}
