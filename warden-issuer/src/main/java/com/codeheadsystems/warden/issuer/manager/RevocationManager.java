package com.codeheadsystems.warden.issuer.manager;

import com.codeheadsystems.warden.core.audit.AuditEvent;
import com.codeheadsystems.warden.core.audit.AuditEventType;
import com.codeheadsystems.warden.core.audit.AuditLogger;
import com.codeheadsystems.warden.issuer.store.IssuanceLedger;
import com.codeheadsystems.warden.issuer.store.RevocationStore;
import com.codeheadsystems.warden.model.RevocationCheckResponse;
import java.time.Clock;
import java.time.Instant;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Revokes issued licenses and answers online revocation checks. Revocation only ever denies;
 * a license that was never issued here is reported as not revoked.
 */
@Singleton
public class RevocationManager {

  private static final Logger log = LoggerFactory.getLogger(RevocationManager.class);

  private final IssuanceLedger ledger;
  private final RevocationStore revocationStore;
  private final AuditLogger auditLogger;
  private final Clock clock;

  /**
   * Instantiates a new Revocation manager.
   *
   * @param ledger          the ledger
   * @param revocationStore the revocation store
   * @param auditLogger     the audit logger
   * @param clock           the clock
   */
  @Inject
  public RevocationManager(final IssuanceLedger ledger,
                           final RevocationStore revocationStore,
                           final AuditLogger auditLogger,
                           final Clock clock) {
    this.ledger = ledger;
    this.revocationStore = revocationStore;
    this.auditLogger = auditLogger;
    this.clock = clock;
    log.info("RevocationManager({})", revocationStore.getClass().getSimpleName());
  }

  /**
   * Revokes an issued license. Revoking an already revoked license is a no-op.
   *
   * @param serial the serial
   * @return true if this call revoked it
   * @throws IllegalArgumentException if the serial was never issued
   */
  public boolean revoke(final String serial) {
    if (ledger.lookup(serial).isEmpty()) {
      throw new IllegalArgumentException("Unknown serial: " + serial);
    }
    final Instant now = clock.instant();
    final boolean revoked = revocationStore.revoke(serial, now);
    if (revoked) {
      auditLogger.append(new AuditEvent(AuditEventType.REVOKED, serial, "revokedAt=" + now));
      log.info("revoke({})", serial);
    } else {
      log.debug("revoke({}): already revoked", serial);
    }
    return revoked;
  }

  /**
   * Current revocation status.
   *
   * @param serial the serial
   * @return the revocation check response
   */
  public RevocationCheckResponse check(final String serial) {
    final boolean revoked = revocationStore.isRevoked(serial);
    log.debug("check({}): revoked={}", serial, revoked);
    return new RevocationCheckResponse(serial, revoked, clock.instant());
  }
}
