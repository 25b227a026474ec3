package com.codeheadsystems.warden.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.warden.core.audit.AuditLogger;
import com.codeheadsystems.warden.core.audit.ChainVerification;

/**
 * Health check that recomputes the audit chain and reports the first broken entry.
 */
public class AuditChainHealthCheck extends HealthCheck {

  private final AuditLogger auditLogger;

  /**
   * Instantiates a new Audit chain health check.
   *
   * @param auditLogger the audit logger
   */
  public AuditChainHealthCheck(AuditLogger auditLogger) {
    this.auditLogger = auditLogger;
  }

  @Override
  protected Result check() {
    ChainVerification verification = auditLogger.verifyChain();
    if (!verification.valid()) {
      return Result.unhealthy("Audit chain broken at entry %d", verification.firstInvalidIndex());
    }
    return Result.healthy("entries=%d", verification.entriesChecked());
  }
}
