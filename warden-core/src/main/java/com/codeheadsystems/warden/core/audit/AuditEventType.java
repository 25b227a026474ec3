package com.codeheadsystems.warden.core.audit;

/**
 * The kinds of events recorded in the audit log.
 */
public enum AuditEventType {
  ISSUED,
  VERIFIED,
  REJECTED,
  REVOKED
}
