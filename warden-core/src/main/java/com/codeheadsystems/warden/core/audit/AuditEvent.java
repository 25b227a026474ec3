package com.codeheadsystems.warden.core.audit;

/**
 * Something to be appended to the audit log.
 *
 * @param type    the type
 * @param subject the license serial, or {@link #UNKNOWN_SUBJECT} when none could be decoded
 * @param result  a short outcome description
 */
public record AuditEvent(AuditEventType type, String subject, String result) {

  /**
   * Subject used when a key string could not be decoded.
   */
  public static final String UNKNOWN_SUBJECT = "unknown";

  public AuditEvent {
    if (type == null) {
      throw new IllegalArgumentException("type is required");
    }
    subject = subject == null || subject.isBlank() ? UNKNOWN_SUBJECT : subject;
    result = result == null ? "" : result;
  }
}
