package com.codeheadsystems.warden.core.audit;

/**
 * Thrown when the audit log cannot be read or written.
 */
public class AuditStoreException extends RuntimeException {

  /**
   * Instantiates a new Audit store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public AuditStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Instantiates a new Audit store exception.
   *
   * @param message the message
   */
  public AuditStoreException(String message) {
    super(message);
  }
}
