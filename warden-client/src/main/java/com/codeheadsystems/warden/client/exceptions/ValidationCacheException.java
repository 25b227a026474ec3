package com.codeheadsystems.warden.client.exceptions;

/**
 * The validation cache file could not be read, locked or written.
 */
public class ValidationCacheException extends RuntimeException {
  /**
   * Instantiates a new Validation cache exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ValidationCacheException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
