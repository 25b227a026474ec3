package com.codeheadsystems.warden.client.exceptions;

/**
 * The revocation server could not be reached or gave an unusable answer.
 */
public class RevocationAccessorException extends RuntimeException {
  /**
   * Instantiates a new Revocation accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public RevocationAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
