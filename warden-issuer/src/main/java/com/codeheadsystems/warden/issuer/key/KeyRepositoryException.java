package com.codeheadsystems.warden.issuer.key;

/**
 * Thrown when key files cannot be read or written.
 */
public class KeyRepositoryException extends RuntimeException {

  /**
   * Instantiates a new Key repository exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyRepositoryException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Instantiates a new Key repository exception.
   *
   * @param message the message
   */
  public KeyRepositoryException(String message) {
    super(message);
  }
}
