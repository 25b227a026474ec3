package com.codeheadsystems.warden.core.license;

/**
 * Thrown for a validity window that is zero or negative.
 */
public class InvalidValidityWindowException extends IllegalArgumentException {

  /**
   * Instantiates a new Invalid validity window exception.
   *
   * @param message the message
   */
  public InvalidValidityWindowException(String message) {
    super(message);
  }
}
