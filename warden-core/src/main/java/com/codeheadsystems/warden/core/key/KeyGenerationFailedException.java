package com.codeheadsystems.warden.core.key;

/**
 * Thrown when a signing key pair cannot be generated, typically because the entropy source is
 * unavailable or exhausted. Issuance must abort; there is no weaker fallback.
 */
public class KeyGenerationFailedException extends RuntimeException {

  /**
   * Instantiates a new Key generation failed exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyGenerationFailedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
