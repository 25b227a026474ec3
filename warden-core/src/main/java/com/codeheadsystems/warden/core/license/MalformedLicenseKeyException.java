package com.codeheadsystems.warden.core.license;

/**
 * Thrown when a license key string cannot be decoded.
 */
public class MalformedLicenseKeyException extends IllegalArgumentException {

  /**
   * Why decoding failed.
   */
  public enum Reason {
    /**
     * Wrong shape, a character outside the key alphabet, or an unknown tier prefix.
     */
    MALFORMED,
    /**
     * Well formed, but the checksum characters do not match the tier and serial.
     */
    CHECKSUM_MISMATCH
  }

  private final Reason reason;

  /**
   * Instantiates a new Malformed license key exception.
   *
   * @param reason  the reason
   * @param message the message
   */
  public MalformedLicenseKeyException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
