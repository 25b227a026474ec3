package com.codeheadsystems.warden.client.model;

/**
 * Outcome of an offline verification. Every status other than {@link #VALID} is a rejection.
 */
public enum VerificationStatus {
  VALID("License is valid."),
  MALFORMED_KEY("The license key is not valid. Check that it was typed correctly."),
  CHECKSUM_MISMATCH("The license key is not valid. Check that it was typed correctly."),
  SIGNATURE_INVALID("The license could not be validated. Contact support for a new license."),
  EXPIRED("The license has expired."),
  REVOKED("The license has been revoked."),
  HARDWARE_MISMATCH("The license is registered to a different machine."),
  CLOCK_TAMPER_SUSPECTED("The system clock appears to be wrong. Correct the date and time and try again."),
  NETWORK_REQUIRED("The license has been offline too long. Connect to the internet to continue.");

  private final String userMessage;

  VerificationStatus(String userMessage) {
    this.userMessage = userMessage;
  }

  public String userMessage() {
    return userMessage;
  }
}
