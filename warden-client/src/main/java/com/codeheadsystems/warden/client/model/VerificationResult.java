package com.codeheadsystems.warden.client.model;

import com.codeheadsystems.warden.core.license.Tier;
import java.util.Optional;

/**
 * Result of verifying a license.
 *
 * @param status the status
 * @param tier   the tier named by the key, null when the key did not decode
 * @param detail the technical reason, kept for logs and audit entries
 */
public record VerificationResult(VerificationStatus status, Tier tier, String detail) {

  public VerificationResult {
    if (status == null) {
      throw new IllegalArgumentException("status is required");
    }
  }

  /**
   * A valid result.
   *
   * @param tier the tier
   * @return the verification result
   */
  public static VerificationResult valid(Tier tier) {
    return new VerificationResult(VerificationStatus.VALID, tier, "valid");
  }

  /**
   * A rejection.
   *
   * @param status the status
   * @param tier   the tier, may be null
   * @param detail the detail
   * @return the verification result
   */
  public static VerificationResult rejected(VerificationStatus status, Tier tier, String detail) {
    if (status == VerificationStatus.VALID) {
      throw new IllegalArgumentException("A rejection cannot carry VALID");
    }
    return new VerificationResult(status, tier, detail);
  }

  public boolean isValid() {
    return status == VerificationStatus.VALID;
  }

  public Optional<Tier> licensedTier() {
    return Optional.ofNullable(tier);
  }

  /**
   * Plain-language reason suitable for an end user.
   *
   * @return the message
   */
  public String userMessage() {
    return status.userMessage();
  }
}
