package com.codeheadsystems.warden.client.config;

import java.time.Duration;

/**
 * Tunables for offline verification.
 *
 * @param clockSkewTolerance how far the local clock may lag the last seen time, or drift from the
 *                           server time, before it is reported
 * @param gracePeriod        how long a license keeps working without an online confirmation
 * @param requestTimeout     connect and request timeout for the revocation check
 */
public record VerifierConfig(Duration clockSkewTolerance, Duration gracePeriod, Duration requestTimeout) {

  /**
   * Default skew tolerance.
   */
  public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofMinutes(5);
  /**
   * Default grace period.
   */
  public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofDays(30);
  /**
   * Default request timeout.
   */
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);

  public VerifierConfig {
    requireNonNegative(clockSkewTolerance, "clockSkewTolerance");
    requireNonNegative(gracePeriod, "gracePeriod");
    if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  /**
   * Instantiates a new Verifier config with the defaults.
   */
  public VerifierConfig() {
    this(DEFAULT_CLOCK_SKEW, DEFAULT_GRACE_PERIOD, DEFAULT_REQUEST_TIMEOUT);
  }

  private static void requireNonNegative(Duration value, String name) {
    if (value == null || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be zero or positive");
    }
  }
}
