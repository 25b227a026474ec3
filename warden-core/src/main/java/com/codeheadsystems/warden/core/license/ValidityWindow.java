package com.codeheadsystems.warden.core.license;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * How long an issued license stays valid. Either a positive duration or perpetual.
 */
public final class ValidityWindow {

  private static final ValidityWindow PERPETUAL = new ValidityWindow(null);

  private final Duration duration;

  private ValidityWindow(Duration duration) {
    this.duration = duration;
  }

  /**
   * A window of the given length. Nothing is clamped.
   *
   * @param duration the duration
   * @return the validity window
   * @throws InvalidValidityWindowException if the duration is null, zero or negative
   */
  public static ValidityWindow of(Duration duration) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      throw new InvalidValidityWindowException("Validity window must be positive: " + duration);
    }
    return new ValidityWindow(duration);
  }

  public static ValidityWindow ofDays(long days) {
    return of(Duration.ofDays(days));
  }

  public static ValidityWindow perpetual() {
    return PERPETUAL;
  }

  public boolean isPerpetual() {
    return duration == null;
  }

  public Optional<Duration> duration() {
    return Optional.ofNullable(duration);
  }

  /**
   * The expiry for a license issued at the given instant.
   *
   * @param issuedAt the issued at
   * @return the expiry, empty when perpetual
   */
  public Optional<Instant> expiresAt(Instant issuedAt) {
    return duration().map(issuedAt::plus);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ValidityWindow other && Objects.equals(duration, other.duration);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(duration);
  }

  @Override
  public String toString() {
    return isPerpetual() ? "ValidityWindow[perpetual]" : "ValidityWindow[" + duration + "]";
  }
}
