package com.codeheadsystems.warden.core.fingerprint;

import java.util.regex.Pattern;

/**
 * A machine fingerprint: 64 lowercase hex characters of SHA-256.
 *
 * @param value the hex value
 */
public record FingerprintHash(String value) {

  private static final Pattern HEX_64 = Pattern.compile("^[0-9a-f]{64}$");

  public FingerprintHash {
    if (value == null || !HEX_64.matcher(value).matches()) {
      throw new IllegalArgumentException("Fingerprint must be 64 lowercase hex characters");
    }
  }

  /**
   * Matches boolean. Bindings are compared exactly.
   *
   * @param binding the binding stored in a license
   * @return the boolean
   */
  public boolean matches(String binding) {
    return value.equals(binding);
  }

  @Override
  public String toString() {
    return value;
  }
}
