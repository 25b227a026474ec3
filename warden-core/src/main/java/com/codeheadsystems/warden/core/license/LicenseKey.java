package com.codeheadsystems.warden.core.license;

/**
 * The part of a license carried by the human-typeable key string.
 *
 * @param tier   the tier
 * @param serial the 11-character serial
 */
public record LicenseKey(Tier tier, String serial) {

  public LicenseKey {
    if (tier == null) {
      throw new IllegalArgumentException("tier is required");
    }
    if (!LicenseKeyCodec.isValidSerial(serial)) {
      throw new IllegalArgumentException("Invalid serial: " + serial);
    }
  }

  /**
   * Parses a key string.
   *
   * @param keyString the key string
   * @return the license key
   * @throws MalformedLicenseKeyException if the string does not decode
   */
  public static LicenseKey parse(String keyString) {
    return LicenseKeyCodec.decode(keyString);
  }

  /**
   * Formats this key as {@code TIER-XXXXX-XXXXX-XXXXX}.
   *
   * @return the string
   */
  public String toKeyString() {
    return LicenseKeyCodec.encode(this);
  }
}
