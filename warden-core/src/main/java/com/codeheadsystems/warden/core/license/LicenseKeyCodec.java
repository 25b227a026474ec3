package com.codeheadsystems.warden.core.license;

import com.codeheadsystems.warden.core.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes and decodes {@code TIER-XXXXX-XXXXX-XXXXX} license key strings.
 * <p>
 * The fifteen body characters are an eleven-character serial followed by four checksum
 * characters, all from a 32-symbol alphabet without I, L, O or U. The checksum is computed over
 * the ASCII of the tier prefix and serial with two rolling hashes:
 * <pre>
 *   h = (h * 31 + c) mod 2^31          starting at 0
 *   r = ((r xor c) * 17) mod 2^16      starting at 0x5A3C
 * </pre>
 * The first three checksum characters hold the low 15 bits of {@code h}, high bits first. The
 * last folds {@code r} down to five bits. The checksum only catches typing mistakes; it carries
 * no authenticity.
 */
public class LicenseKeyCodec {

  /**
   * The key alphabet.
   */
  public static final String ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";
  /**
   * The constant SERIAL_LENGTH.
   */
  public static final int SERIAL_LENGTH = 11;
  /**
   * The constant CHECKSUM_LENGTH.
   */
  public static final int CHECKSUM_LENGTH = 4;

  private static final int GROUP = 5;
  private static final int R_SEED = 0x5A3C;
  private static final Pattern SHAPE =
      Pattern.compile("^([A-Z]{4})-([0-9A-Z]{5})-([0-9A-Z]{5})-([0-9A-Z]{5})$");

  private LicenseKeyCodec() {
  }

  /**
   * Formats a key.
   *
   * @param key the key
   * @return the key string
   */
  public static String encode(LicenseKey key) {
    String body = key.serial() + checksum(key.tier().prefix(), key.serial());
    StringBuilder out = new StringBuilder(key.tier().prefix());
    for (int i = 0; i < body.length(); i += GROUP) {
      out.append('-').append(body, i, i + GROUP);
    }
    return out.toString();
  }

  /**
   * Decodes a key string after trimming and upper-casing it. No cryptographic work is done.
   *
   * @param keyString the key string
   * @return the license key
   * @throws MalformedLicenseKeyException on a bad shape, alphabet, prefix or checksum
   */
  public static LicenseKey decode(String keyString) {
    if (keyString == null) {
      throw malformed("License key is missing");
    }
    Matcher matcher = SHAPE.matcher(keyString.trim().toUpperCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw malformed("License key does not have the form TIER-XXXXX-XXXXX-XXXXX");
    }
    Tier tier = Tier.fromPrefix(matcher.group(1))
        .orElseThrow(() -> malformed("Unknown tier prefix: " + matcher.group(1)));
    String body = matcher.group(2) + matcher.group(3) + matcher.group(4);
    for (int i = 0; i < body.length(); i++) {
      if (ALPHABET.indexOf(body.charAt(i)) < 0) {
        throw malformed("Character not allowed in license key: " + body.charAt(i));
      }
    }
    String serial = body.substring(0, SERIAL_LENGTH);
    String given = body.substring(SERIAL_LENGTH);
    if (!checksum(tier.prefix(), serial).equals(given)) {
      throw new MalformedLicenseKeyException(MalformedLicenseKeyException.Reason.CHECKSUM_MISMATCH,
          "License key checksum does not match");
    }
    return new LicenseKey(tier, serial);
  }

  /**
   * Draws a fresh serial: eleven symbols, 55 random bits.
   *
   * @param randomProvider the random provider
   * @return the serial
   */
  public static String randomSerial(RandomProvider randomProvider) {
    StringBuilder serial = new StringBuilder(SERIAL_LENGTH);
    for (int i = 0; i < SERIAL_LENGTH; i++) {
      serial.append(ALPHABET.charAt(randomProvider.nextInt(ALPHABET.length())));
    }
    return serial.toString();
  }

  /**
   * Is valid serial boolean.
   *
   * @param serial the serial
   * @return the boolean
   */
  public static boolean isValidSerial(String serial) {
    if (serial == null || serial.length() != SERIAL_LENGTH) {
      return false;
    }
    for (int i = 0; i < serial.length(); i++) {
      if (ALPHABET.indexOf(serial.charAt(i)) < 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * The four checksum characters for a prefix and serial.
   *
   * @param prefix the tier prefix
   * @param serial the serial
   * @return the checksum
   */
  static String checksum(String prefix, String serial) {
    long h = 0;
    int r = R_SEED;
    for (byte b : (prefix + serial).getBytes(StandardCharsets.US_ASCII)) {
      int c = b & 0xFF;
      h = (h * 31 + c) & 0x7FFFFFFFL;
      r = ((r ^ c) * 17) & 0xFFFF;
    }
    int low = (int) (h & 0x7FFF);
    int folded = (r ^ (r >>> 5) ^ (r >>> 10)) & 0x1F;
    return new String(new char[]{
        ALPHABET.charAt((low >>> 10) & 0x1F),
        ALPHABET.charAt((low >>> 5) & 0x1F),
        ALPHABET.charAt(low & 0x1F),
        ALPHABET.charAt(folded)
    });
  }

  private static MalformedLicenseKeyException malformed(String message) {
    return new MalformedLicenseKeyException(MalformedLicenseKeyException.Reason.MALFORMED, message);
  }
}
