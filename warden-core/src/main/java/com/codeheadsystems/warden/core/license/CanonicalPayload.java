package com.codeheadsystems.warden.core.license;

import static com.codeheadsystems.warden.core.common.ByteUtils.I2OSP;
import static com.codeheadsystems.warden.core.common.ByteUtils.concat;
import static com.codeheadsystems.warden.core.common.ByteUtils.lengthPrefixed;

import java.time.Instant;

/**
 * The exact bytes a license signature covers (format version 1):
 * <pre>
 *   I2OSP(1, 1) || lp(serial) || lp(tierPrefix) || I2OSP(issuedAt, 8)
 *     || flag(expires) [|| I2OSP(expiresAt, 8)]
 *     || flag(bound) [|| lp(binding)]
 *     || I2OSP(keyVersion, 4)
 * </pre>
 * Instants are epoch seconds, {@code lp} is a two-byte length prefix and flags are one byte.
 * Every field is length-delimited or fixed-width so no two records share an encoding.
 */
public class CanonicalPayload {

  /**
   * The constant FORMAT_VERSION.
   */
  public static final int FORMAT_VERSION = 1;

  private static final byte[] ABSENT = {0};
  private static final byte[] PRESENT = {1};

  private CanonicalPayload() {
  }

  /**
   * Encodes the signed fields.
   *
   * @param tier            the tier
   * @param serial          the serial
   * @param issuedAt        the issued at
   * @param expiresAt       the expiry, null when perpetual
   * @param hardwareBinding the hardware fingerprint, null when floating
   * @param keyVersion      the key version
   * @return the byte [ ]
   */
  public static byte[] encode(Tier tier, String serial, Instant issuedAt, Instant expiresAt,
                              String hardwareBinding, int keyVersion) {
    return concat(
        I2OSP(FORMAT_VERSION, 1),
        lengthPrefixed(serial),
        lengthPrefixed(tier.prefix()),
        I2OSP(issuedAt.getEpochSecond(), 8),
        expiresAt == null ? ABSENT : concat(PRESENT, I2OSP(expiresAt.getEpochSecond(), 8)),
        hardwareBinding == null ? ABSENT : concat(PRESENT, lengthPrefixed(hardwareBinding)),
        I2OSP(keyVersion, 4));
  }

  /**
   * Encodes the signed fields of a record; the signature itself is excluded.
   *
   * @param record the record
   * @return the byte [ ]
   */
  public static byte[] encode(LicenseRecord record) {
    return encode(record.tier(), record.serial(), record.issuedAt(), record.expiresAt(),
        record.hardwareBinding(), record.keyVersion());
  }
}
