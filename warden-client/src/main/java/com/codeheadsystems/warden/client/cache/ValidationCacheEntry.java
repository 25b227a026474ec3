package com.codeheadsystems.warden.client.cache;

import static com.codeheadsystems.warden.core.common.ByteUtils.I2OSP;
import static com.codeheadsystems.warden.core.common.ByteUtils.concat;
import static com.codeheadsystems.warden.core.common.ByteUtils.lengthPrefixed;

import com.codeheadsystems.warden.core.license.LicenseRecord;
import com.codeheadsystems.warden.core.license.Tier;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * What this machine last knew about one license.
 *
 * @param serial          the serial
 * @param tier            the tier
 * @param issuedAt        the issued at
 * @param expiresAt       the expiry, null when perpetual
 * @param hardwareBinding the binding, null when floating
 * @param keyVersion      the key version
 * @param lastOnlineAt    the last time the server confirmed the license, null if never
 * @param revoked         the last known revocation flag
 * @param lastSeenAt      the local clock at the last successful verification
 * @param hmac            hex HMAC-SHA256 over every other field
 */
public record ValidationCacheEntry(String serial, Tier tier, Instant issuedAt, Instant expiresAt,
                                   String hardwareBinding, int keyVersion, Instant lastOnlineAt,
                                   boolean revoked, Instant lastSeenAt, String hmac) {

  public ValidationCacheEntry {
    if (serial == null || tier == null || issuedAt == null || lastSeenAt == null) {
      throw new IllegalArgumentException("serial, tier, issuedAt and lastSeenAt are required");
    }
    issuedAt = issuedAt.truncatedTo(ChronoUnit.SECONDS);
    expiresAt = expiresAt == null ? null : expiresAt.truncatedTo(ChronoUnit.SECONDS);
  }

  /**
   * An unsigned entry describing a verified record.
   *
   * @param record       the record
   * @param lastOnlineAt the last online confirmation, may be null
   * @param lastSeenAt   the local time of this verification
   * @return the validation cache entry
   */
  public static ValidationCacheEntry of(LicenseRecord record, Instant lastOnlineAt, Instant lastSeenAt) {
    return new ValidationCacheEntry(record.serial(), record.tier(), record.issuedAt(), record.expiresAt(),
        record.hardwareBinding(), record.keyVersion(), lastOnlineAt, false, lastSeenAt, null);
  }

  public Optional<Instant> lastOnline() {
    return Optional.ofNullable(lastOnlineAt);
  }

  /**
   * Same fields after a server answer.
   *
   * @param onlineAt  when the server answered, on the local clock
   * @param isRevoked the server's flag
   * @return the unsigned entry
   */
  public ValidationCacheEntry reconciled(Instant onlineAt, boolean isRevoked) {
    return new ValidationCacheEntry(serial, tier, issuedAt, expiresAt, hardwareBinding, keyVersion,
        onlineAt, isRevoked, lastSeenAt, null);
  }

  public ValidationCacheEntry withHmac(String newHmac) {
    return new ValidationCacheEntry(serial, tier, issuedAt, expiresAt, hardwareBinding, keyVersion,
        lastOnlineAt, revoked, lastSeenAt, newHmac);
  }

  /**
   * The bytes the HMAC covers.
   *
   * @return the byte [ ]
   */
  public byte[] canonicalBytes() {
    return concat(
        lengthPrefixed(serial),
        lengthPrefixed(tier.prefix()),
        I2OSP(issuedAt.getEpochSecond(), 8),
        optionalInstant(expiresAt),
        hardwareBinding == null ? new byte[]{0} : concat(new byte[]{1}, lengthPrefixed(hardwareBinding)),
        I2OSP(keyVersion, 4),
        optionalInstant(lastOnlineAt),
        new byte[]{(byte) (revoked ? 1 : 0)},
        I2OSP(lastSeenAt.getEpochSecond(), 8),
        I2OSP(lastSeenAt.getNano(), 4));
  }

  private static byte[] optionalInstant(Instant instant) {
    if (instant == null) {
      return new byte[]{0};
    }
    return concat(new byte[]{1}, I2OSP(instant.getEpochSecond(), 8), I2OSP(instant.getNano(), 4));
  }
}
