package com.codeheadsystems.warden.core.license;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A complete signed license. Timestamps are held at whole-second precision, which is what the
 * canonical payload signs.
 *
 * @param tier            the tier
 * @param serial          the serial
 * @param issuedAt        the issued at
 * @param expiresAt       the expiry, null when perpetual
 * @param hardwareBinding the bound fingerprint, null when floating
 * @param keyVersion      the signing key version
 * @param signature       the RSA signature over {@link CanonicalPayload#encode(LicenseRecord)}
 */
public record LicenseRecord(Tier tier, String serial, Instant issuedAt, Instant expiresAt,
                            String hardwareBinding, int keyVersion, byte[] signature) {

  public LicenseRecord {
    if (tier == null || serial == null || issuedAt == null) {
      throw new IllegalArgumentException("tier, serial and issuedAt are required");
    }
    issuedAt = issuedAt.truncatedTo(ChronoUnit.SECONDS);
    expiresAt = expiresAt == null ? null : expiresAt.truncatedTo(ChronoUnit.SECONDS);
    signature = signature == null ? new byte[0] : signature.clone();
  }

  /**
   * Rebuilds a record from the two distributed halves.
   *
   * @param key       the key
   * @param signature the signature
   * @return the license record
   */
  public static LicenseRecord of(LicenseKey key, LicenseSignature signature) {
    return new LicenseRecord(key.tier(), key.serial(), signature.issuedAt(), signature.expiresAt(),
        signature.hardwareBinding(), signature.keyVersion(), signature.signature());
  }

  public LicenseKey licenseKey() {
    return new LicenseKey(tier, serial);
  }

  public LicenseSignature licenseSignature() {
    return new LicenseSignature(issuedAt, expiresAt, hardwareBinding, keyVersion, signature);
  }

  /**
   * The bytes the signature covers.
   *
   * @return the byte [ ]
   */
  public byte[] canonicalPayload() {
    return CanonicalPayload.encode(this);
  }

  /**
   * Same fields with the given signature.
   *
   * @param newSignature the new signature
   * @return the license record
   */
  public LicenseRecord withSignature(byte[] newSignature) {
    return new LicenseRecord(tier, serial, issuedAt, expiresAt, hardwareBinding, keyVersion, newSignature);
  }

  public Optional<Instant> expiry() {
    return Optional.ofNullable(expiresAt);
  }

  public Optional<String> binding() {
    return Optional.ofNullable(hardwareBinding);
  }

  /**
   * A license is expired once the clock reaches its expiry.
   *
   * @param now the now
   * @return the boolean
   */
  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof LicenseRecord that
        && keyVersion == that.keyVersion
        && tier == that.tier
        && serial.equals(that.serial)
        && issuedAt.equals(that.issuedAt)
        && Objects.equals(expiresAt, that.expiresAt)
        && Objects.equals(hardwareBinding, that.hardwareBinding)
        && Arrays.equals(signature, that.signature);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(tier, serial, issuedAt, expiresAt, hardwareBinding, keyVersion)
        + Arrays.hashCode(signature);
  }

  @Override
  public String toString() {
    return "LicenseRecord[tier=" + tier + ", serial=" + serial + ", issuedAt=" + issuedAt
        + ", expiresAt=" + expiresAt + ", bound=" + (hardwareBinding != null)
        + ", keyVersion=" + keyVersion + "]";
  }
}
