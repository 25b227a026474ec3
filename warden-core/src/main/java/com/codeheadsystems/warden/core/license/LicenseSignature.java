package com.codeheadsystems.warden.core.license;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * The part of a license shipped beside the key string: everything the verifier needs to rebuild
 * the signed payload that the key string does not carry.
 *
 * @param issuedAt        the issued at
 * @param expiresAt       the expiry, null when perpetual
 * @param hardwareBinding the bound fingerprint, null when floating
 * @param keyVersion      the signing key version
 * @param signature       the RSA signature
 */
public record LicenseSignature(Instant issuedAt, Instant expiresAt, String hardwareBinding,
                               int keyVersion, byte[] signature) {

  public LicenseSignature {
    if (issuedAt == null) {
      throw new IllegalArgumentException("issuedAt is required");
    }
    issuedAt = issuedAt.truncatedTo(ChronoUnit.SECONDS);
    expiresAt = expiresAt == null ? null : expiresAt.truncatedTo(ChronoUnit.SECONDS);
    signature = signature == null ? new byte[0] : signature.clone();
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof LicenseSignature that
        && keyVersion == that.keyVersion
        && issuedAt.equals(that.issuedAt)
        && Objects.equals(expiresAt, that.expiresAt)
        && Objects.equals(hardwareBinding, that.hardwareBinding)
        && Arrays.equals(signature, that.signature);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(issuedAt, expiresAt, hardwareBinding, keyVersion) + Arrays.hashCode(signature);
  }

  @Override
  public String toString() {
    return "LicenseSignature[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt
        + ", bound=" + (hardwareBinding != null) + ", keyVersion=" + keyVersion
        + ", signature=" + Base64.getEncoder().encodeToString(signature) + "]";
  }
}
