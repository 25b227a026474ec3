package com.codeheadsystems.warden.model;

import com.codeheadsystems.warden.core.license.LicenseRecord;
import com.codeheadsystems.warden.core.license.LicenseSignature;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Wire model for the license file shipped beside the key string.
 * <p>
 * The key string alone carries the tier and serial. This file carries the remaining signed
 * fields and the signature, so the verifier can rebuild the canonical payload without any
 * network access. The key string is repeated here for convenience; verification always uses the
 * key string the user entered.
 * <p>
 * Instants are ISO-8601, the signature is base64.
 *
 * @param licenseKey      the key string, {@code TIER-XXXXX-XXXXX-XXXXX}
 * @param issuedAt        ISO-8601 issue time
 * @param expiresAt       ISO-8601 expiry, null when perpetual
 * @param hardwareBinding bound machine fingerprint, null when floating
 * @param keyVersion      signing key version
 * @param signatureBase64 base64-encoded RSA signature
 */
public record LicenseFile(
    @JsonProperty("licenseKey") String licenseKey,
    @JsonProperty("issuedAt") String issuedAt,
    @JsonProperty("expiresAt") String expiresAt,
    @JsonProperty("hardwareBinding") String hardwareBinding,
    @JsonProperty("keyVersion") int keyVersion,
    @JsonProperty("signature") String signatureBase64) {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  public LicenseFile(String licenseKey, LicenseSignature signature) {
    this(licenseKey,
        signature.issuedAt().toString(),
        signature.expiresAt() == null ? null : signature.expiresAt().toString(),
        signature.hardwareBinding(),
        signature.keyVersion(),
        B64.encodeToString(signature.signature()));
  }

  public LicenseFile(LicenseRecord record) {
    this(record.licenseKey().toKeyString(), record.licenseSignature());
  }

  /**
   * Converts to the core type.
   *
   * @return the license signature
   * @throws IllegalArgumentException if a field is missing or unparseable
   */
  public LicenseSignature licenseSignature() {
    return new LicenseSignature(
        instant(issuedAt, "issuedAt", true),
        instant(expiresAt, "expiresAt", false),
        hardwareBinding == null || hardwareBinding.isBlank() ? null : hardwareBinding,
        keyVersion,
        decode(signatureBase64, "signature"));
  }

  private static Instant instant(String value, String fieldName, boolean required) {
    if (value == null || value.isBlank()) {
      if (required) {
        throw new IllegalArgumentException("Missing required field: " + fieldName);
      }
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 instant in field: " + fieldName, e);
    }
  }

  private static byte[] decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }
}
