package com.codeheadsystems.warden.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;

/**
 * Dropwizard configuration for the warden license server.
 * <p>
 * For production, set {@code keyDirectory} so signing keys survive restarts, and set both
 * {@code auditLogPath} and {@code auditKeyHex} so the audit trail is durable and verifiable.
 * Omitting them causes an ephemeral key and an in-memory audit log (dev/test only; every license
 * issued becomes unverifiable after a restart).
 * <p>
 * Generate an audit key with: {@code openssl rand -hex 32}
 */
public class WardenConfiguration extends Configuration {

  /**
   * Directory holding {@code v{N}-private.pem} / {@code v{N}-public.pem} files.
   * Leave empty for an ephemeral key generated at startup (dev only).
   */
  private String keyDirectory = "";

  /**
   * When the key directory holds no keys, generate and save version 1.
   */
  private boolean generateKeyIfMissing = true;

  /**
   * RSA modulus size for newly generated keys.
   */
  @Min(2048)
  private int keySizeBits = 2048;

  /**
   * How many versions before the current one stay in the published key ring.
   */
  @Min(0)
  private int keyRetention = 4;

  /**
   * JSON-lines audit log file. Leave empty for an in-memory log (dev only).
   */
  private String auditLogPath = "";

  /**
   * Hex-encoded HMAC key for the audit chain, at least 32 bytes.
   * Leave empty for random generation (dev only; the chain cannot be re-verified after a restart).
   */
  private String auditKeyHex = "";

  @JsonProperty
  public String getKeyDirectory() {
    return keyDirectory;
  }

  @JsonProperty
  public void setKeyDirectory(String keyDirectory) {
    this.keyDirectory = keyDirectory;
  }

  @JsonProperty
  public boolean isGenerateKeyIfMissing() {
    return generateKeyIfMissing;
  }

  @JsonProperty
  public void setGenerateKeyIfMissing(boolean generateKeyIfMissing) {
    this.generateKeyIfMissing = generateKeyIfMissing;
  }

  @JsonProperty
  public int getKeySizeBits() {
    return keySizeBits;
  }

  @JsonProperty
  public void setKeySizeBits(int keySizeBits) {
    this.keySizeBits = keySizeBits;
  }

  @JsonProperty
  public int getKeyRetention() {
    return keyRetention;
  }

  @JsonProperty
  public void setKeyRetention(int keyRetention) {
    this.keyRetention = keyRetention;
  }

  @JsonProperty
  public String getAuditLogPath() {
    return auditLogPath;
  }

  @JsonProperty
  public void setAuditLogPath(String auditLogPath) {
    this.auditLogPath = auditLogPath;
  }

  @JsonProperty
  public String getAuditKeyHex() {
    return auditKeyHex;
  }

  @JsonProperty
  public void setAuditKeyHex(String auditKeyHex) {
    this.auditKeyHex = auditKeyHex;
  }
}
