package com.codeheadsystems.warden.core.key;

import com.codeheadsystems.warden.core.common.RandomProvider;

/**
 * Configuration for the key manager.
 *
 * @param keySizeBits    RSA modulus size; at least 2048
 * @param retention      how many versions before the current one a key ring keeps
 * @param randomProvider entropy for key generation
 */
public record KeyManagerConfig(int keySizeBits, int retention, RandomProvider randomProvider) {

  /**
   * The constant DEFAULT_KEY_SIZE_BITS.
   */
  public static final int DEFAULT_KEY_SIZE_BITS = 2048;
  /**
   * The constant DEFAULT_RETENTION.
   */
  public static final int DEFAULT_RETENTION = 4;

  public KeyManagerConfig {
    if (keySizeBits < DEFAULT_KEY_SIZE_BITS) {
      throw new IllegalArgumentException("RSA keys must be at least 2048 bits: " + keySizeBits);
    }
    if (retention < 0) {
      throw new IllegalArgumentException("Retention cannot be negative: " + retention);
    }
    if (randomProvider == null) {
      throw new IllegalArgumentException("randomProvider is required");
    }
  }

  /**
   * Defaults: 2048-bit keys, four retained versions, the platform's strong entropy source.
   */
  public KeyManagerConfig() {
    this(DEFAULT_KEY_SIZE_BITS, DEFAULT_RETENTION, RandomProvider.strong());
  }

  /**
   * Instantiates a new Key manager config with the strong entropy source.
   *
   * @param keySizeBits the key size bits
   * @param retention   the retention
   */
  public KeyManagerConfig(int keySizeBits, int retention) {
    this(keySizeBits, retention, RandomProvider.strong());
  }
}
