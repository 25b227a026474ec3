package com.codeheadsystems.warden.core.key;

/**
 * Thrown when a key version is requested that was never generated or has aged out of retention.
 */
public class UnknownKeyVersionException extends IllegalArgumentException {

  private final int keyVersion;

  /**
   * Instantiates a new Unknown key version exception.
   *
   * @param keyVersion the key version
   */
  public UnknownKeyVersionException(final int keyVersion) {
    super("Unknown key version: " + keyVersion);
    this.keyVersion = keyVersion;
  }

  /**
   * The requested version.
   *
   * @return the key version
   */
  public int keyVersion() {
    return keyVersion;
  }
}
