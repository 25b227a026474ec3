package com.codeheadsystems.warden.core.key;

import java.util.Arrays;
import java.util.Locale;

/**
 * Serialization formats a public key can be exported in. All of them describe the same RSA
 * modulus and exponent.
 */
public enum PublicKeyEncoding {

  /**
   * SubjectPublicKeyInfo DER inside {@code -----BEGIN PUBLIC KEY-----} armor.
   */
  PEM,

  /**
   * SubjectPublicKeyInfo DER as a single base64 line, for embedding in scripts and installers.
   */
  DER_BASE64,

  /**
   * {@code <RSAKeyValue>} document with base64 modulus and exponent, for legacy runtimes that
   * cannot parse key containers.
   */
  XML;

  /**
   * Case-insensitive lookup, accepting dashes for underscores.
   *
   * @param name the name
   * @return the public key encoding
   * @throws IllegalArgumentException if the name matches no encoding
   */
  public static PublicKeyEncoding fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Missing key encoding");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    return Arrays.stream(values())
        .filter(e -> e.name().equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown key encoding: " + name));
  }
}
