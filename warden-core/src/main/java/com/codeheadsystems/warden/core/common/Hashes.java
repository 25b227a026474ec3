package com.codeheadsystems.warden.core.common;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.util.encoders.Hex;

/**
 * SHA-256 and HMAC-SHA256 helpers.
 */
public class Hashes {

  private static final String SHA_256 = "SHA-256";
  private static final String HMAC_SHA_256 = "HmacSHA256";

  private Hashes() {
  }

  /**
   * Sha 256 byte [ ].
   *
   * @param data the data
   * @return the byte [ ]
   */
  public static byte[] sha256(byte[] data) {
    try {
      return MessageDigest.getInstance(SHA_256).digest(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(SHA_256 + " not available", e);
    }
  }

  /**
   * Lowercase hex SHA-256 of a UTF-8 string.
   *
   * @param value the value
   * @return the string
   */
  public static String sha256Hex(String value) {
    return Hex.toHexString(sha256(value.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Hmac sha 256 byte [ ].
   *
   * @param key  the key
   * @param data the data
   * @return the byte [ ]
   */
  public static byte[] hmacSha256(byte[] key, byte[] data) {
    try {
      Mac mac = Mac.getInstance(HMAC_SHA_256);
      mac.init(new SecretKeySpec(key, HMAC_SHA_256));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(HMAC_SHA_256 + " not available", e);
    }
  }

  /**
   * Compares two byte arrays in time independent of where they differ.
   *
   * @param a the a
   * @param b the b
   * @return the boolean
   */
  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    return MessageDigest.isEqual(a, b);
  }
}
