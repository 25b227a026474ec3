package com.codeheadsystems.warden.core.common;

import java.nio.charset.StandardCharsets;

/**
 * Utility methods for octet string encoding.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017.
   * Converts a non-negative integer to a big-endian octet string of the specified length.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(long value, int length) {
    if (value < 0 || (length < 8 && value >= (1L << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Prefixes the bytes with their length as a two-byte big-endian integer.
   *
   * @param bytes the bytes
   * @return the byte [ ]
   */
  public static byte[] lengthPrefixed(byte[] bytes) {
    return concat(I2OSP(bytes.length, 2), bytes);
  }

  /**
   * Length-prefixed UTF-8 encoding of a string.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] lengthPrefixed(String value) {
    return lengthPrefixed(value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }
}
