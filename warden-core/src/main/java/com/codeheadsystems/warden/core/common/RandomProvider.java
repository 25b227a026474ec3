package com.codeheadsystems.warden.core.common;

import com.codeheadsystems.warden.core.key.KeyGenerationFailedException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random generation.
 * Used for key pair generation and license serials.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Creates a RandomProvider backed by the platform's strong entropy source.
   * There is no fallback: an unavailable strong source aborts key generation.
   *
   * @return the random provider
   * @throws KeyGenerationFailedException if no strong source is configured
   */
  public static RandomProvider strong() {
    try {
      return new RandomProvider(SecureRandom.getInstanceStrong());
    } catch (NoSuchAlgorithmException e) {
      throw new KeyGenerationFailedException("No strong entropy source available", e);
    }
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Returns a uniformly distributed int in {@code [0, bound)}.
   *
   * @param bound the exclusive upper bound
   * @return the int
   */
  public int nextInt(int bound) {
    return random.nextInt(bound);
  }
}
