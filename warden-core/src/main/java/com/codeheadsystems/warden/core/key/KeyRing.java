package com.codeheadsystems.warden.core.key;

import java.security.interfaces.RSAPublicKey;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An immutable set of public verification keys indexed by key version, with one marked current.
 * A key ring never contains private material, so it can be embedded in any client artifact.
 */
public final class KeyRing {

  private final int currentVersion;
  private final SortedMap<Integer, RSAPublicKey> keys;

  private KeyRing(int currentVersion, SortedMap<Integer, RSAPublicKey> keys) {
    if (!keys.containsKey(currentVersion)) {
      throw new IllegalArgumentException("Current version " + currentVersion + " is not in the ring");
    }
    this.currentVersion = currentVersion;
    this.keys = Collections.unmodifiableSortedMap(new TreeMap<>(keys));
  }

  /**
   * Builds a ring from the given keys. The highest version becomes current.
   *
   * @param keys version to public key
   * @return the key ring
   */
  public static KeyRing of(Map<Integer, RSAPublicKey> keys) {
    if (keys.isEmpty()) {
      throw new IllegalArgumentException("A key ring needs at least one key");
    }
    TreeMap<Integer, RSAPublicKey> sorted = new TreeMap<>(keys);
    return new KeyRing(sorted.lastKey(), sorted);
  }

  /**
   * Builds a single-key ring.
   *
   * @param keyVersion the key version
   * @param publicKey  the public key
   * @return the key ring
   */
  public static KeyRing of(int keyVersion, RSAPublicKey publicKey) {
    return of(Map.of(keyVersion, publicKey));
  }

  /**
   * Builder for a key ring loaded from exported public keys.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public int currentVersion() {
    return currentVersion;
  }

  public Optional<RSAPublicKey> publicKey(int keyVersion) {
    return Optional.ofNullable(keys.get(keyVersion));
  }

  public boolean contains(int keyVersion) {
    return keys.containsKey(keyVersion);
  }

  /**
   * The retained versions, ascending.
   *
   * @return the versions
   */
  public Set<Integer> versions() {
    return keys.keySet();
  }

  /**
   * Verifies a signature with the key for the given version. A version that is not in the ring
   * never verifies.
   *
   * @param keyVersion the key version
   * @param data       the signed data
   * @param signature  the signature
   * @return true if the signature is valid under that version
   */
  public boolean verify(int keyVersion, byte[] data, byte[] signature) {
    RSAPublicKey key = keys.get(keyVersion);
    return key != null && RsaSignatures.verify(key, data, signature);
  }

  @Override
  public String toString() {
    return "KeyRing[current=" + currentVersion + ", versions=" + keys.keySet() + "]";
  }

  /**
   * Accumulates keys from any supported encoding.
   */
  public static final class Builder {

    private final TreeMap<Integer, RSAPublicKey> keys = new TreeMap<>();

    private Builder() {
    }

    public Builder add(int keyVersion, RSAPublicKey publicKey) {
      if (keyVersion < 1) {
        throw new IllegalArgumentException("Key version must be positive: " + keyVersion);
      }
      keys.put(keyVersion, publicKey);
      return this;
    }

    public Builder add(int keyVersion, byte[] encoded, PublicKeyEncoding encoding) {
      return add(keyVersion, PublicKeyCodec.decode(encoded, encoding));
    }

    public KeyRing build() {
      return KeyRing.of(keys);
    }
  }
}
