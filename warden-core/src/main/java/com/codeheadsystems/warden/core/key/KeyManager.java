package com.codeheadsystems.warden.core.key;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAKeyGenParameterSpec;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the issuing authority's versioned RSA signing keys.
 * <p>
 * Issuance always signs with {@link #current()}. Rotation generates the next version and swaps
 * the current pointer atomically, so a signer that already read the old key finishes with it and
 * the result still verifies against any {@link KeyRing} that retains that version.
 */
@Singleton
public class KeyManager {

  private static final Logger log = LoggerFactory.getLogger(KeyManager.class);
  private static final byte[] SELF_TEST_MESSAGE =
      "warden-key-self-test".getBytes(StandardCharsets.US_ASCII);

  private final KeyManagerConfig config;
  private final ConcurrentSkipListMap<Integer, SigningKeyPair> keyPairs = new ConcurrentSkipListMap<>();
  private final AtomicReference<SigningKeyPair> current = new AtomicReference<>();
  private final ReentrantLock rotationLock = new ReentrantLock();

  /**
   * Instantiates a new Key manager with no keys. Call {@link #rotate()} before issuing.
   *
   * @param config the config
   */
  @Inject
  public KeyManager(KeyManagerConfig config) {
    this.config = config;
    log.info("KeyManager({} bits, retention={})", config.keySizeBits(), config.retention());
  }

  /**
   * Instantiates a new Key manager seeded with previously persisted key pairs. The highest
   * version becomes current.
   *
   * @param config   the config
   * @param existing the existing key pairs
   */
  public KeyManager(KeyManagerConfig config, Collection<SigningKeyPair> existing) {
    this(config);
    for (SigningKeyPair pair : existing) {
      keyPairs.put(pair.keyVersion(), pair);
    }
    if (!keyPairs.isEmpty()) {
      current.set(keyPairs.lastEntry().getValue());
      log.info("Loaded {} key versions, current={}", keyPairs.size(), keyPairs.lastKey());
    }
  }

  /**
   * Generates the next key version and registers it without making it current, unless no key is
   * current yet.
   *
   * @return the signing key pair
   * @throws KeyGenerationFailedException if the entropy source or key generator fails
   */
  public SigningKeyPair generateKeypair() {
    rotationLock.lock();
    try {
      int version = keyPairs.isEmpty() ? 1 : keyPairs.lastKey() + 1;
      SigningKeyPair pair = new SigningKeyPair(version, newRsaKeyPair());
      keyPairs.put(version, pair);
      current.compareAndSet(null, pair);
      log.debug("generateKeypair(): version={}", version);
      return pair;
    } finally {
      rotationLock.unlock();
    }
  }

  /**
   * Generates the next key version and publishes it as current.
   *
   * @return the new version
   */
  public int rotate() {
    rotationLock.lock();
    try {
      SigningKeyPair pair = generateKeypair();
      SigningKeyPair previous = current.getAndSet(pair);
      log.info("Rotated signing key {} -> {}",
          previous == null ? "none" : previous.keyVersion(), pair.keyVersion());
      return pair.keyVersion();
    } finally {
      rotationLock.unlock();
    }
  }

  /**
   * The key pair issuance signs with.
   *
   * @return the signing key pair
   * @throws IllegalStateException if no key has been generated or loaded
   */
  public SigningKeyPair current() {
    SigningKeyPair pair = current.get();
    if (pair == null) {
      throw new IllegalStateException("No signing key; generate or load one first");
    }
    return pair;
  }

  public Optional<SigningKeyPair> keyPair(int keyVersion) {
    return Optional.ofNullable(keyPairs.get(keyVersion));
  }

  /**
   * All key pairs held by this manager, ascending by version.
   *
   * @return the list
   */
  public List<SigningKeyPair> keyPairs() {
    return new ArrayList<>(keyPairs.values());
  }

  /**
   * Exports a version's public key.
   *
   * @param keyVersion the key version
   * @param encoding   the encoding
   * @return the encoded key
   * @throws UnknownKeyVersionException if the version was never generated
   */
  public byte[] exportPublic(int keyVersion, PublicKeyEncoding encoding) {
    SigningKeyPair pair = keyPairs.get(keyVersion);
    if (pair == null) {
      throw new UnknownKeyVersionException(keyVersion);
    }
    return PublicKeyCodec.encode(pair.publicKey(), encoding);
  }

  /**
   * Snapshot of the current public key plus up to {@code retention} earlier versions.
   *
   * @return the key ring
   */
  public KeyRing keyRing() {
    SigningKeyPair head = current();
    NavigableMap<Integer, SigningKeyPair> older = keyPairs.headMap(head.keyVersion(), false).descendingMap();
    Map<Integer, RSAPublicKey> ring = new TreeMap<>();
    ring.put(head.keyVersion(), head.publicKey());
    for (SigningKeyPair pair : older.values()) {
      if (ring.size() > config.retention()) {
        break;
      }
      ring.put(pair.keyVersion(), pair.publicKey());
    }
    return KeyRing.of(ring);
  }

  /**
   * Signs a fixed message with the version's private key and verifies it with the public key decoded
   * back from every export encoding.
   *
   * @param keyVersion the key version
   * @throws IllegalStateException      if any encoding fails to round-trip or verify
   * @throws UnknownKeyVersionException if the version is unknown
   */
  public void selfTest(int keyVersion) {
    SigningKeyPair pair = keyPairs.get(keyVersion);
    if (pair == null) {
      throw new UnknownKeyVersionException(keyVersion);
    }
    byte[] signature = pair.sign(SELF_TEST_MESSAGE);
    for (PublicKeyEncoding encoding : PublicKeyEncoding.values()) {
      RSAPublicKey decoded = PublicKeyCodec.decode(exportPublic(keyVersion, encoding), encoding);
      if (!decoded.getModulus().equals(pair.publicKey().getModulus())
          || !decoded.getPublicExponent().equals(pair.publicKey().getPublicExponent())) {
        throw new IllegalStateException("Public key " + encoding + " export of version "
            + keyVersion + " does not round-trip");
      }
      if (!RsaSignatures.verify(decoded, SELF_TEST_MESSAGE, signature)) {
        throw new IllegalStateException("Public key " + encoding + " export of version "
            + keyVersion + " does not verify its own signature");
      }
    }
    log.debug("selfTest({}): ok", keyVersion);
  }

  private KeyPair newRsaKeyPair() {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(new RSAKeyGenParameterSpec(config.keySizeBits(), RSAKeyGenParameterSpec.F4),
          config.randomProvider().random());
      return generator.generateKeyPair();
    } catch (GeneralSecurityException | RuntimeException e) {
      throw new KeyGenerationFailedException("RSA key generation failed", e);
    }
  }
}
