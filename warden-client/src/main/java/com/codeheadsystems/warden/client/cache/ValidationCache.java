package com.codeheadsystems.warden.client.cache;

import com.codeheadsystems.warden.client.exceptions.ValidationCacheException;
import com.codeheadsystems.warden.core.common.Hashes;
import com.codeheadsystems.warden.core.fingerprint.FingerprintHash;
import com.codeheadsystems.warden.core.license.LicenseRecord;
import com.codeheadsystems.warden.core.license.Tier;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The local validation cache: a JSON document of {@link ValidationCacheEntry} keyed by serial.
 * <p>
 * Each entry carries an HMAC keyed from this machine's fingerprint, so a cache copied from
 * another machine does not verify and its entries are treated as absent. The key is derived
 * from the fingerprint alone, and a bound license stores that fingerprint in the file, so the
 * HMAC does not stop someone on this machine from rewriting the file. Signatures and expiry
 * never depend on the cache; a rewritten entry can at most restore the grace period or clear a
 * revoked flag until the next online check.
 * Read-modify-write cycles hold an in-process lock and an OS lock on a sibling {@code .lock}
 * file. New contents are written to a temporary file and moved into place.
 */
public class ValidationCache {

  private static final Logger log = LoggerFactory.getLogger(ValidationCache.class);

  static final String HMAC_CONTEXT = "warden-cache-v1";
  static final int FORMAT_VERSION = 1;

  // The OS lock is held per JVM, so threads in this JVM must queue on a shared lock first.
  private static final ConcurrentMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

  private final Path path;
  private final Path lockPath;
  private final ObjectMapper objectMapper;
  private final byte[] hmacKey;
  private final ReentrantLock lock;

  /**
   * Instantiates a new Validation cache.
   *
   * @param path             the cache file
   * @param localFingerprint this machine's fingerprint
   */
  public ValidationCache(Path path, FingerprintHash localFingerprint) {
    this(path, localFingerprint, new ObjectMapper());
  }

  /**
   * Instantiates a new Validation cache.
   *
   * @param path             the cache file
   * @param localFingerprint this machine's fingerprint
   * @param objectMapper     the object mapper
   */
  public ValidationCache(Path path, FingerprintHash localFingerprint, ObjectMapper objectMapper) {
    log.info("ValidationCache({})", path);
    this.path = path.toAbsolutePath();
    this.lockPath = this.path.resolveSibling(this.path.getFileName() + ".lock");
    this.lock = PROCESS_LOCKS.computeIfAbsent(this.path, p -> new ReentrantLock());
    this.objectMapper = objectMapper;
    this.hmacKey = hmacKey(localFingerprint);
    try {
      Files.createDirectories(this.path.getParent());
    } catch (IOException e) {
      throw new ValidationCacheException("Unable to create cache directory for " + path, e);
    }
  }

  static byte[] hmacKey(FingerprintHash fingerprint) {
    return Hashes.sha256((HMAC_CONTEXT + fingerprint.value()).getBytes(StandardCharsets.UTF_8));
  }

  /**
   * The trusted entry for a serial.
   *
   * @param serial the serial
   * @return the entry, empty when missing or when its HMAC does not verify
   */
  public Optional<ValidationCacheEntry> find(String serial) {
    return withLock(() -> Optional.ofNullable(readTrusted().get(serial)));
  }

  /**
   * Records a successful verification. The entry is created if needed; the last online time is
   * moved forward when {@code confirmedOnlineAt} is given and is otherwise kept.
   *
   * @param record            the verified record
   * @param seenAt            the local time of the verification
   * @param confirmedOnlineAt when the server confirmed the license during this verification, may be null
   * @return the stored entry
   */
  public ValidationCacheEntry recordVerification(LicenseRecord record, Instant seenAt, Instant confirmedOnlineAt) {
    return update(record.serial(), existing -> {
      Instant lastOnline = confirmedOnlineAt;
      if (lastOnline == null && existing != null) {
        lastOnline = existing.lastOnlineAt();
      }
      return ValidationCacheEntry.of(record, lastOnline, seenAt);
    });
  }

  /**
   * Records a server answer for a serial that already has an entry.
   *
   * @param serial   the serial
   * @param onlineAt the local time of the answer
   * @param revoked  the server's flag
   * @return the stored entry, empty when the serial has no trusted entry yet
   */
  public Optional<ValidationCacheEntry> recordReconciliation(String serial, Instant onlineAt, boolean revoked) {
    return Optional.ofNullable(update(serial,
        existing -> existing == null ? null : existing.reconciled(onlineAt, revoked)));
  }

  /**
   * Records a server revocation for a verified record, creating the entry if needed, so the
   * license stays revoked when later checks are offline.
   *
   * @param record    the record whose signature has been verified
   * @param revokedAt the local time of the server's answer
   * @return the stored entry
   */
  public ValidationCacheEntry recordRevocation(LicenseRecord record, Instant revokedAt) {
    return update(record.serial(), existing -> (existing == null
        ? ValidationCacheEntry.of(record, revokedAt, revokedAt)
        : existing).reconciled(revokedAt, true));
  }

  private ValidationCacheEntry update(String serial, UnaryOperator<ValidationCacheEntry> change) {
    return withLock(() -> {
      Map<String, ValidationCacheEntry> entries = readTrusted();
      ValidationCacheEntry changed = change.apply(entries.get(serial));
      if (changed == null) {
        return null;
      }
      ValidationCacheEntry signed = changed.withHmac(hmac(changed));
      entries.put(serial, signed);
      write(entries);
      log.debug("update({}): revoked={} lastOnlineAt={}", serial, signed.revoked(), signed.lastOnlineAt());
      return signed;
    });
  }

  public Path path() {
    return path;
  }

  private String hmac(ValidationCacheEntry entry) {
    return Hex.toHexString(Hashes.hmacSha256(hmacKey, entry.canonicalBytes()));
  }

  private boolean trusted(ValidationCacheEntry entry) {
    if (entry.hmac() == null) {
      return false;
    }
    try {
      return Hashes.constantTimeEquals(Hex.decode(entry.hmac()), Hashes.hmacSha256(hmacKey, entry.canonicalBytes()));
    } catch (DecoderException e) {
      log.debug("trusted({}): hmac is not hex", entry.serial(), e);
      return false;
    }
  }

  private Map<String, ValidationCacheEntry> readTrusted() {
    Map<String, ValidationCacheEntry> trusted = new TreeMap<>();
    if (!Files.exists(path)) {
      return trusted;
    }
    CacheFile file;
    try {
      file = objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8), CacheFile.class);
    } catch (JsonProcessingException e) {
      log.warn("Validation cache {} is unreadable; ignoring its contents", path);
      return trusted;
    } catch (IOException e) {
      throw new ValidationCacheException("Unable to read validation cache " + path, e);
    }
    if (file.entries() == null) {
      return trusted;
    }
    for (Map.Entry<String, StoredEntry> stored : file.entries().entrySet()) {
      Optional<ValidationCacheEntry> entry = stored.getValue() == null ? Optional.empty() : stored.getValue().toEntry();
      if (entry.isPresent() && entry.get().serial().equals(stored.getKey()) && trusted(entry.get())) {
        trusted.put(stored.getKey(), entry.get());
      } else {
        log.warn("Validation cache entry for {} failed verification; treating it as absent", stored.getKey());
      }
    }
    return trusted;
  }

  private void write(Map<String, ValidationCacheEntry> entries) {
    Map<String, StoredEntry> stored = new TreeMap<>();
    entries.forEach((serial, entry) -> stored.put(serial, StoredEntry.of(entry)));
    Path temp = null;
    try {
      temp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
      Files.writeString(temp, objectMapper.writeValueAsString(new CacheFile(FORMAT_VERSION, stored)),
          StandardCharsets.UTF_8);
      try {
        Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("write(): atomic move not supported, replacing {}", path);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(temp, e);
      throw new ValidationCacheException("Unable to write validation cache " + path, e);
    }
  }

  private void deleteQuietly(Path temp, IOException cause) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }

  private <T> T withLock(LockedAction<T> action) {
    lock.lock();
    try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
         FileLock ignored = channel.lock()) {
      return action.run();
    } catch (IOException e) {
      throw new ValidationCacheException("Unable to lock validation cache " + lockPath, e);
    } finally {
      lock.unlock();
    }
  }

  @FunctionalInterface
  private interface LockedAction<T> {
    T run();
  }

  /**
   * On-disk document.
   */
  record CacheFile(@JsonProperty("formatVersion") int formatVersion,
                   @JsonProperty("entries") Map<String, StoredEntry> entries) {
  }

  /**
   * On-disk shape of an entry; instants are kept as ISO-8601 text.
   */
  record StoredEntry(@JsonProperty("serial") String serial,
                     @JsonProperty("tier") String tier,
                     @JsonProperty("issuedAt") String issuedAt,
                     @JsonProperty("expiresAt") String expiresAt,
                     @JsonProperty("hardwareBinding") String hardwareBinding,
                     @JsonProperty("keyVersion") int keyVersion,
                     @JsonProperty("lastOnlineAt") String lastOnlineAt,
                     @JsonProperty("revoked") boolean revoked,
                     @JsonProperty("lastSeenAt") String lastSeenAt,
                     @JsonProperty("hmac") String hmac) {

    static StoredEntry of(ValidationCacheEntry entry) {
      return new StoredEntry(entry.serial(), entry.tier().prefix(), entry.issuedAt().toString(),
          text(entry.expiresAt()), entry.hardwareBinding(), entry.keyVersion(), text(entry.lastOnlineAt()),
          entry.revoked(), entry.lastSeenAt().toString(), entry.hmac());
    }

    Optional<ValidationCacheEntry> toEntry() {
      try {
        Optional<Tier> parsedTier = tier == null ? Optional.empty() : Tier.fromPrefix(tier);
        return parsedTier.map(t -> new ValidationCacheEntry(serial, t, Instant.parse(issuedAt),
            instant(expiresAt), hardwareBinding, keyVersion, instant(lastOnlineAt), revoked,
            Instant.parse(lastSeenAt), hmac));
      } catch (RuntimeException e) {
        log.debug("toEntry({}): malformed entry", serial, e);
        return Optional.empty();
      }
    }

    private static String text(Instant instant) {
      return instant == null ? null : instant.toString();
    }

    private static Instant instant(String text) {
      return text == null ? null : Instant.parse(text);
    }
  }
}
