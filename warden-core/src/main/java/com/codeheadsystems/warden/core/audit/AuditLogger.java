package com.codeheadsystems.warden.core.audit;

import com.codeheadsystems.warden.core.common.ByteUtils;
import com.codeheadsystems.warden.core.common.Hashes;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.inject.Singleton;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tamper-evident audit log. Each entry's HMAC covers the previous entry's HMAC, so altering,
 * removing or reordering any entry breaks verification from that point on.
 */
@Singleton
public class AuditLogger {

  private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
  private static final int MIN_KEY_BYTES = 32;
  private static final Pattern HASH = Pattern.compile("^[0-9a-f]{64}$");

  private final byte[] auditKey;
  private final AuditStore store;
  private final Clock clock;

  /**
   * Instantiates a new Audit logger.
   *
   * @param auditKey the HMAC key, at least 32 bytes
   * @param store    the store
   * @param clock    the clock
   */
  public AuditLogger(byte[] auditKey, AuditStore store, Clock clock) {
    if (auditKey == null || auditKey.length < MIN_KEY_BYTES) {
      throw new IllegalArgumentException("Audit key must be at least " + MIN_KEY_BYTES + " bytes");
    }
    this.auditKey = auditKey.clone();
    this.store = store;
    this.clock = clock;
    log.info("AuditLogger({})", store.getClass().getSimpleName());
  }

  /**
   * Appends an event, chaining it to the last entry.
   *
   * @param event the event
   * @return the new entry's HMAC in hex
   * @throws AuditStoreException if the store cannot persist it
   */
  public synchronized String append(AuditEvent event) {
    AuditEntry entry = store.appendNext(previous -> link(previous, event));
    log.debug("append({}, {}): index={}", event.type(), event.subject(), entry.index());
    return entry.entryHmac();
  }

  private AuditEntry link(Optional<AuditEntry> previous, AuditEvent event) {
    long index = previous.map(e -> e.index() + 1).orElse(0L);
    String prevHash = previous.map(AuditEntry::entryHmac).orElse(AuditEntry.GENESIS_HASH);
    if (!HASH.matcher(prevHash).matches()) {
      // The chain is already broken at the tail; verifyChain reports the damaged entry.
      log.warn("Audit log tail at index {} is damaged; chaining from genesis", index - 1);
      prevHash = AuditEntry.GENESIS_HASH;
    }
    AuditEntry unsigned = new AuditEntry(index, clock.instant(), event.type(), event.subject(),
        event.result(), prevHash, null);
    return unsigned.withEntryHmac(hmac(unsigned));
  }

  /**
   * Recomputes the chain from entry 0.
   *
   * @return the chain verification
   */
  public ChainVerification verifyChain() {
    List<AuditEntry> entries = store.entries();
    String expectedPrev = AuditEntry.GENESIS_HASH;
    for (int i = 0; i < entries.size(); i++) {
      AuditEntry entry = entries.get(i);
      if (!entry.complete()
          || entry.index() != i
          || !expectedPrev.equals(entry.prevHash())
          || !hmacMatches(entry)) {
        log.warn("Audit chain broken at index {}", i);
        return ChainVerification.brokenAt(i, i + 1);
      }
      expectedPrev = entry.entryHmac();
    }
    return ChainVerification.ok(entries.size());
  }

  private boolean hmacMatches(AuditEntry entry) {
    if (entry.entryHmac() == null) {
      return false;
    }
    try {
      return Hashes.constantTimeEquals(Hex.decode(entry.entryHmac()), Hex.decode(hmac(entry)));
    } catch (DecoderException e) {
      log.debug("Entry {} has a non-hex HMAC", entry.index(), e);
      return false;
    }
  }

  private String hmac(AuditEntry entry) {
    byte[] prev = Hex.decode(entry.prevHash());
    return Hex.toHexString(Hashes.hmacSha256(auditKey, ByteUtils.concat(prev, entry.canonicalBytes())));
  }
}
