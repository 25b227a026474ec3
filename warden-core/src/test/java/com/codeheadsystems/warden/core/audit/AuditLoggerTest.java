package com.codeheadsystems.warden.core.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuditLoggerTest {

  private static final byte[] KEY = new byte[32];
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-01T12:00:00Z"), ZoneOffset.UTC);

  static {
    Arrays.fill(KEY, (byte) 7);
  }

  @Mock private AuditStore failingStore;

  private ListAuditStore store;
  private AuditLogger auditLogger;

  @BeforeEach
  void setUp() {
    store = new ListAuditStore();
    auditLogger = new AuditLogger(KEY, store, CLOCK);
  }

  @Test
  void append_firstEntryChainsFromGenesis() {
    String hash = auditLogger.append(new AuditEvent(AuditEventType.ISSUED, "ABCDE12345F", "tier=BASIC"));

    AuditEntry entry = store.entries.get(0);
    assertThat(entry.index()).isZero();
    assertThat(entry.prevHash()).isEqualTo(AuditEntry.GENESIS_HASH).hasSize(64);
    assertThat(entry.entryHmac()).isEqualTo(hash).hasSize(64);
    assertThat(entry.timestamp()).isEqualTo(CLOCK.instant());
  }

  @Test
  void append_laterEntriesChainFromPrevious() {
    String first = auditLogger.append(new AuditEvent(AuditEventType.ISSUED, "A", "ok"));
    auditLogger.append(new AuditEvent(AuditEventType.VERIFIED, "A", "VALID"));

    assertThat(store.entries.get(1).index()).isEqualTo(1);
    assertThat(store.entries.get(1).prevHash()).isEqualTo(first);
  }

  @Test
  void append_nullSubjectBecomesUnknown() {
    auditLogger.append(new AuditEvent(AuditEventType.REJECTED, null, "MALFORMED_KEY"));

    assertThat(store.entries.get(0).subject()).isEqualTo(AuditEvent.UNKNOWN_SUBJECT);
  }

  @Test
  void verifyChain_emptyLogIsValid() {
    assertThat(auditLogger.verifyChain()).isEqualTo(ChainVerification.ok(0));
  }

  @Test
  void verifyChain_untouchedLogIsValid() {
    appendFive();

    assertThat(auditLogger.verifyChain()).isEqualTo(ChainVerification.ok(5));
  }

  @Test
  void verifyChain_mutatedResult_reportsThatIndex() {
    appendFive();
    AuditEntry e = store.entries.get(2);
    store.entries.set(2, new AuditEntry(e.index(), e.timestamp(), e.eventType(), e.subject(), "VALID",
        e.prevHash(), e.entryHmac()));

    ChainVerification result = auditLogger.verifyChain();

    assertThat(result.valid()).isFalse();
    assertThat(result.firstInvalidIndex()).isEqualTo(2);
  }

  @Test
  void verifyChain_mutatedTimestamp_reportsThatIndex() {
    appendFive();
    AuditEntry e = store.entries.get(4);
    store.entries.set(4, new AuditEntry(e.index(), e.timestamp().plusSeconds(1), e.eventType(), e.subject(),
        e.result(), e.prevHash(), e.entryHmac()));

    assertThat(auditLogger.verifyChain().firstInvalidIndex()).isEqualTo(4);
  }

  @Test
  void verifyChain_missingField_reportsThatIndex() {
    appendFive();
    AuditEntry e = store.entries.get(2);
    store.entries.set(2, new AuditEntry(e.index(), e.timestamp(), e.eventType(), null, e.result(),
        e.prevHash(), e.entryHmac()));

    assertThat(auditLogger.verifyChain()).isEqualTo(ChainVerification.brokenAt(2, 3));
  }

  @Test
  void verifyChain_undecodableEntry_reportsThatIndex() {
    appendFive();
    store.entries.set(3, AuditEntry.unreadable(3));

    assertThat(auditLogger.verifyChain()).isEqualTo(ChainVerification.brokenAt(3, 4));
  }

  @Test
  void append_afterDamagedTail_stillAppends() {
    appendFive();
    store.entries.set(4, store.entries.get(4).withEntryHmac("not hex"));

    auditLogger.append(new AuditEvent(AuditEventType.VERIFIED, "S1", "VALID"));

    assertThat(store.entries).hasSize(6);
    assertThat(store.entries.get(5).index()).isEqualTo(5);
    assertThat(auditLogger.verifyChain().firstInvalidIndex()).isEqualTo(4);
  }

  @Test
  void verifyChain_forgedHmac_reportsThatIndex() {
    appendFive();
    AuditEntry e = store.entries.get(1);
    store.entries.set(1, e.withEntryHmac("f".repeat(64)));

    assertThat(auditLogger.verifyChain().firstInvalidIndex()).isEqualTo(1);
  }

  @Test
  void verifyChain_deletedEntry_reportsGap() {
    appendFive();
    store.entries.remove(3);

    assertThat(auditLogger.verifyChain().firstInvalidIndex()).isEqualTo(3);
  }

  @Test
  void verifyChain_swappedEntries_detected() {
    appendFive();
    AuditEntry second = store.entries.get(1);
    store.entries.set(1, store.entries.get(2));
    store.entries.set(2, second);

    assertThat(auditLogger.verifyChain().firstInvalidIndex()).isEqualTo(1);
  }

  @Test
  void verifyChain_differentKey_failsAtZero() {
    appendFive();
    byte[] otherKey = new byte[32];

    assertThat(new AuditLogger(otherKey, store, CLOCK).verifyChain().firstInvalidIndex()).isZero();
  }

  @Test
  void append_storeFailure_propagates() {
    doThrow(new AuditStoreException("disk full")).when(failingStore).appendNext(any());
    AuditLogger logger = new AuditLogger(KEY, failingStore, CLOCK);

    assertThatThrownBy(() -> logger.append(new AuditEvent(AuditEventType.ISSUED, "A", "ok")))
        .isInstanceOf(AuditStoreException.class);
  }

  @Test
  void constructor_shortKey_throws() {
    assertThatThrownBy(() -> new AuditLogger(new byte[16], store, CLOCK))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private void appendFive() {
    auditLogger.append(new AuditEvent(AuditEventType.ISSUED, "S1", "tier=BASIC"));
    auditLogger.append(new AuditEvent(AuditEventType.VERIFIED, "S1", "VALID"));
    auditLogger.append(new AuditEvent(AuditEventType.REJECTED, "S1", "EXPIRED"));
    auditLogger.append(new AuditEvent(AuditEventType.REVOKED, "S1", "revoked"));
    auditLogger.append(new AuditEvent(AuditEventType.REJECTED, "S1", "REVOKED"));
  }

  /**
   * Mutable store so tests can play the attacker.
   */
  private static class ListAuditStore implements AuditStore {

    private final List<AuditEntry> entries = new ArrayList<>();

    @Override
    public void append(AuditEntry entry) {
      entries.add(entry);
    }

    @Override
    public Optional<AuditEntry> last() {
      return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    @Override
    public List<AuditEntry> entries() {
      return List.copyOf(entries);
    }
  }
}
