package com.codeheadsystems.warden.core.audit;

import static com.codeheadsystems.warden.core.common.ByteUtils.I2OSP;
import static com.codeheadsystems.warden.core.common.ByteUtils.concat;
import static com.codeheadsystems.warden.core.common.ByteUtils.lengthPrefixed;

import java.time.Instant;

/**
 * One link of the audit hash chain.
 *
 * @param index     position in the log, starting at 0
 * @param timestamp when the entry was appended
 * @param eventType the event type
 * @param subject   the subject
 * @param result    the result
 * @param prevHash  the previous entry's HMAC in hex, or {@link #GENESIS_HASH} for entry 0
 * @param entryHmac HMAC-SHA256(auditKey, prevHash || canonical fields) in hex
 */
public record AuditEntry(long index, Instant timestamp, AuditEventType eventType, String subject,
                         String result, String prevHash, String entryHmac) {

  /**
   * The prevHash of the first entry.
   */
  public static final String GENESIS_HASH = "0".repeat(64);

  /**
   * Placeholder for a stored entry that could not be decoded at all. It never verifies.
   *
   * @param position the entry's position in the log
   * @return the audit entry
   */
  public static AuditEntry unreadable(long position) {
    return new AuditEntry(position, null, null, null, null, null, null);
  }

  /**
   * Whether every field is present. Entries decoded from a damaged log may have gaps.
   *
   * @return true when no field is null
   */
  public boolean complete() {
    return timestamp != null && eventType != null && subject != null && result != null
        && prevHash != null && entryHmac != null;
  }

  /**
   * The fields covered by the HMAC, excluding the chain link itself. Only defined for
   * entries with every covered field present.
   *
   * @return the byte [ ]
   */
  public byte[] canonicalBytes() {
    return concat(
        I2OSP(index, 8),
        lengthPrefixed(timestamp.toString()),
        lengthPrefixed(eventType.name()),
        lengthPrefixed(subject),
        lengthPrefixed(result));
  }

  /**
   * Same entry with the given HMAC.
   *
   * @param hmac the hmac
   * @return the audit entry
   */
  public AuditEntry withEntryHmac(String hmac) {
    return new AuditEntry(index, timestamp, eventType, subject, result, prevHash, hmac);
  }
}
