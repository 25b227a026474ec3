package com.codeheadsystems.warden.core.audit;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Append-only storage for audit entries.
 * <p>
 * {@link #entries()} returns what is stored even when the log has been damaged: a field that
 * cannot be decoded comes back null, so chain verification can point at it.
 */
public interface AuditStore {

  /**
   * Persists an entry at the end of the log.
   *
   * @param entry the entry
   * @throws AuditStoreException if the entry could not be persisted
   */
  void append(AuditEntry entry);

  /**
   * The last entry appended, if any.
   *
   * @return the optional
   */
  Optional<AuditEntry> last();

  /**
   * All entries, in append order, as currently stored.
   *
   * @return the list
   */
  List<AuditEntry> entries();

  /**
   * Builds the next entry from the current tail and persists it, with no other append in
   * between.
   *
   * @param next builds the entry to append from the current last entry
   * @return the appended entry
   * @throws AuditStoreException if the entry could not be persisted
   */
  default AuditEntry appendNext(Function<Optional<AuditEntry>, AuditEntry> next) {
    synchronized (this) {
      AuditEntry entry = next.apply(last());
      append(entry);
      return entry;
    }
  }
}
