package com.codeheadsystems.warden.core.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory audit store. Entries are lost on restart.
 */
public class InMemoryAuditStore implements AuditStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAuditStore.class);

  private final List<AuditEntry> entries = new ArrayList<>();

  /**
   * Instantiates a new In memory audit store.
   */
  public InMemoryAuditStore() {
    log.warn("Using in-memory audit store; the audit trail will not survive a restart");
  }

  @Override
  public synchronized void append(AuditEntry entry) {
    entries.add(entry);
  }

  @Override
  public synchronized Optional<AuditEntry> last() {
    return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
  }

  @Override
  public synchronized List<AuditEntry> entries() {
    return List.copyOf(entries);
  }
}
