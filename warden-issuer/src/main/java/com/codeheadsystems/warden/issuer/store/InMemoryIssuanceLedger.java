package com.codeheadsystems.warden.issuer.store;

import com.codeheadsystems.warden.core.license.LicenseRecord;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link IssuanceLedger}. Issued serials are lost on restart, which means a
 * restarted issuer could in principle reuse one; use a persistent ledger in production.
 */
public class InMemoryIssuanceLedger implements IssuanceLedger {

  private static final Logger log = LoggerFactory.getLogger(InMemoryIssuanceLedger.class);

  private final ReentrantLock lock = new ReentrantLock();
  // A reserved-but-unsigned serial maps to an empty Optional.
  private final Map<String, Optional<LicenseRecord>> ledger = new HashMap<>();

  public InMemoryIssuanceLedger() {
    log.warn("Using InMemoryIssuanceLedger; issued serials will NOT survive restarts.");
  }

  @Override
  public boolean reserve(String serial) {
    lock.lock();
    try {
      if (ledger.containsKey(serial)) {
        log.debug("reserve({}): collision", serial);
        return false;
      }
      ledger.put(serial, Optional.empty());
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void record(LicenseRecord record) {
    lock.lock();
    try {
      if (!ledger.containsKey(record.serial())) {
        throw new IllegalStateException("Serial was not reserved: " + record.serial());
      }
      ledger.put(record.serial(), Optional.of(record));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<LicenseRecord> lookup(String serial) {
    lock.lock();
    try {
      return ledger.getOrDefault(serial, Optional.empty());
    } finally {
      lock.unlock();
    }
  }
}
