package com.codeheadsystems.warden.issuer.store;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link RevocationStore} backed by a {@link ConcurrentHashMap}.
 */
public class InMemoryRevocationStore implements RevocationStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRevocationStore.class);

  private final ConcurrentHashMap<String, Instant> revoked = new ConcurrentHashMap<>();

  public InMemoryRevocationStore() {
    log.warn("Using InMemoryRevocationStore; revocations will NOT survive restarts.");
  }

  @Override
  public boolean revoke(String serial, Instant revokedAt) {
    return revoked.putIfAbsent(serial, revokedAt) == null;
  }

  @Override
  public Optional<Instant> revokedAt(String serial) {
    return Optional.ofNullable(revoked.get(serial));
  }
}
