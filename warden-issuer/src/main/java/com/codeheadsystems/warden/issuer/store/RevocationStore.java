package com.codeheadsystems.warden.issuer.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for revoked serials. Implementations must be thread-safe.
 */
public interface RevocationStore {

  /**
   * Marks a serial revoked.
   *
   * @param serial    the serial
   * @param revokedAt when it was revoked
   * @return true if it was not already revoked
   */
  boolean revoke(String serial, Instant revokedAt);

  /**
   * When the serial was revoked.
   *
   * @param serial the serial
   * @return the revocation time, empty when not revoked
   */
  Optional<Instant> revokedAt(String serial);

  default boolean isRevoked(String serial) {
    return revokedAt(serial).isPresent();
  }
}
