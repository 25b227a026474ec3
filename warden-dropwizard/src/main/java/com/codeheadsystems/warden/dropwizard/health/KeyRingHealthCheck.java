package com.codeheadsystems.warden.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.warden.core.key.KeyManager;
import com.codeheadsystems.warden.core.key.KeyRing;

/**
 * Health check that signs a fixed message with the current key and verifies it through every public
 * key encoding.
 */
public class KeyRingHealthCheck extends HealthCheck {

  private final KeyManager keyManager;

  /**
   * Instantiates a new Key ring health check.
   *
   * @param keyManager the key manager
   */
  public KeyRingHealthCheck(KeyManager keyManager) {
    this.keyManager = keyManager;
  }

  @Override
  protected Result check() {
    final KeyRing keyRing;
    try {
      keyRing = keyManager.keyRing();
    } catch (IllegalStateException e) {
      return Result.unhealthy("No signing key: " + e.getMessage());
    }
    try {
      keyManager.selfTest(keyRing.currentVersion());
    } catch (IllegalStateException e) {
      return Result.unhealthy(e);
    }
    return Result.healthy("current key version=%d, ring=%s", keyRing.currentVersion(), keyRing.versions());
  }
}
