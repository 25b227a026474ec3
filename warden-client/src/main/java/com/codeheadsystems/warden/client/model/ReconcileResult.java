package com.codeheadsystems.warden.client.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of an online revocation check.
 *
 * @param reachability whether the server answered
 * @param revoked      the server's revocation flag, false when unreachable
 * @param serverTime   the server's clock, null when unreachable
 * @param clockSkew    server time minus local time, null when unreachable
 * @param reason       why the server could not be used, null when reachable
 */
public record ReconcileResult(Reachability reachability, boolean revoked, Instant serverTime,
                              Duration clockSkew, String reason) {

  /**
   * Whether the server could be consulted.
   */
  public enum Reachability {
    REACHABLE, UNREACHABLE
  }

  public static ReconcileResult reachable(boolean revoked, Instant serverTime, Duration clockSkew) {
    return new ReconcileResult(Reachability.REACHABLE, revoked, serverTime, clockSkew, null);
  }

  public static ReconcileResult unreachable(String reason) {
    return new ReconcileResult(Reachability.UNREACHABLE, false, null, null, reason);
  }

  public boolean isReachable() {
    return reachability == Reachability.REACHABLE;
  }
}
