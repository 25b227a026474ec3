package com.codeheadsystems.warden.client.manager;

import com.codeheadsystems.warden.client.accessor.RevocationAccessor;
import com.codeheadsystems.warden.client.cache.ValidationCache;
import com.codeheadsystems.warden.client.config.VerifierConfig;
import com.codeheadsystems.warden.client.exceptions.RevocationAccessorException;
import com.codeheadsystems.warden.client.model.ReconcileResult;
import com.codeheadsystems.warden.model.RevocationCheckResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort online revocation check. Only deny information comes from the server; signatures
 * are never checked here.
 */
@Singleton
public class OnlineReconciler {

  private static final Logger log = LoggerFactory.getLogger(OnlineReconciler.class);

  private final RevocationAccessor accessor;
  private final ValidationCache cache;
  private final VerifierConfig config;
  private final Clock clock;

  /**
   * Instantiates a new Online reconciler.
   *
   * @param accessor the accessor
   * @param cache    the cache
   * @param config   the config
   * @param clock    the clock
   */
  @Inject
  public OnlineReconciler(final RevocationAccessor accessor,
                          final ValidationCache cache,
                          final VerifierConfig config,
                          final Clock clock) {
    log.info("OnlineReconciler({}, {})", accessor, cache.path());
    this.accessor = accessor;
    this.cache = cache;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Asks the server about a serial. A successful answer refreshes the serial's cache entry; a
   * transport failure leaves the cache alone.
   *
   * @param serial the serial
   * @return the reconcile result
   */
  public ReconcileResult reconcile(final String serial) {
    log.debug("reconcile({})", serial);
    final RevocationCheckResponse response;
    try {
      response = accessor.check(serial);
    } catch (RevocationAccessorException e) {
      log.warn("Revocation server unreachable for {}: {}", serial, e.getMessage());
      return ReconcileResult.unreachable(e.getMessage());
    }
    final Instant now = clock.instant();
    final Instant serverTime = response.serverInstant();
    final Duration skew = Duration.between(now, serverTime);
    if (skew.abs().compareTo(config.clockSkewTolerance()) > 0) {
      log.warn("Local clock differs from server time by {} (tolerance {})", skew, config.clockSkewTolerance());
    }
    cache.recordReconciliation(serial, now, response.revoked());
    return ReconcileResult.reachable(response.revoked(), serverTime, skew);
  }
}
