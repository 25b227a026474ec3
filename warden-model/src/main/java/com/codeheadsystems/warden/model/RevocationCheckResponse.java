package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Wire model for the answer to a revocation check. The server time lets clients notice a
 * skewed local clock.
 * <p>
 * Used by: {@code POST /revocation/check} response
 *
 * @param serial     the license serial
 * @param revoked    whether the license has been revoked
 * @param serverTime ISO-8601 server time when the answer was produced
 */
public record RevocationCheckResponse(
    @JsonProperty("serial") String serial,
    @JsonProperty("revoked") boolean revoked,
    @JsonProperty("serverTime") String serverTime) {

  public RevocationCheckResponse(String serial, boolean revoked, Instant serverTime) {
    this(serial, revoked, serverTime.toString());
  }

  /**
   * Server time as an instant.
   *
   * @return the instant
   * @throws IllegalArgumentException if the server sent an unparseable time
   */
  public Instant serverInstant() {
    if (serverTime == null) {
      throw new IllegalArgumentException("Missing required field: serverTime");
    }
    try {
      return Instant.parse(serverTime);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 instant in field: serverTime", e);
    }
  }
}
