package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for an online revocation check.
 * <p>
 * Used by: {@code POST /revocation/check}
 *
 * @param serial the license serial
 */
public record RevocationCheckRequest(@JsonProperty("serial") String serial) {
}
