package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model listing the public key versions a verifier should embed.
 * <p>
 * Used by: {@code GET /keys} response
 *
 * @param currentVersion the version new licenses are signed with
 * @param versions       every version in the current key ring, ascending
 */
public record PublicKeyVersionsResponse(
    @JsonProperty("currentVersion") int currentVersion,
    @JsonProperty("versions") List<Integer> versions) {
}
