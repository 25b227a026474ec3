package com.codeheadsystems.warden.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RevocationCheckResponseTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void json_matchesWireFormat() throws Exception {
    RevocationCheckResponse response = new RevocationCheckResponse("ABCDE12345F", true,
        Instant.parse("2026-06-01T08:00:00Z"));

    assertThat(objectMapper.readTree(objectMapper.writeValueAsString(response)))
        .isEqualTo(objectMapper.readTree(
            "{\"serial\":\"ABCDE12345F\",\"revoked\":true,\"serverTime\":\"2026-06-01T08:00:00Z\"}"));
  }

  @Test
  void json_parsesServerTime() throws Exception {
    RevocationCheckResponse response = objectMapper.readValue(
        "{\"serial\":\"S\",\"revoked\":false,\"serverTime\":\"2026-06-01T08:00:00Z\"}",
        RevocationCheckResponse.class);

    assertThat(response.revoked()).isFalse();
    assertThat(response.serverInstant()).isEqualTo(Instant.parse("2026-06-01T08:00:00Z"));
  }

  @Test
  void serverInstant_invalid_throws() {
    assertThatThrownBy(() -> new RevocationCheckResponse("S", false, "noon").serverInstant())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void request_json() throws Exception {
    assertThat(objectMapper.readValue("{\"serial\":\"X\"}", RevocationCheckRequest.class).serial()).isEqualTo("X");
  }
}
