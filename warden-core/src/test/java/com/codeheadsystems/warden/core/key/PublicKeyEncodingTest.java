package com.codeheadsystems.warden.core.key;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PublicKeyEncodingTest {

  @Test
  void fromName_isLenient() {
    assertThat(PublicKeyEncoding.fromName("pem")).isEqualTo(PublicKeyEncoding.PEM);
    assertThat(PublicKeyEncoding.fromName(" der-base64 ")).isEqualTo(PublicKeyEncoding.DER_BASE64);
    assertThat(PublicKeyEncoding.fromName("Xml")).isEqualTo(PublicKeyEncoding.XML);
  }

  @Test
  void fromName_unknown_throws() {
    assertThatThrownBy(() -> PublicKeyEncoding.fromName("jwk")).isInstanceOf(IllegalArgumentException.class);
  }
}
