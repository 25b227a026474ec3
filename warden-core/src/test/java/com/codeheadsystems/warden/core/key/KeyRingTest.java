package com.codeheadsystems.warden.core.key;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class KeyRingTest {

  private static final byte[] DATA = "data".getBytes(StandardCharsets.UTF_8);

  private static SigningKeyPair v1;
  private static SigningKeyPair v2;

  @BeforeAll
  static void generate() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    KeyPair first = generator.generateKeyPair();
    KeyPair second = generator.generateKeyPair();
    v1 = new SigningKeyPair(1, first);
    v2 = new SigningKeyPair(2, second);
  }

  @Test
  void of_highestVersionIsCurrent() {
    KeyRing ring = KeyRing.of(Map.of(1, v1.publicKey(), 2, v2.publicKey()));

    assertThat(ring.currentVersion()).isEqualTo(2);
    assertThat(ring.versions()).containsExactly(1, 2);
  }

  @Test
  void verify_usesKeyForVersion() {
    KeyRing ring = KeyRing.of(Map.of(1, v1.publicKey(), 2, v2.publicKey()));
    byte[] signature = v1.sign(DATA);

    assertThat(ring.verify(1, DATA, signature)).isTrue();
    assertThat(ring.verify(2, DATA, signature)).isFalse();
  }

  @Test
  void verify_absentVersion_isFalse() {
    KeyRing ring = KeyRing.of(2, v2.publicKey());

    assertThat(ring.verify(1, DATA, v1.sign(DATA))).isFalse();
  }

  @Test
  void verify_emptyOrGarbageSignature_isFalse() {
    KeyRing ring = KeyRing.of(1, v1.publicKey());

    assertThat(ring.verify(1, DATA, new byte[0])).isFalse();
    assertThat(ring.verify(1, DATA, new byte[]{1, 2, 3})).isFalse();
  }

  @Test
  void builder_acceptsEveryEncoding() {
    KeyRing ring = KeyRing.builder()
        .add(1, PublicKeyCodec.encode(v1.publicKey(), PublicKeyEncoding.XML), PublicKeyEncoding.XML)
        .add(2, PublicKeyCodec.encode(v2.publicKey(), PublicKeyEncoding.PEM), PublicKeyEncoding.PEM)
        .build();

    assertThat(ring.verify(1, DATA, v1.sign(DATA))).isTrue();
    assertThat(ring.verify(2, DATA, v2.sign(DATA))).isTrue();
  }

  @Test
  void of_empty_throws() {
    assertThatThrownBy(() -> KeyRing.of(Map.of())).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void signingKeyPair_toStringHidesKeys() {
    assertThat(v1.toString()).isEqualTo("SigningKeyPair[keyVersion=1, modulusBits=2048]");
  }
}
