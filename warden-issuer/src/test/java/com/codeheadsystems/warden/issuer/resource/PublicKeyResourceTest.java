package com.codeheadsystems.warden.issuer.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.core.common.RandomProvider;
import com.codeheadsystems.warden.core.key.KeyManager;
import com.codeheadsystems.warden.core.key.KeyManagerConfig;
import com.codeheadsystems.warden.core.key.PublicKeyCodec;
import com.codeheadsystems.warden.core.key.PublicKeyEncoding;
import com.codeheadsystems.warden.model.PublicKeyVersionsResponse;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class PublicKeyResourceTest {

  private static KeyManager keyManager;
  private static PublicKeyResource resource;

  @BeforeAll
  static void setUp() {
    StubRuntimeDelegate.install();
    keyManager = new KeyManager(new KeyManagerConfig(2048, 4, new RandomProvider()));
    keyManager.rotate();
    keyManager.rotate();
    resource = new PublicKeyResource(keyManager);
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    StubRuntimeDelegate.uninstall();
  }

  @Test
  void versions_listsKeyRing() {
    assertThat(resource.versions()).isEqualTo(new PublicKeyVersionsResponse(2, List.of(1, 2)));
  }

  @Test
  void publicKey_xml_decodesToVersionKey() {
    String xml = resource.publicKey(1, "xml");

    assertThat(PublicKeyCodec.decode(xml.getBytes(StandardCharsets.UTF_8), PublicKeyEncoding.XML).getModulus())
        .isEqualTo(keyManager.keyPair(1).orElseThrow().publicKey().getModulus());
  }

  @Test
  void publicKey_pem() {
    assertThat(resource.publicKey(2, "PEM")).startsWith("-----BEGIN PUBLIC KEY-----");
  }

  @Test
  void publicKey_unknownEncoding_throwsBadRequest() {
    assertThatThrownBy(() -> resource.publicKey(1, "jwk"))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(Response.Status.BAD_REQUEST.getStatusCode()));
  }

  @Test
  void publicKey_unknownVersion_throwsNotFound() {
    assertThatThrownBy(() -> resource.publicKey(9, "pem"))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(Response.Status.NOT_FOUND.getStatusCode()));
  }
}
