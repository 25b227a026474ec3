package com.codeheadsystems.warden.issuer.resource;

import com.codeheadsystems.warden.core.key.KeyManager;
import com.codeheadsystems.warden.core.key.KeyRing;
import com.codeheadsystems.warden.core.key.PublicKeyEncoding;
import com.codeheadsystems.warden.core.key.UnknownKeyVersionException;
import com.codeheadsystems.warden.model.PublicKeyVersionsResponse;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.nio.charset.StandardCharsets;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public key distribution for verifier builds.
 */
@Singleton
@Path("/keys")
public class PublicKeyResource {
  private static final Logger log = LoggerFactory.getLogger(PublicKeyResource.class);

  private final KeyManager keyManager;

  /**
   * Instantiates a new Public key resource.
   *
   * @param keyManager the key manager
   */
  @Inject
  public PublicKeyResource(final KeyManager keyManager) {
    this.keyManager = keyManager;
    log.info("PublicKeyResource({})", keyManager);
  }

  /**
   * The versions in the current key ring.
   *
   * @return the public key versions response
   */
  @GET
  @Produces(MediaType.APPLICATION_JSON)
  public PublicKeyVersionsResponse versions() {
    final KeyRing keyRing = keyManager.keyRing();
    return new PublicKeyVersionsResponse(keyRing.currentVersion(), List.copyOf(keyRing.versions()));
  }

  /**
   * One public key in the requested encoding.
   *
   * @param version  the key version
   * @param encoding pem, der_base64 or xml
   * @return the encoded key
   */
  @GET
  @Path("/{version}/{encoding}")
  @Produces(MediaType.TEXT_PLAIN)
  public String publicKey(@PathParam("version") final int version,
                          @PathParam("encoding") final String encoding) {
    final PublicKeyEncoding keyEncoding;
    try {
      keyEncoding = PublicKeyEncoding.fromName(encoding);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException("Unknown key encoding: " + encoding, Response.Status.BAD_REQUEST);
    }
    try {
      return new String(keyManager.exportPublic(version, keyEncoding), StandardCharsets.UTF_8);
    } catch (UnknownKeyVersionException e) {
      throw new WebApplicationException("Unknown key version: " + version, Response.Status.NOT_FOUND);
    }
  }
}
