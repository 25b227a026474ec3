package com.codeheadsystems.warden.issuer.resource;

import com.codeheadsystems.warden.core.license.LicenseKeyCodec;
import com.codeheadsystems.warden.issuer.manager.RevocationManager;
import com.codeheadsystems.warden.model.RevocationCheckRequest;
import com.codeheadsystems.warden.model.RevocationCheckResponse;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Locale;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Online revocation checks.
 */
@Singleton
@Path("/revocation")
public class RevocationResource {
  private static final Logger log = LoggerFactory.getLogger(RevocationResource.class);

  private final RevocationManager revocationManager;

  /**
   * Instantiates a new Revocation resource.
   *
   * @param revocationManager the revocation manager
   */
  @Inject
  public RevocationResource(final RevocationManager revocationManager) {
    this.revocationManager = revocationManager;
    log.info("RevocationResource({})", revocationManager);
  }

  /**
   * Check revocation status.
   *
   * @param request the request
   * @return the revocation check response
   */
  @POST
  @Path("/check")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public RevocationCheckResponse check(final RevocationCheckRequest request) {
    if (request == null || request.serial() == null || request.serial().isBlank()) {
      throw new WebApplicationException("Missing required field: serial", Response.Status.BAD_REQUEST);
    }
    final String serial = request.serial().trim().toUpperCase(Locale.ROOT);
    if (!LicenseKeyCodec.isValidSerial(serial)) {
      throw new WebApplicationException("Invalid serial", Response.Status.BAD_REQUEST);
    }
    log.trace("check(serial={})", serial);
    return revocationManager.check(serial);
  }
}
