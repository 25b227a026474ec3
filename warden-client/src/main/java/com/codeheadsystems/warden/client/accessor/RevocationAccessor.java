package com.codeheadsystems.warden.client.accessor;

import com.codeheadsystems.warden.client.config.VerifierConfig;
import com.codeheadsystems.warden.client.exceptions.RevocationAccessorException;
import com.codeheadsystems.warden.client.model.ServerConnectionInfo;
import com.codeheadsystems.warden.model.RevocationCheckRequest;
import com.codeheadsystems.warden.model.RevocationCheckResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for {@code POST /revocation/check}.
 */
@Singleton
public class RevocationAccessor {
  private static final Logger log = LoggerFactory.getLogger(RevocationAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo connectionInfo;
  private final VerifierConfig verifierConfig;

  /**
   * Instantiates a new Revocation accessor.
   *
   * @param verifierConfig the verifier config, supplies the request timeout
   * @param httpClient     the http client
   * @param objectMapper   the object mapper
   * @param connectionInfo the server connection info
   */
  @Inject
  public RevocationAccessor(final VerifierConfig verifierConfig,
                            final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final ServerConnectionInfo connectionInfo) {
    log.info("RevocationAccessor({}, {})", verifierConfig, connectionInfo);
    this.verifierConfig = verifierConfig;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
  }

  /**
   * Builds an accessor with its own HTTP client using the configured connect timeout.
   *
   * @param verifierConfig the verifier config
   * @param connectionInfo the connection info
   * @return the revocation accessor
   */
  public static RevocationAccessor create(final VerifierConfig verifierConfig,
                                          final ServerConnectionInfo connectionInfo) {
    HttpClient client = HttpClient.newBuilder()
        .connectTimeout(verifierConfig.requestTimeout())
        .build();
    return new RevocationAccessor(verifierConfig, client, new ObjectMapper(), connectionInfo);
  }

  /**
   * Asks the server whether a serial is revoked.
   *
   * @param serial the serial
   * @return the server's answer
   * @throws RevocationAccessorException on any transport failure or unusable answer
   */
  public RevocationCheckResponse check(final String serial) {
    log.trace("check({})", serial);
    try {
      final String requestBody = objectMapper.writeValueAsString(new RevocationCheckRequest(serial));
      final HttpRequest httpRequest = HttpRequest.newBuilder()
          .uri(connectionInfo.revocationCheckUri())
          .timeout(verifierConfig.requestTimeout())
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();

      final HttpResponse<String> httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      checkStatus(serial, httpResponse.statusCode());
      final RevocationCheckResponse response = objectMapper.readValue(httpResponse.body(), RevocationCheckResponse.class);
      return validate(serial, response);
    } catch (IOException e) {
      throw new RevocationAccessorException("Revocation check failed for serial: " + serial, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RevocationAccessorException("Revocation check interrupted for serial: " + serial, e);
    }
  }

  private void checkStatus(String serial, int statusCode) {
    if (statusCode < 200 || statusCode >= 300) {
      throw new RevocationAccessorException(
          "Server returned HTTP " + statusCode + " for serial: " + serial, null);
    }
  }

  private RevocationCheckResponse validate(String serial, RevocationCheckResponse response) {
    if (response == null || !serial.equals(response.serial())) {
      throw new RevocationAccessorException("Server answered for a different serial than: " + serial, null);
    }
    try {
      response.serverInstant();
    } catch (IllegalArgumentException e) {
      throw new RevocationAccessorException("Server sent an unusable time for serial: " + serial, e);
    }
    return response;
  }
}
