package com.codeheadsystems.warden.client.model;

import java.net.URI;

/**
 * Network connection details for the license server.
 *
 * @param baseUri The base URI of the server (e.g. http://host:8080).
 */
public record ServerConnectionInfo(URI baseUri) {

  public ServerConnectionInfo {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
  }

  /**
   * The revocation check endpoint.
   *
   * @return the uri
   */
  public URI revocationCheckUri() {
    String base = baseUri.toString();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + "/revocation/check");
  }
}
