package com.codeheadsystems.warden.testserver.task;

import com.codeheadsystems.warden.core.fingerprint.FingerprintHash;
import com.codeheadsystems.warden.core.license.ValidityWindow;
import com.codeheadsystems.warden.issuer.manager.IssuedLicense;
import com.codeheadsystems.warden.issuer.manager.LicenseIssuer;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.servlets.tasks.Task;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admin task that issues a license and prints the key string and license file.
 * <p>
 * Parameters: {@code tier} (required), {@code days} (default 365, or {@code perpetual}),
 * {@code binding} (optional machine fingerprint).
 */
public class IssueLicenseTask extends Task {

  private static final Logger log = LoggerFactory.getLogger(IssueLicenseTask.class);

  private final LicenseIssuer licenseIssuer;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Issue license task.
   *
   * @param licenseIssuer the license issuer
   * @param objectMapper  the object mapper
   */
  public IssueLicenseTask(LicenseIssuer licenseIssuer, ObjectMapper objectMapper) {
    super("issue-license");
    this.licenseIssuer = licenseIssuer;
    this.objectMapper = objectMapper;
  }

  @Override
  public void execute(Map<String, List<String>> parameters, PrintWriter output) throws Exception {
    Optional<String> tier = first(parameters, "tier");
    if (tier.isEmpty()) {
      output.println("Missing parameter: tier");
      return;
    }
    String days = first(parameters, "days").orElse("365");
    Optional<FingerprintHash> binding = first(parameters, "binding").map(FingerprintHash::new);
    ValidityWindow window = "perpetual".equals(days)
        ? ValidityWindow.perpetual()
        : ValidityWindow.ofDays(Long.parseLong(days));

    IssuedLicense issued = licenseIssuer.issue(tier.get(), window, binding);
    log.info("Issued {} via admin task", issued.record().serial());
    output.println(issued.licenseKey());
    output.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(issued.licenseFile()));
  }

  static Optional<String> first(Map<String, List<String>> parameters, String name) {
    List<String> values = parameters.get(name);
    if (values == null || values.isEmpty() || values.get(0).isBlank()) {
      return Optional.empty();
    }
    return Optional.of(values.get(0).trim());
  }
}
