package com.codeheadsystems.warden.testserver.task;

import com.codeheadsystems.warden.issuer.manager.RevocationManager;
import io.dropwizard.servlets.tasks.Task;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Admin task that revokes a license by serial.
 */
public class RevokeLicenseTask extends Task {

  private final RevocationManager revocationManager;

  /**
   * Instantiates a new Revoke license task.
   *
   * @param revocationManager the revocation manager
   */
  public RevokeLicenseTask(RevocationManager revocationManager) {
    super("revoke-license");
    this.revocationManager = revocationManager;
  }

  @Override
  public void execute(Map<String, List<String>> parameters, PrintWriter output) {
    Optional<String> serial = IssueLicenseTask.first(parameters, "serial");
    if (serial.isEmpty()) {
      output.println("Missing parameter: serial");
      return;
    }
    String normalized = serial.get().toUpperCase(Locale.ROOT);
    try {
      boolean newlyRevoked = revocationManager.revoke(normalized);
      output.println(newlyRevoked ? "revoked " + normalized : normalized + " was already revoked");
    } catch (IllegalArgumentException e) {
      output.println(e.getMessage());
    }
  }
}
