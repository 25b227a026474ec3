package com.codeheadsystems.warden.testserver.cli;

import com.codeheadsystems.warden.core.audit.AuditLogger;
import com.codeheadsystems.warden.core.audit.ChainVerification;
import com.codeheadsystems.warden.core.audit.FileAuditStore;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;

/**
 * Re-verifies a JSON-lines audit log offline.
 *
 * <pre>
 * Usage:
 *   AuditCli --log &lt;audit.jsonl&gt; --key &lt;hex&gt;
 * </pre>
 *
 * <p>Exit status is 0 for an intact chain and 3 when an entry does not verify.
 */
public class AuditCli {

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    try {
      CliArgs cli = CliArgs.parse(args, Set.of());
      Path log = Path.of(cli.required("log"));
      if (!Files.exists(log)) {
        err.println("Error: no audit log at " + log);
        return 1;
      }
      AuditLogger auditLogger = new AuditLogger(CliArgs.hexKey(cli.required("key")), new FileAuditStore(log),
          Clock.systemUTC());

      ChainVerification verification = auditLogger.verifyChain();
      out.println("Entries checked : " + verification.entriesChecked());
      if (!verification.valid()) {
        out.println("Chain BROKEN at entry " + verification.firstInvalidIndex());
        return 3;
      }
      out.println("Chain intact");
      return 0;
    } catch (CliArgs.UsageException e) {
      err.println("Error: " + e.getMessage());
      err.println("Usage: AuditCli --log <audit.jsonl> --key <hex>");
      return 1;
    } catch (RuntimeException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
