package com.codeheadsystems.warden.testserver.cli;

import com.codeheadsystems.warden.core.common.RandomProvider;
import com.codeheadsystems.warden.core.fingerprint.FingerprintHash;
import com.codeheadsystems.warden.core.fingerprint.HardwareFingerprinter;
import com.codeheadsystems.warden.core.fingerprint.SystemHardwareFactsProvider;
import com.codeheadsystems.warden.core.key.KeyManager;
import com.codeheadsystems.warden.core.key.KeyManagerConfig;
import com.codeheadsystems.warden.core.key.SigningKeyPair;
import com.codeheadsystems.warden.core.license.ValidityWindow;
import com.codeheadsystems.warden.issuer.key.FileKeyRepository;
import com.codeheadsystems.warden.issuer.manager.IssuedLicense;
import com.codeheadsystems.warden.issuer.manager.LicenseIssuer;
import com.codeheadsystems.warden.issuer.store.InMemoryIssuanceLedger;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line license issuance from a key directory, without a running server.
 *
 * <pre>
 * Usage:
 *   IssueCli --keys &lt;dir&gt; --tier &lt;tier&gt; [--days &lt;n&gt; | --perpetual]
 *            [--bind &lt;fingerprint&gt; | --bind-this-machine] [--out &lt;license.json&gt;]
 *            [--audit-log &lt;file&gt; --audit-key &lt;hex&gt;]
 * </pre>
 *
 * <p>Serials are only checked for uniqueness within one run; licenses that must be revocable
 * should be issued by the server's {@code issue-license} admin task instead.
 */
public class IssueCli {

  private static final String USAGE = "Usage: IssueCli --keys <dir> --tier <tier> [--days <n> | --perpetual] "
      + "[--bind <fingerprint> | --bind-this-machine] [--out <license.json>] [--audit-log <file> --audit-key <hex>]";

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
      CliArgs cli = CliArgs.parse(args, Set.of("perpetual", "bind-this-machine"));
      Path keys = Path.of(cli.required("keys"));
      String tier = cli.required("tier");
      ValidityWindow window = cli.flag("perpetual")
          ? ValidityWindow.perpetual()
          : ValidityWindow.ofDays(cli.intOption("days", 365));
      Optional<FingerprintHash> binding = cli.option("bind").map(FingerprintHash::new);
      if (cli.flag("bind-this-machine")) {
        binding = Optional.of(new HardwareFingerprinter(new SystemHardwareFactsProvider()).fingerprint());
      }

      List<SigningKeyPair> existing = new FileKeyRepository(keys).loadAll();
      if (existing.isEmpty()) {
        err.println("Error: no signing keys in " + keys + "; run KeygenCli first");
        return 1;
      }
      KeyManager keyManager = new KeyManager(new KeyManagerConfig(), existing);
      LicenseIssuer issuer = new LicenseIssuer(keyManager, new InMemoryIssuanceLedger(), cli.auditLogger(),
          new RandomProvider(), Clock.systemUTC());

      IssuedLicense issued = issuer.issue(tier, window, binding);
      String json = new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(issued.licenseFile());

      out.println("License key  : " + issued.licenseKey());
      out.println("Key version  : " + issued.record().keyVersion());
      out.println("Expires      : " + issued.record().expiry().map(Object::toString).orElse("never"));
      Optional<String> target = cli.option("out");
      if (target.isPresent()) {
        Files.writeString(Path.of(target.get()), json + System.lineSeparator(), StandardCharsets.UTF_8);
        out.println("License file : " + target.get());
      } else {
        out.println(json);
      }
      return 0;
    } catch (CliArgs.UsageException e) {
      err.println("Error: " + e.getMessage());
      err.println(USAGE);
      return 1;
    } catch (IOException | RuntimeException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
