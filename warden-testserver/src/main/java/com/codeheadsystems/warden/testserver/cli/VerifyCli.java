package com.codeheadsystems.warden.testserver.cli;

import com.codeheadsystems.warden.client.accessor.RevocationAccessor;
import com.codeheadsystems.warden.client.cache.ValidationCache;
import com.codeheadsystems.warden.client.config.VerifierConfig;
import com.codeheadsystems.warden.client.manager.OfflineVerifier;
import com.codeheadsystems.warden.client.manager.OnlineReconciler;
import com.codeheadsystems.warden.client.model.ServerConnectionInfo;
import com.codeheadsystems.warden.client.model.VerificationResult;
import com.codeheadsystems.warden.core.fingerprint.FingerprintHash;
import com.codeheadsystems.warden.core.fingerprint.HardwareFingerprinter;
import com.codeheadsystems.warden.core.fingerprint.SystemHardwareFactsProvider;
import com.codeheadsystems.warden.core.key.KeyRing;
import com.codeheadsystems.warden.core.license.Tier;
import com.codeheadsystems.warden.issuer.key.FileKeyRepository;
import com.codeheadsystems.warden.model.LicenseFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line license verification, as an installer would run it.
 *
 * <pre>
 * Usage:
 *   VerifyCli --keys &lt;dir&gt; --license &lt;license.json&gt; [--key &lt;license key&gt;]
 *             [--server &lt;url&gt;] [--cache &lt;file&gt;] [--fingerprint &lt;hex&gt;] [--retention &lt;n&gt;]
 *             [--audit-log &lt;file&gt; --audit-key &lt;hex&gt;]
 * </pre>
 *
 * <p>Only the public key files in {@code --keys} are read. Without {@code --server} the check is
 * purely offline. Exit status is 0 for a valid license and 2 for any rejection.
 */
public class VerifyCli {

  private static final String USAGE = "Usage: VerifyCli --keys <dir> --license <license.json> [--key <license key>] "
      + "[--server <url>] [--cache <file>] [--fingerprint <hex>] [--retention <n>] [--audit-log <file> --audit-key <hex>]";

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
      KeyRing keyRing = new FileKeyRepository(Path.of(cli.required("keys"))).loadKeyRing(cli.intOption("retention", 4));
      LicenseFile licenseFile = new ObjectMapper().readValue(Path.of(cli.required("license")).toFile(), LicenseFile.class);
      String keyString = cli.option("key").orElse(licenseFile.licenseKey());
      FingerprintHash fingerprint = cli.option("fingerprint")
          .map(FingerprintHash::new)
          .orElseGet(() -> new HardwareFingerprinter(new SystemHardwareFactsProvider()).fingerprint());
      Path cachePath = cli.option("cache")
          .map(Path::of)
          .orElse(Path.of(System.getProperty("user.home"), ".warden", "validation-cache.json"));

      VerifierConfig config = new VerifierConfig();
      ValidationCache cache = new ValidationCache(cachePath, fingerprint);
      Optional<OnlineReconciler> reconciler = cli.option("server")
          .map(server -> RevocationAccessor.create(config, new ServerConnectionInfo(URI.create(server))))
          .map(accessor -> new OnlineReconciler(accessor, cache, config, Clock.systemUTC()));
      OfflineVerifier verifier = new OfflineVerifier(keyRing, cache, cli.auditLogger(), reconciler, config,
          Clock.systemUTC());

      VerificationResult result = verifier.verify(keyString, licenseFile.licenseSignature(), fingerprint);
      out.println("Status  : " + result.status());
      out.println("Tier    : " + result.licensedTier().map(Tier::displayName).orElse("-"));
      out.println("Message : " + result.userMessage());
      return result.isValid() ? 0 : 2;
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
