package com.codeheadsystems.warden.testserver.cli;

import com.codeheadsystems.warden.core.common.RandomProvider;
import com.codeheadsystems.warden.core.key.KeyManager;
import com.codeheadsystems.warden.core.key.KeyManagerConfig;
import com.codeheadsystems.warden.core.key.SigningKeyPair;
import com.codeheadsystems.warden.issuer.key.FileKeyRepository;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Command-line key generation into a key directory.
 *
 * <pre>
 * Usage:
 *   KeygenCli --dir &lt;path&gt; [--rotate] [--bits &lt;n&gt;]
 * </pre>
 *
 * <p>An empty directory gets version 1. A directory that already holds keys only gets a new
 * version with {@code --rotate}; older versions are kept so existing licenses keep verifying.
 */
public class KeygenCli {

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
      CliArgs cli = CliArgs.parse(args, Set.of("rotate"));
      Path dir = Path.of(cli.required("dir"));
      int bits = cli.intOption("bits", 2048);

      FileKeyRepository repository = new FileKeyRepository(dir);
      List<SigningKeyPair> existing = repository.loadAll();
      if (!existing.isEmpty() && !cli.flag("rotate")) {
        err.println("Error: " + dir + " already holds key version "
            + existing.get(existing.size() - 1).keyVersion() + "; pass --rotate to add a new version");
        return 1;
      }
      KeyManager keyManager = new KeyManager(new KeyManagerConfig(bits, 4, RandomProvider.strong()), existing);
      int version = keyManager.rotate();
      keyManager.selfTest(version);
      repository.save(keyManager.current());

      out.println("Generated key version " + version);
      out.println("  private : " + repository.privateKeyPath(version));
      out.println("  public  : " + repository.publicKeyPath(version));
      return 0;
    } catch (CliArgs.UsageException e) {
      err.println("Error: " + e.getMessage());
      err.println("Usage: KeygenCli --dir <path> [--rotate] [--bits <n>]");
      return 1;
    } catch (RuntimeException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
