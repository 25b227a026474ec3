package com.codeheadsystems.warden.testserver.cli;

import com.codeheadsystems.warden.core.audit.AuditLogger;
import com.codeheadsystems.warden.core.audit.FileAuditStore;
import com.codeheadsystems.warden.core.audit.InMemoryAuditStore;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * {@code --name value} and {@code --flag} arguments shared by the command-line tools.
 */
final class CliArgs {

  private final Map<String, String> options;
  private final Set<String> flags;

  private CliArgs(Map<String, String> options, Set<String> flags) {
    this.options = options;
    this.flags = flags;
  }

  /**
   * Parses arguments.
   *
   * @param args      the args
   * @param flagNames options that take no value
   * @return the cli args
   * @throws UsageException on a stray or incomplete argument
   */
  static CliArgs parse(String[] args, Set<String> flagNames) {
    Map<String, String> options = new HashMap<>();
    Set<String> flags = new HashSet<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        throw new UsageException("Unexpected argument: " + arg);
      }
      String name = arg.substring(2);
      if (flagNames.contains(name)) {
        flags.add(name);
      } else if (i + 1 < args.length) {
        options.put(name, args[++i]);
      } else {
        throw new UsageException("Missing value for " + arg);
      }
    }
    return new CliArgs(options, flags);
  }

  Optional<String> option(String name) {
    return Optional.ofNullable(options.get(name));
  }

  String required(String name) {
    return option(name).orElseThrow(() -> new UsageException("Missing required option --" + name));
  }

  int intOption(String name, int defaultValue) {
    Optional<String> value = option(name);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.get());
    } catch (NumberFormatException e) {
      throw new UsageException("--" + name + " must be a number: " + value.get());
    }
  }

  boolean flag(String name) {
    return flags.contains(name);
  }

  /**
   * An audit logger over {@code --audit-log} with {@code --audit-key}, or an in-memory one when
   * no log is given.
   *
   * @return the audit logger
   */
  AuditLogger auditLogger() {
    Optional<String> log = option("audit-log");
    if (log.isEmpty()) {
      return new AuditLogger(new byte[32], new InMemoryAuditStore(), Clock.systemUTC());
    }
    return new AuditLogger(hexKey(required("audit-key")), new FileAuditStore(Path.of(log.get())), Clock.systemUTC());
  }

  static byte[] hexKey(String hex) {
    try {
      return Hex.decode(hex);
    } catch (DecoderException e) {
      throw new UsageException("Audit key is not valid hex");
    }
  }

  /**
   * Bad command line.
   */
  static final class UsageException extends RuntimeException {
    UsageException(String message) {
      super(message);
    }
  }
}
