package com.codeheadsystems.warden.testserver.cli;

import com.codeheadsystems.warden.core.fingerprint.HardwareFingerprinter;
import com.codeheadsystems.warden.core.fingerprint.SystemHardwareFactsProvider;

/**
 * Prints this machine's fingerprint, for binding a license with {@code IssueCli --bind}.
 */
public class FingerprintCli {

  /**
   * Main entry point.
   *
   * @param args ignored
   */
  public static void main(String[] args) {
    System.out.println(new HardwareFingerprinter(new SystemHardwareFactsProvider()).fingerprint());
  }
}
