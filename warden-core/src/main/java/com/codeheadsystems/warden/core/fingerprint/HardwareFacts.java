package com.codeheadsystems.warden.core.fingerprint;

import java.util.List;
import java.util.Locale;

/**
 * Raw machine identifiers. These never leave {@link HardwareFingerprinter}; only their hash does.
 *
 * @param platformUuid the platform or machine UUID, empty when unavailable
 * @param macAddresses MAC addresses of physical interfaces, lowercase colon-separated
 * @param cpuModel     the CPU model string
 */
public record HardwareFacts(String platformUuid, List<String> macAddresses, String cpuModel) {

  public HardwareFacts {
    platformUuid = platformUuid == null ? "" : platformUuid.trim().toLowerCase(Locale.ROOT);
    macAddresses = macAddresses == null ? List.of() : List.copyOf(macAddresses);
    cpuModel = cpuModel == null ? "" : cpuModel.trim();
  }

  @Override
  public String toString() {
    return "HardwareFacts[redacted, macs=" + macAddresses.size() + "]";
  }
}
