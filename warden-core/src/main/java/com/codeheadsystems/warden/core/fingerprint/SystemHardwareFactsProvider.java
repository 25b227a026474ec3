package com.codeheadsystems.warden.core.fingerprint;

import java.io.IOException;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads identifiers from the running Linux host. Unreadable sources fall back to the next
 * source, so a fingerprint is always produced.
 * <p>
 * Only MAC addresses of interfaces backed by a device in sysfs are used. Bridges, veth pairs,
 * tunnels and the docker interface come and go with containers and VPNs. Physical interfaces
 * that are down still count, since link state is not a property of the machine.
 */
@Singleton
public class SystemHardwareFactsProvider implements HardwareFactsProvider {

  private static final Logger log = LoggerFactory.getLogger(SystemHardwareFactsProvider.class);

  private final Path productUuid;
  private final Path machineId;
  private final Path cpuInfo;
  private final Path netClass;

  /**
   * Instantiates a new System hardware facts provider using the standard Linux paths.
   */
  public SystemHardwareFactsProvider() {
    this(Path.of("/sys/class/dmi/id/product_uuid"), Path.of("/etc/machine-id"), Path.of("/proc/cpuinfo"),
        Path.of("/sys/class/net"));
  }

  /**
   * Instantiates a new System hardware facts provider.
   *
   * @param productUuid the product uuid file
   * @param machineId   the machine id file
   * @param cpuInfo     the cpuinfo file
   */
  public SystemHardwareFactsProvider(Path productUuid, Path machineId, Path cpuInfo) {
    this(productUuid, machineId, cpuInfo, Path.of("/sys/class/net"));
  }

  /**
   * Instantiates a new System hardware facts provider.
   *
   * @param productUuid the product uuid file
   * @param machineId   the machine id file
   * @param cpuInfo     the cpuinfo file
   * @param netClass    the sysfs directory listing network interfaces
   */
  public SystemHardwareFactsProvider(Path productUuid, Path machineId, Path cpuInfo, Path netClass) {
    this.productUuid = productUuid;
    this.machineId = machineId;
    this.cpuInfo = cpuInfo;
    this.netClass = netClass;
  }

  @Override
  public HardwareFacts collect() {
    String uuid = readFirstLine(productUuid).or(() -> readFirstLine(machineId)).orElse("");
    return new HardwareFacts(uuid, macAddresses(), cpuModel());
  }

  String cpuModel() {
    if (Files.isReadable(cpuInfo)) {
      try {
        for (String line : Files.readAllLines(cpuInfo)) {
          if (line.startsWith("model name")) {
            int colon = line.indexOf(':');
            if (colon > 0) {
              return line.substring(colon + 1).trim();
            }
          }
        }
      } catch (IOException e) {
        log.debug("Unable to read {}", cpuInfo, e);
      }
    }
    return System.getProperty("os.arch", "unknown") + "/" + Runtime.getRuntime().availableProcessors();
  }

  List<String> macAddresses() {
    Map<String, byte[]> addresses = new LinkedHashMap<>();
    try {
      for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
        if (nic.isLoopback() || nic.isVirtual()) {
          continue;
        }
        byte[] address = nic.getHardwareAddress();
        if (address != null) {
          addresses.put(nic.getName(), address);
        }
      }
    } catch (SocketException e) {
      log.warn("Unable to enumerate network interfaces; fingerprint will omit MAC addresses", e);
    }
    return physicalMacs(addresses);
  }

  /**
   * Keeps the addresses of physical interfaces, sorted. Without a sysfs tree (not Linux) every
   * non-empty address is kept.
   *
   * @param addresses hardware address by interface name
   * @return the formatted MAC addresses
   */
  List<String> physicalMacs(Map<String, byte[]> addresses) {
    boolean sysfs = Files.isDirectory(netClass);
    List<String> macs = new ArrayList<>();
    addresses.forEach((name, address) -> {
      if (address.length == 0 || allZero(address)) {
        return;
      }
      if (sysfs && !physical(name)) {
        log.debug("physicalMacs(): skipping {}", name);
        return;
      }
      macs.add(formatMac(address));
    });
    Collections.sort(macs);
    return macs;
  }

  boolean physical(String name) {
    return Files.exists(netClass.resolve(name).resolve("device"));
  }

  static String formatMac(byte[] address) {
    StringBuilder out = new StringBuilder();
    for (byte b : address) {
      if (out.length() > 0) {
        out.append(':');
      }
      out.append(String.format("%02x", b & 0xFF));
    }
    return out.toString();
  }

  private static boolean allZero(byte[] address) {
    for (byte b : address) {
      if (b != 0) {
        return false;
      }
    }
    return true;
  }

  private Optional<String> readFirstLine(Path path) {
    if (!Files.isReadable(path)) {
      return Optional.empty();
    }
    try {
      return Files.readAllLines(path).stream().map(String::trim).filter(s -> !s.isEmpty()).findFirst();
    } catch (IOException e) {
      log.debug("Unable to read {}", path, e);
      return Optional.empty();
    }
  }
}
