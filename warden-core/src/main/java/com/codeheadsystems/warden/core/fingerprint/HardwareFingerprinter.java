package com.codeheadsystems.warden.core.fingerprint;

import com.codeheadsystems.warden.core.common.Hashes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a stable machine fingerprint from hardware identifiers.
 * <p>
 * The canonical form is {@code uuid=<uuid>|mac=<sorted macs joined by ','>|cpu=<sha256 of model>},
 * hashed with SHA-256. Only the hash is exposed.
 */
@Singleton
public class HardwareFingerprinter {

  private static final Logger log = LoggerFactory.getLogger(HardwareFingerprinter.class);

  private final HardwareFactsProvider factsProvider;

  /**
   * Instantiates a new Hardware fingerprinter.
   *
   * @param factsProvider the facts provider
   */
  @Inject
  public HardwareFingerprinter(HardwareFactsProvider factsProvider) {
    this.factsProvider = factsProvider;
  }

  /**
   * Fingerprint of this machine.
   *
   * @return the fingerprint hash
   */
  public FingerprintHash fingerprint() {
    HardwareFacts facts = factsProvider.collect();
    FingerprintHash hash = new FingerprintHash(Hashes.sha256Hex(canonical(facts)));
    log.debug("fingerprint(): macs={}, uuidPresent={}", facts.macAddresses().size(),
        !facts.platformUuid().isEmpty());
    return hash;
  }

  static String canonical(HardwareFacts facts) {
    List<String> macs = new ArrayList<>(facts.macAddresses());
    macs.replaceAll(mac -> mac.toLowerCase(Locale.ROOT));
    macs.sort(null);
    return "uuid=" + facts.platformUuid()
        + "|mac=" + String.join(",", macs)
        + "|cpu=" + Hashes.sha256Hex(facts.cpuModel());
  }
}
