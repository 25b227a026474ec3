package com.codeheadsystems.warden.core.fingerprint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codeheadsystems.warden.core.common.Hashes;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HardwareFingerprinterTest {

  private static final HardwareFacts FACTS = new HardwareFacts("4C4C4544-0042-3510-8052-B4C04F384232",
      List.of("aa:bb:cc:00:11:22", "02:42:ac:11:00:02"), "Intel(R) Core(TM) i7-8650U CPU @ 1.90GHz");

  @Mock private HardwareFactsProvider provider;

  @Test
  void canonical_sortsMacsAndHashesCpu() {
    String canonical = HardwareFingerprinter.canonical(FACTS);

    assertThat(canonical).isEqualTo("uuid=4c4c4544-0042-3510-8052-b4c04f384232"
        + "|mac=02:42:ac:11:00:02,aa:bb:cc:00:11:22"
        + "|cpu=" + Hashes.sha256Hex("Intel(R) Core(TM) i7-8650U CPU @ 1.90GHz"));
  }

  @Test
  void fingerprint_isSha256HexOfCanonical() {
    when(provider.collect()).thenReturn(FACTS);

    FingerprintHash hash = new HardwareFingerprinter(provider).fingerprint();

    assertThat(hash.value()).hasSize(64).isEqualTo(Hashes.sha256Hex(HardwareFingerprinter.canonical(FACTS)));
  }

  @Test
  void fingerprint_independentOfMacOrderAndCase() {
    HardwareFacts reordered = new HardwareFacts(FACTS.platformUuid().toUpperCase(),
        List.of("02:42:AC:11:00:02", "aa:bb:cc:00:11:22"), FACTS.cpuModel());
    when(provider.collect()).thenReturn(FACTS, reordered);
    HardwareFingerprinter fingerprinter = new HardwareFingerprinter(provider);

    assertThat(fingerprinter.fingerprint()).isEqualTo(fingerprinter.fingerprint());
  }

  @Test
  void fingerprint_changesWithAnyFact() {
    HardwareFacts otherNic = new HardwareFacts(FACTS.platformUuid(), List.of("aa:bb:cc:00:11:23"), FACTS.cpuModel());
    HardwareFacts otherCpu = new HardwareFacts(FACTS.platformUuid(), FACTS.macAddresses(), "AMD Ryzen 7");
    HardwareFacts otherUuid = new HardwareFacts("different", FACTS.macAddresses(), FACTS.cpuModel());
    when(provider.collect()).thenReturn(FACTS, otherNic, otherCpu, otherUuid);
    HardwareFingerprinter fingerprinter = new HardwareFingerprinter(provider);

    FingerprintHash base = fingerprinter.fingerprint();

    assertThat(fingerprinter.fingerprint()).isNotEqualTo(base);
    assertThat(fingerprinter.fingerprint()).isNotEqualTo(base);
    assertThat(fingerprinter.fingerprint()).isNotEqualTo(base);
  }

  @Test
  void fingerprintHash_matchesExactly() {
    FingerprintHash hash = new FingerprintHash("0".repeat(64));

    assertThat(hash.matches("0".repeat(64))).isTrue();
    assertThat(hash.matches("0".repeat(63) + "1")).isFalse();
    assertThat(hash.matches(null)).isFalse();
  }

  @Test
  void hardwareFacts_toStringRedactsIdentifiers() {
    assertThat(FACTS.toString()).doesNotContain("4c4c4544").doesNotContain("aa:bb");
  }
}
