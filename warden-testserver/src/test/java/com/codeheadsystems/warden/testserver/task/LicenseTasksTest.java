package com.codeheadsystems.warden.testserver.task;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.warden.core.audit.AuditEntry;
import com.codeheadsystems.warden.core.audit.AuditEventType;
import com.codeheadsystems.warden.core.audit.AuditLogger;
import com.codeheadsystems.warden.core.audit.InMemoryAuditStore;
import com.codeheadsystems.warden.core.common.RandomProvider;
import com.codeheadsystems.warden.core.key.KeyManager;
import com.codeheadsystems.warden.core.key.KeyManagerConfig;
import com.codeheadsystems.warden.issuer.manager.LicenseIssuer;
import com.codeheadsystems.warden.issuer.manager.RevocationManager;
import com.codeheadsystems.warden.issuer.store.InMemoryIssuanceLedger;
import com.codeheadsystems.warden.issuer.store.InMemoryRevocationStore;
import com.codeheadsystems.warden.model.LicenseFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LicenseTasksTest {

  private static KeyManager keyManager;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private InMemoryAuditStore auditStore;
  private InMemoryRevocationStore revocationStore;
  private IssueLicenseTask issueTask;
  private RevokeLicenseTask revokeTask;
  private StringWriter buffer;

  @BeforeAll
  static void generateKey() {
    keyManager = new KeyManager(new KeyManagerConfig());
    keyManager.rotate();
  }

  @BeforeEach
  void setUp() {
    auditStore = new InMemoryAuditStore();
    revocationStore = new InMemoryRevocationStore();
    InMemoryIssuanceLedger ledger = new InMemoryIssuanceLedger();
    AuditLogger auditLogger = new AuditLogger(new byte[32], auditStore, Clock.systemUTC());
    issueTask = new IssueLicenseTask(
        new LicenseIssuer(keyManager, ledger, auditLogger, new RandomProvider(), Clock.systemUTC()), objectMapper);
    revokeTask = new RevokeLicenseTask(new RevocationManager(ledger, revocationStore, auditLogger, Clock.systemUTC()));
    buffer = new StringWriter();
  }

  private String[] issue(Map<String, List<String>> parameters) throws Exception {
    issueTask.execute(parameters, new PrintWriter(buffer, true));
    return buffer.toString().split("\\R", 2);
  }

  private String revoke(String serial) {
    StringWriter out = new StringWriter();
    revokeTask.execute(Map.of("serial", List.of(serial)), new PrintWriter(out, true));
    return out.toString().trim();
  }

  @Test
  void issue_printsKeyAndMatchingLicenseFile() throws Exception {
    String[] lines = issue(Map.of("tier", List.of("workplace"), "days", List.of("30")));

    assertThat(lines[0]).startsWith("WORK-");
    LicenseFile file = objectMapper.readValue(lines[1], LicenseFile.class);
    assertThat(file.licenseKey()).isEqualTo(lines[0]);
    assertThat(file.expiresAt()).isNotNull();
    assertThat(file.hardwareBinding()).isNull();
    assertThat(auditStore.entries()).extracting(AuditEntry::eventType).containsExactly(AuditEventType.ISSUED);
  }

  @Test
  void issue_perpetualWithBinding() throws Exception {
    String binding = "c".repeat(64);

    String[] lines = issue(Map.of("tier", List.of("server"), "days", List.of("perpetual"),
        "binding", List.of(binding)));

    LicenseFile file = objectMapper.readValue(lines[1], LicenseFile.class);
    assertThat(file.expiresAt()).isNull();
    assertThat(file.hardwareBinding()).isEqualTo(binding);
  }

  @Test
  void issue_missingTier_issuesNothing() throws Exception {
    issue(Map.of());

    assertThat(buffer.toString()).contains("Missing parameter: tier");
    assertThat(auditStore.entries()).isEmpty();
  }

  @Test
  void revoke_issuedSerial_thenAgain_isIdempotent() throws Exception {
    String key = issue(Map.of("tier", List.of("basic")))[0];
    String serial = key.substring(5).replace("-", "").substring(0, 11);

    assertThat(revoke(serial.toLowerCase(Locale.ROOT))).isEqualTo("revoked " + serial);
    assertThat(revoke(serial)).isEqualTo(serial + " was already revoked");

    assertThat(revocationStore.isRevoked(serial)).isTrue();
    assertThat(auditStore.entries()).extracting(AuditEntry::eventType)
        .containsExactly(AuditEventType.ISSUED, AuditEventType.REVOKED);
  }

  @Test
  void revoke_unknownSerial_reportsIt() {
    assertThat(revoke("ZZZZZZZZZZZ")).contains("Unknown serial");
    assertThat(auditStore.entries()).isEmpty();
  }

  @Test
  void revoke_missingSerial() {
    StringWriter out = new StringWriter();
    revokeTask.execute(Map.of("serial", List.of(" ")), new PrintWriter(out, true));

    assertThat(out.toString()).contains("Missing parameter: serial");
  }
}
