package com.codeheadsystems.warden.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.warden.core.license.ValidityWindow;
import com.codeheadsystems.warden.dropwizard.health.AuditChainHealthCheck;
import com.codeheadsystems.warden.dropwizard.health.KeyRingHealthCheck;
import com.codeheadsystems.warden.issuer.manager.IssuedLicense;
import com.codeheadsystems.warden.issuer.resource.PublicKeyResource;
import com.codeheadsystems.warden.issuer.resource.RevocationResource;
import com.codeheadsystems.warden.issuer.store.InMemoryIssuanceLedger;
import com.codeheadsystems.warden.issuer.store.InMemoryRevocationStore;
import io.dropwizard.core.setup.Environment;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WardenBundleTest {

  private static final String AUDIT_KEY_HEX = "11".repeat(32);

  @TempDir Path tempDir;

  @Mock(answer = Answers.RETURNS_DEEP_STUBS) private Environment environment;

  private WardenConfiguration configuration;

  @BeforeEach
  void setUp() {
    configuration = new WardenConfiguration();
    configuration.setAuditKeyHex(AUDIT_KEY_HEX);
  }

  private WardenBundle<WardenConfiguration> bundle() {
    return new WardenBundle<>(new InMemoryIssuanceLedger(), new InMemoryRevocationStore());
  }

  @Test
  void accessors_beforeRun_throw() {
    WardenBundle<WardenConfiguration> bundle = bundle();

    assertThatThrownBy(bundle::licenseIssuer)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not been run");
  }

  @Test
  void run_registersResourcesAndHealthChecks() {
    bundle().run(configuration, environment);

    verify(environment.jersey()).register(isA(RevocationResource.class));
    verify(environment.jersey()).register(isA(PublicKeyResource.class));
    verify(environment.healthChecks()).register(eq("key-ring"), isA(KeyRingHealthCheck.class));
    verify(environment.healthChecks()).register(eq("audit-chain"), isA(AuditChainHealthCheck.class));
  }

  @Test
  void run_emptyKeyDirectory_generatesAndSavesVersionOne() {
    Path keys = tempDir.resolve("keys");
    configuration.setKeyDirectory(keys.toString());

    WardenBundle<WardenConfiguration> bundle = bundle();
    bundle.run(configuration, environment);

    assertThat(bundle.keyManager().current().keyVersion()).isEqualTo(1);
    assertThat(keys.resolve("v1-private.pem")).exists();
    assertThat(keys.resolve("v1-public.pem")).exists();
  }

  @Test
  void run_existingKeys_areReloaded() {
    configuration.setKeyDirectory(tempDir.toString());
    WardenBundle<WardenConfiguration> first = bundle();
    first.run(configuration, environment);

    WardenBundle<WardenConfiguration> second = bundle();
    second.run(configuration, environment);

    assertThat(second.keyManager().current().publicKey().getModulus())
        .isEqualTo(first.keyManager().current().publicKey().getModulus());
  }

  @Test
  void run_noKeysAndGenerationDisabled_throws() {
    configuration.setKeyDirectory(tempDir.toString());
    configuration.setGenerateKeyIfMissing(false);

    assertThatThrownBy(() -> bundle().run(configuration, environment))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("generateKeyIfMissing");
  }

  @Test
  void run_shortAuditKey_throws() {
    configuration.setAuditKeyHex("abcd");

    assertThatThrownBy(() -> bundle().run(configuration, environment))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("at least 32 bytes");
  }

  @Test
  void run_nonHexAuditKey_throws() {
    configuration.setAuditKeyHex("zz".repeat(32));

    assertThatThrownBy(() -> bundle().run(configuration, environment))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not valid hex");
  }

  @Test
  void run_fileAuditLog_recordsIssuance() throws Exception {
    Path auditLog = tempDir.resolve("audit").resolve("audit.jsonl");
    configuration.setAuditLogPath(auditLog.toString());
    WardenBundle<WardenConfiguration> bundle = bundle();
    bundle.run(configuration, environment);

    IssuedLicense issued = bundle.licenseIssuer().issue("workplace", ValidityWindow.ofDays(90), Optional.empty());

    List<String> lines = Files.readAllLines(auditLog, StandardCharsets.UTF_8);
    assertThat(lines).hasSize(1);
    assertThat(lines.get(0)).contains("ISSUED").contains(issued.record().serial());
    assertThat(bundle.auditLogger().verifyChain().valid()).isTrue();
  }

  @Test
  void run_revocation_isVisibleThroughManager() {
    WardenBundle<WardenConfiguration> bundle = bundle();
    bundle.run(configuration, environment);
    IssuedLicense issued = bundle.licenseIssuer().issue("basic", ValidityWindow.perpetual(), Optional.empty());

    bundle.revocationManager().revoke(issued.record().serial());

    assertThat(bundle.revocationManager().check(issued.record().serial()).revoked()).isTrue();
  }
}
