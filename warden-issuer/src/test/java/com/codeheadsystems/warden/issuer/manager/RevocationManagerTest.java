package com.codeheadsystems.warden.issuer.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.warden.core.audit.AuditEvent;
import com.codeheadsystems.warden.core.audit.AuditEventType;
import com.codeheadsystems.warden.core.audit.AuditLogger;
import com.codeheadsystems.warden.core.license.LicenseRecord;
import com.codeheadsystems.warden.core.license.Tier;
import com.codeheadsystems.warden.issuer.store.IssuanceLedger;
import com.codeheadsystems.warden.issuer.store.InMemoryRevocationStore;
import com.codeheadsystems.warden.model.RevocationCheckResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RevocationManagerTest {

  private static final String SERIAL = "ABCDE12345F";
  private static final Instant NOW = Instant.parse("2026-07-04T00:00:00Z");
  private static final LicenseRecord RECORD =
      new LicenseRecord(Tier.GAMER, SERIAL, NOW.minusSeconds(3600), null, null, 1, new byte[]{1});

  @Mock private IssuanceLedger ledger;
  @Mock private AuditLogger auditLogger;

  private RevocationManager manager;

  @BeforeEach
  void setUp() {
    manager = new RevocationManager(ledger, new InMemoryRevocationStore(), auditLogger,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void revoke_issuedSerial_revokesAndAudits() {
    when(ledger.lookup(SERIAL)).thenReturn(Optional.of(RECORD));

    assertThat(manager.revoke(SERIAL)).isTrue();

    ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
    verify(auditLogger).append(event.capture());
    assertThat(event.getValue().type()).isEqualTo(AuditEventType.REVOKED);
    assertThat(event.getValue().subject()).isEqualTo(SERIAL);
    assertThat(manager.check(SERIAL).revoked()).isTrue();
  }

  @Test
  void revoke_twice_auditsOnce() {
    when(ledger.lookup(SERIAL)).thenReturn(Optional.of(RECORD));
    manager.revoke(SERIAL);

    assertThat(manager.revoke(SERIAL)).isFalse();
    verify(auditLogger).append(any());
  }

  @Test
  void revoke_unknownSerial_throws() {
    when(ledger.lookup(SERIAL)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> manager.revoke(SERIAL)).isInstanceOf(IllegalArgumentException.class);
    verify(auditLogger, never()).append(any());
  }

  @Test
  void check_notRevoked_reportsServerTime() {
    RevocationCheckResponse response = manager.check(SERIAL);

    assertThat(response.serial()).isEqualTo(SERIAL);
    assertThat(response.revoked()).isFalse();
    assertThat(response.serverInstant()).isEqualTo(NOW);
  }
}
