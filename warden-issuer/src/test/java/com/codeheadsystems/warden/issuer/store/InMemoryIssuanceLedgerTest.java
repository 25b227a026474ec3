package com.codeheadsystems.warden.issuer.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.core.license.LicenseRecord;
import com.codeheadsystems.warden.core.license.Tier;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryIssuanceLedgerTest {

  private static final String SERIAL = "ABCDE12345F";

  private InMemoryIssuanceLedger ledger;

  @BeforeEach
  void setUp() {
    ledger = new InMemoryIssuanceLedger();
  }

  @Test
  void reserve_secondReservationCollides() {
    assertThat(ledger.reserve(SERIAL)).isTrue();
    assertThat(ledger.reserve(SERIAL)).isFalse();
  }

  @Test
  void lookup_reservedButUnsigned_isEmpty() {
    ledger.reserve(SERIAL);

    assertThat(ledger.lookup(SERIAL)).isEmpty();
  }

  @Test
  void record_thenLookup_roundTrip() {
    LicenseRecord record = new LicenseRecord(Tier.BASIC, SERIAL, Instant.EPOCH, null, null, 1, new byte[]{1});
    ledger.reserve(SERIAL);
    ledger.record(record);

    assertThat(ledger.lookup(SERIAL)).contains(record);
  }

  @Test
  void record_withoutReservation_throws() {
    LicenseRecord record = new LicenseRecord(Tier.BASIC, SERIAL, Instant.EPOCH, null, null, 1, new byte[]{1});

    assertThatThrownBy(() -> ledger.record(record)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void reserve_concurrentCallersForSameSerial_exactlyOneWins() throws Exception {
    int threads = 16;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(() -> {
          start.await();
          return ledger.reserve(SERIAL);
        }));
      }
      start.countDown();
      int wins = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          wins++;
        }
      }
      assertThat(wins).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }
}
