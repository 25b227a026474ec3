package com.codeheadsystems.warden.core.license;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.codeheadsystems.warden.core.common.RandomProvider;
import java.security.SecureRandom;
import java.util.Locale;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class LicenseKeyCodecTest {

  private static final int[] BODY_POSITIONS = {5, 6, 7, 8, 9, 11, 12, 13, 14, 15, 17, 18, 19, 20, 21};
  private static final RandomProvider RANDOM = new RandomProvider(new SecureRandom(new byte[]{42}));

  static Stream<Arguments> sampleKeys() {
    return Stream.of(Tier.values())
        .flatMap(tier -> Stream.of(
            Arguments.of(tier, "00000000000"),
            Arguments.of(tier, "ZZZZZZZZZZZ"),
            Arguments.of(tier, LicenseKeyCodec.randomSerial(RANDOM)),
            Arguments.of(tier, LicenseKeyCodec.randomSerial(RANDOM))));
  }

  @ParameterizedTest
  @EnumSource(Tier.class)
  void encode_hasExpectedShape(Tier tier) {
    String key = new LicenseKey(tier, "ABCDE12345F").toKeyString();

    assertThat(key).matches(tier.prefix() + "-ABCDE-12345-F[0-9A-Z]{4}");
  }

  @ParameterizedTest
  @MethodSource("sampleKeys")
  void decode_reversesEncode(Tier tier, String serial) {
    LicenseKey key = new LicenseKey(tier, serial);

    assertThat(LicenseKeyCodec.decode(key.toKeyString())).isEqualTo(key);
  }

  @Test
  void decode_normalizesCaseAndWhitespace() {
    LicenseKey key = new LicenseKey(Tier.GAMER, "7KQ2M9X0B4T");

    assertThat(LicenseKey.parse("  " + key.toKeyString().toLowerCase(Locale.ROOT) + "\n")).isEqualTo(key);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "BSIC", "BSIC-12345-12345", "BSIC-12345-12345-1234", "BSIC_12345_12345_12345",
      "BSIC-12345-12345-123456", "AEGIS-BSIC-12345-12345-12345"})
  void decode_wrongShape_isMalformed(String input) {
    assertReason(input, MalformedLicenseKeyException.Reason.MALFORMED);
  }

  @Test
  void decode_null_isMalformed() {
    assertReason(null, MalformedLicenseKeyException.Reason.MALFORMED);
  }

  @Test
  void decode_unknownPrefix_isMalformed() {
    String valid = new LicenseKey(Tier.BASIC, "00000000000").toKeyString();

    assertReason("FREE" + valid.substring(4), MalformedLicenseKeyException.Reason.MALFORMED);
  }

  @ParameterizedTest
  @ValueSource(chars = {'I', 'L', 'O', 'U'})
  void decode_characterOutsideAlphabet_isMalformed(char bad) {
    String valid = new LicenseKey(Tier.BASIC, "00000000000").toKeyString();

    assertReason(valid.substring(0, 5) + bad + valid.substring(6), MalformedLicenseKeyException.Reason.MALFORMED);
  }

  @ParameterizedTest
  @MethodSource("sampleKeys")
  void decode_everySingleSubstitution_isRejected(Tier tier, String serial) {
    char[] key = new LicenseKey(tier, serial).toKeyString().toCharArray();
    for (int pos : BODY_POSITIONS) {
      char original = key[pos];
      for (char replacement : LicenseKeyCodec.ALPHABET.toCharArray()) {
        if (replacement == original) {
          continue;
        }
        key[pos] = replacement;
        assertReason(new String(key), MalformedLicenseKeyException.Reason.CHECKSUM_MISMATCH);
      }
      key[pos] = original;
    }
  }

  @ParameterizedTest
  @MethodSource("sampleKeys")
  void decode_everyAdjacentTransposition_isRejected(Tier tier, String serial) {
    String original = new LicenseKey(tier, serial).toKeyString();
    String body = original.substring(5).replace("-", "");
    for (int i = 0; i + 1 < body.length(); i++) {
      if (body.charAt(i) == body.charAt(i + 1)) {
        continue;
      }
      char[] swapped = body.toCharArray();
      swapped[i] = body.charAt(i + 1);
      swapped[i + 1] = body.charAt(i);
      String candidate = tier.prefix() + "-" + new String(swapped, 0, 5) + "-"
          + new String(swapped, 5, 5) + "-" + new String(swapped, 10, 5);
      assertReason(candidate, MalformedLicenseKeyException.Reason.CHECKSUM_MISMATCH);
    }
  }

  @Test
  void checksum_knownValues() {
    assertThat(LicenseKeyCodec.checksum("BSIC", "00000000000")).isEqualTo("215M");
    assertThat(new LicenseKey(Tier.GAMER, "7KQ2M9X0B4T").toKeyString()).isEqualTo("GAME-7KQ2M-9X0B4-T4DQP");
  }

  @Test
  void randomSerial_usesAlphabetOnly() {
    for (int i = 0; i < 100; i++) {
      assertThat(LicenseKeyCodec.isValidSerial(LicenseKeyCodec.randomSerial(RANDOM))).isTrue();
    }
  }

  @Test
  void licenseKey_rejectsInvalidSerial() {
    assertThatThrownBy(() -> new LicenseKey(Tier.BASIC, "SHORT")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new LicenseKey(Tier.BASIC, "OOOOOOOOOOO")).isInstanceOf(IllegalArgumentException.class);
  }

  private static void assertReason(String input, MalformedLicenseKeyException.Reason reason) {
    MalformedLicenseKeyException e = catchThrowableOfType(() -> LicenseKeyCodec.decode(input),
        MalformedLicenseKeyException.class);
    assertThat(e).as("decode(%s)", input).isNotNull();
    assertThat(e.reason()).as("decode(%s)", input).isEqualTo(reason);
  }
}
