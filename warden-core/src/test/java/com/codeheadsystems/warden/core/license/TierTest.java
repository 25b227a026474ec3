package com.codeheadsystems.warden.core.license;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TierTest {

  @ParameterizedTest
  @CsvSource({
      "basic, BASIC",
      "BASIC, BASIC",
      "workplace, WORKPLACE",
      "gamer, GAMER",
      "ai-dev, AI_DEVELOPER",
      "ai_developer, AI_DEVELOPER",
      "gamer-ai, GAMER_AI",
      "' Server ', SERVER"
  })
  void fromName_acceptsEnumNamesAndSlugs(String name, Tier expected) {
    assertThat(Tier.fromName(name)).isEqualTo(expected);
  }

  @Test
  void fromName_unknown_throwsUnknownTier() {
    assertThatThrownBy(() -> Tier.fromName("freemium"))
        .isInstanceOf(UnknownTierException.class)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown tier: freemium");
  }

  @Test
  void fromName_blank_throwsUnknownTier() {
    assertThatThrownBy(() -> Tier.fromName(" ")).isInstanceOf(UnknownTierException.class);
  }

  @Test
  void fromPrefix_roundTripsEveryTier() {
    for (Tier tier : Tier.values()) {
      assertThat(Tier.fromPrefix(tier.prefix())).contains(tier);
    }
    assertThat(Tier.fromPrefix("gmai")).contains(Tier.GAMER_AI);
    assertThat(Tier.fromPrefix("FREE")).isEmpty();
  }

  @Test
  void prefixes_areFourLettersAndUnique() {
    assertThat(Arrays.stream(Tier.values()).map(Tier::prefix))
        .allMatch(p -> p.matches("[A-Z]{4}"))
        .doesNotHaveDuplicates();
  }

  @Test
  void features_matchTierEntitlements() {
    assertThat(Tier.BASIC.hasFeature("vpn_client")).isTrue();
    assertThat(Tier.BASIC.hasFeature("gaming_mode")).isFalse();
    assertThat(Tier.GAMER_AI.features()).contains("gaming_mode", "pytorch");
    assertThat(Tier.SERVER.displayName()).isEqualTo("Server");
  }
}
