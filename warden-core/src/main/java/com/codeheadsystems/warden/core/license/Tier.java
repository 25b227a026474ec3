package com.codeheadsystems.warden.core.license;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The closed set of product tiers. Each tier has the four-letter prefix used in license key
 * strings and the feature set it unlocks.
 */
public enum Tier {

  BASIC("BSIC", "basic", "Basic",
      "encrypted_storage", "secure_dns", "vpn_client", "password_manager", "anti_ransomware"),
  WORKPLACE("WORK", "workplace", "Workplace",
      "active_directory", "sso_support", "remote_desktop", "team_collaboration",
      "office_365_compatibility", "meeting_scheduler", "expense_tracker", "business_vpn"),
  GAMER("GAME", "gamer", "Gamer",
      "gaming_mode", "ray_tracing", "dlss3", "fsr3", "8k_upscaling", "rgb_ecosystem",
      "3ms_latency", "game_optimizer"),
  AI_DEVELOPER("AIDV", "ai-dev", "AI Developer",
      "cuda_12_3", "rocm", "intel_oneapi", "pytorch", "tensorflow", "jupyter_lab",
      "ml_libraries", "triton_server", "langchain", "vector_dbs"),
  GAMER_AI("GMAI", "gamer-ai", "Gamer + AI",
      "gaming_mode", "ray_tracing", "dlss3", "fsr3", "8k_upscaling", "rgb_ecosystem",
      "1ms_latency", "game_optimizer", "cuda_12_3", "pytorch", "tensorflow",
      "ml_gaming_optimization", "ai_upscaling"),
  SERVER("SERV", "server", "Server",
      "kubernetes", "docker_swarm", "high_availability", "auto_scaling", "disaster_recovery",
      "zero_trust", "multi_region", "100k_rps");

  private final String prefix;
  private final String slug;
  private final String displayName;
  private final Set<String> features;

  Tier(String prefix, String slug, String displayName, String... features) {
    this.prefix = prefix;
    this.slug = slug;
    this.displayName = displayName;
    this.features = Set.of(features);
  }

  /**
   * Looks up a tier by its key-string prefix.
   *
   * @param prefix the four-letter prefix, case-insensitive
   * @return the tier, empty for an unknown prefix
   */
  public static Optional<Tier> fromPrefix(String prefix) {
    if (prefix == null) {
      return Optional.empty();
    }
    String normalized = prefix.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values()).filter(t -> t.prefix.equals(normalized)).findFirst();
  }

  /**
   * Looks up a tier by enum name ({@code AI_DEVELOPER}) or product slug ({@code ai-dev}),
   * case-insensitive.
   *
   * @param name the name
   * @return the tier
   * @throws UnknownTierException if nothing matches
   */
  public static Tier fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new UnknownTierException(name);
    }
    String trimmed = name.trim();
    for (Tier tier : values()) {
      if (tier.name().equalsIgnoreCase(trimmed.replace('-', '_')) || tier.slug.equalsIgnoreCase(trimmed)) {
        return tier;
      }
    }
    throw new UnknownTierException(name);
  }

  public String prefix() {
    return prefix;
  }

  public String slug() {
    return slug;
  }

  public String displayName() {
    return displayName;
  }

  public Set<String> features() {
    return features;
  }

  public boolean hasFeature(String feature) {
    return features.contains(feature);
  }
}
