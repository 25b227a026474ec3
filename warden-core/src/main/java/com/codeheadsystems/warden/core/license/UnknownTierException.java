package com.codeheadsystems.warden.core.license;

/**
 * Thrown when a tier name does not match any {@link Tier}.
 */
public class UnknownTierException extends IllegalArgumentException {

  private final String tierName;

  /**
   * Instantiates a new Unknown tier exception.
   *
   * @param tierName the tier name that was requested
   */
  public UnknownTierException(String tierName) {
    super("Unknown tier: " + tierName);
    this.tierName = tierName;
  }

  public String tierName() {
    return tierName;
  }
}
