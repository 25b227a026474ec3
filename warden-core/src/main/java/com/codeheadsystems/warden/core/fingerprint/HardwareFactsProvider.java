package com.codeheadsystems.warden.core.fingerprint;

/**
 * Source of the machine identifiers a fingerprint is derived from.
 */
public interface HardwareFactsProvider {

  /**
   * Collects the identifiers of the current machine.
   *
   * @return the hardware facts
   */
  HardwareFacts collect();
}
