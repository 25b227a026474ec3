package com.codeheadsystems.warden.core.audit;

/**
 * Outcome of re-verifying the audit chain.
 *
 * @param valid             true if every entry verified
 * @param firstInvalidIndex the first index that failed, -1 when valid
 * @param entriesChecked    the number of entries examined
 */
public record ChainVerification(boolean valid, long firstInvalidIndex, long entriesChecked) {

  public static ChainVerification ok(long entriesChecked) {
    return new ChainVerification(true, -1, entriesChecked);
  }

  public static ChainVerification brokenAt(long index, long entriesChecked) {
    return new ChainVerification(false, index, entriesChecked);
  }
}
