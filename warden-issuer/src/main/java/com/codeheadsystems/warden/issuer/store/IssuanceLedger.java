package com.codeheadsystems.warden.issuer.store;

import com.codeheadsystems.warden.core.license.LicenseRecord;
import java.util.Optional;

/**
 * Record of every serial the issuer has handed out.
 * <p>
 * Implementations must be thread-safe, and {@link #reserve(String)} must be atomic: two
 * concurrent reservations of the same serial cannot both succeed.
 */
public interface IssuanceLedger {

  /**
   * Claims a serial for a license about to be signed.
   *
   * @param serial the serial
   * @return true if the serial was free and is now reserved, false on collision
   */
  boolean reserve(String serial);

  /**
   * Stores the signed record for a previously reserved serial.
   *
   * @param record the record
   * @throws IllegalStateException if the serial was never reserved
   */
  void record(LicenseRecord record);

  /**
   * Looks up an issued license.
   *
   * @param serial the serial
   * @return the record, empty if the serial is unknown or only reserved
   */
  Optional<LicenseRecord> lookup(String serial);
}
