package com.codeheadsystems.warden.issuer.manager;

import com.codeheadsystems.warden.core.license.LicenseRecord;
import com.codeheadsystems.warden.model.LicenseFile;

/**
 * What the issuer hands back: the key string for the customer and the full signed record.
 *
 * @param licenseKey the key string
 * @param record     the signed record
 */
public record IssuedLicense(String licenseKey, LicenseRecord record) {

  /**
   * The license file to distribute beside the key string.
   *
   * @return the license file
   */
  public LicenseFile licenseFile() {
    return new LicenseFile(licenseKey, record.licenseSignature());
  }
}
