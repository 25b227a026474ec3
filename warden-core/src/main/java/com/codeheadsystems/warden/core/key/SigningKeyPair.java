package com.codeheadsystems.warden.core.key;

import java.security.KeyPair;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;

/**
 * One generation of the issuing authority's RSA key pair.
 *
 * @param keyVersion the monotonically increasing version of this key
 * @param keyPair    the RSA key pair; the private half never leaves the issuer
 */
public record SigningKeyPair(int keyVersion, KeyPair keyPair) {

  public SigningKeyPair {
    if (keyVersion < 1) {
      throw new IllegalArgumentException("Key version must be positive: " + keyVersion);
    }
    if (!(keyPair.getPublic() instanceof RSAPublicKey)
        || !(keyPair.getPrivate() instanceof RSAPrivateKey)) {
      throw new IllegalArgumentException("Signing keys must be RSA");
    }
  }

  public RSAPublicKey publicKey() {
    return (RSAPublicKey) keyPair.getPublic();
  }

  public RSAPrivateKey privateKey() {
    return (RSAPrivateKey) keyPair.getPrivate();
  }

  /**
   * Signs the data with this version's private key.
   *
   * @param data the data
   * @return the signature
   */
  public byte[] sign(byte[] data) {
    return RsaSignatures.sign(keyPair.getPrivate(), data);
  }

  @Override
  public String toString() {
    return "SigningKeyPair[keyVersion=" + keyVersion
        + ", modulusBits=" + publicKey().getModulus().bitLength() + "]";
  }
}
