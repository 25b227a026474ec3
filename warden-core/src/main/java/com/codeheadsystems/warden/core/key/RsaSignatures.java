package com.codeheadsystems.warden.core.key;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;

/**
 * RSA PKCS#1 v1.5 signatures over SHA-256.
 */
public class RsaSignatures {

  /**
   * JCA algorithm name.
   */
  public static final String ALGORITHM = "SHA256withRSA";

  private RsaSignatures() {
  }

  /**
   * Signs the data.
   *
   * @param privateKey the private key
   * @param data       the data
   * @return the signature
   */
  public static byte[] sign(PrivateKey privateKey, byte[] data) {
    try {
      Signature signature = Signature.getInstance(ALGORITHM);
      signature.initSign(privateKey);
      signature.update(data);
      return signature.sign();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to sign with " + ALGORITHM, e);
    }
  }

  /**
   * Verifies a signature. Malformed signatures verify as false rather than throwing.
   *
   * @param publicKey the public key
   * @param data      the signed data
   * @param sig       the signature
   * @return true if the signature matches
   */
  public static boolean verify(PublicKey publicKey, byte[] data, byte[] sig) {
    if (sig == null || sig.length == 0) {
      return false;
    }
    try {
      Signature signature = Signature.getInstance(ALGORITHM);
      signature.initVerify(publicKey);
      signature.update(data);
      return signature.verify(sig);
    } catch (SignatureException | InvalidKeyException e) {
      return false;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to verify with " + ALGORITHM, e);
    }
  }
}
