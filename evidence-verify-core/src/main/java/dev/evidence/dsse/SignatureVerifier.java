package dev.evidence.dsse;

import java.security.PublicKey;

/**
 * Checks a detached signature with one public key.
 */
public interface SignatureVerifier {

  PublicKey publicKey();

  /**
   * Returns true only when {@code signature} is a valid signature of {@code message}. A malformed
   * signature is reported as false, never thrown.
   */
  boolean verify(byte[] message, byte[] signature);
}
