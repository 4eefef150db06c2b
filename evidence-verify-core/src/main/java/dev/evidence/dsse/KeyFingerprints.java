package dev.evidence.dsse;

import static java.lang.String.format;

import dev.evidence.Checksums;
import java.security.PublicKey;

public final class KeyFingerprints {

  private KeyFingerprints() {
  }

  /**
   * Lowercase hex SHA-256 of the DER encoded SubjectPublicKeyInfo.
   */
  public static String sha256(PublicKey key) {
    byte[] der = key.getEncoded();
    if (der == null) {
      throw new IllegalArgumentException(format("key %s has no DER encoding", key.getAlgorithm()));
    }
    return Checksums.sha256(der);
  }
}
