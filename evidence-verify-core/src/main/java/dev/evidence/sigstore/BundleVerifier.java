package dev.evidence.sigstore;

import dev.evidence.InvalidBundleException;
import dev.evidence.model.SigstoreBundle;
import dev.evidence.model.SigstoreVerification;

/**
 * Verifies a Sigstore bundle against the digest of the artifact it claims to sign.
 */
public interface BundleVerifier {

  /**
   * @throws InvalidBundleException the bundle cannot be read at all
   * @throws BundleVerificationException the bundle was read but does not verify
   */
  SigstoreVerification verify(SigstoreBundle bundle, byte[] artifactDigest)
      throws InvalidBundleException, BundleVerificationException;
}
