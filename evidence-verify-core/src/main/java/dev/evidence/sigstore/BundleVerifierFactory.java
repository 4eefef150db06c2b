package dev.evidence.sigstore;

import dev.evidence.TrustRootException;
import dev.sigstore.trustroot.SigstoreTrustedRoot;

@FunctionalInterface
public interface BundleVerifierFactory {

  BundleVerifier create(SigstoreTrustedRoot trustedRoot, BundleVerificationPolicy policy) throws TrustRootException;
}
