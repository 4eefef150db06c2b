package dev.evidence.sigstore;

import dev.evidence.TrustRootException;
import dev.sigstore.trustroot.SigstoreTrustedRoot;

/**
 * Source of the Sigstore trust material (Fulcio CAs, Rekor and CT log keys, TSAs).
 */
@FunctionalInterface
public interface TrustRootProvider {

  SigstoreTrustedRoot loadTrustedRoot() throws TrustRootException;
}
