package dev.evidence.sigstore;

//
// Copyright 2021 The Sigstore Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

import static dev.evidence.model.VerificationResult.SIGSTORE_BUNDLE_KEY;
import static java.lang.String.format;

import dev.evidence.InvalidBundleException;
import dev.evidence.InvalidEvidenceInputException;
import dev.evidence.TrustRootException;
import dev.evidence.model.EvidenceVerification;
import dev.evidence.model.SigstoreBundle;
import dev.evidence.model.SigstoreVerification;
import dev.evidence.model.VerificationResult;
import dev.evidence.model.VerificationStatus;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies Sigstore bundle evidence. The trusted root is fetched on first use and reused for every
 * later bundle checked by this instance.
 */
public class SigstoreVerifier {

  private static final Logger logger = LoggerFactory.getLogger(SigstoreVerifier.class);

  private final TrustRootProvider trustRootProvider;
  private final BundleVerificationPolicy policy;
  private final BundleVerifierFactory verifierFactory;

  private BundleVerifier bundleVerifier;

  public SigstoreVerifier(TrustRootProvider trustRootProvider, BundleVerificationPolicy policy) {
    this(trustRootProvider, policy, KeylessBundleVerifier::create);
  }

  public SigstoreVerifier(TrustRootProvider trustRootProvider, BundleVerificationPolicy policy,
      BundleVerifierFactory verifierFactory) {
    this.trustRootProvider = trustRootProvider;
    this.policy = policy;
    this.verifierFactory = verifierFactory;
  }

  public void verify(String subjectSha256, EvidenceVerification verification)
      throws InvalidEvidenceInputException, TrustRootException, InvalidBundleException {
    if (verification == null || verification.getSigstoreBundle() == null) {
      throw new InvalidEvidenceInputException("empty evidence verification or Sigstore bundle provided for verification");
    }
    SigstoreBundle bundle = verification.getSigstoreBundle();
    BundleVerifier verifier = bundleVerifier();
    byte[] digest = decodeDigest(subjectSha256);

    VerificationResult result = verification.getVerificationResult();
    try {
      SigstoreVerification details = verifier.verify(bundle, digest);
      result.setSigstoreBundleVerificationStatus(VerificationStatus.SUCCESS);
      result.setKeySource(SIGSTORE_BUNDLE_KEY);
      result.setSigstoreBundleVerificationResult(details);
      logger.debug(format("%s verified, signed by %s", verification.getDownloadPath(), details.signingIdentity()));
    } catch (BundleVerificationException e) {
      logger.debug(format("%s rejected: %s", verification.getDownloadPath(), e.getMessage()));
      result.setSigstoreBundleVerificationStatus(VerificationStatus.FAILED);
      result.setFailureReason(e.getMessage());
    }
  }

  private BundleVerifier bundleVerifier() throws TrustRootException {
    if (bundleVerifier == null) {
      bundleVerifier = verifierFactory.create(trustRootProvider.loadTrustedRoot(), policy);
    }
    return bundleVerifier;
  }

  static byte[] decodeDigest(String subjectSha256) throws InvalidEvidenceInputException {
    if (subjectSha256 == null || subjectSha256.length() % 2 != 0 || !subjectSha256.matches("[0-9a-fA-F]*")) {
      throw new InvalidEvidenceInputException(format("invalid hex digest: %s", subjectSha256));
    }
    return Hex.decode(subjectSha256);
  }
}
