package dev.evidence.dsse;

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

import static dev.evidence.model.VerificationResult.ARTIFACTORY_KEY;
import static dev.evidence.model.VerificationResult.USER_PROVIDED_KEY;
import static java.lang.String.format;

import dev.evidence.InvalidEvidenceInputException;
import dev.evidence.KeyLoadingException;
import dev.evidence.model.DsseEnvelope;
import dev.evidence.model.DsseSignature;
import dev.evidence.model.EvidenceMetadata;
import dev.evidence.model.EvidenceVerification;
import dev.evidence.model.VerificationResult;
import dev.evidence.model.VerificationStatus;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies DSSE envelope signatures in two tiers: the keys configured locally first, then, when
 * allowed, the public key the repository stored alongside the evidence. The first key and
 * signature pair that verifies decides the key source and fingerprint.
 *
 * <p>Local keys are loaded on first use and kept for the lifetime of the instance. Instances are
 * not thread safe.
 */
public class DsseVerifier {

  private static final Logger logger = LoggerFactory.getLogger(DsseVerifier.class);

  private final List<Path> keyPaths;
  private final boolean useArtifactoryKeys;
  private final PublicKeyLoader keyLoader;

  private List<SignatureVerifier> localVerifiers;

  public DsseVerifier(List<Path> keyPaths, boolean useArtifactoryKeys) {
    this(keyPaths, useArtifactoryKeys, new PemPublicKeyLoader());
  }

  public DsseVerifier(List<Path> keyPaths, boolean useArtifactoryKeys, PublicKeyLoader keyLoader) {
    this.keyPaths = keyPaths == null ? Collections.emptyList() : List.copyOf(keyPaths);
    this.useArtifactoryKeys = useArtifactoryKeys;
    this.keyLoader = keyLoader;
  }

  public void verify(String subjectSha256, EvidenceMetadata evidence, EvidenceVerification verification)
      throws InvalidEvidenceInputException, KeyLoadingException {
    if (evidence == null || verification == null) {
      throw new InvalidEvidenceInputException("empty evidence or result provided for DSSE verification");
    }
    DsseEnvelope envelope = verification.getDsseEnvelope();
    if (envelope == null) {
      throw new InvalidEvidenceInputException(
          format("evidence %s does not carry a DSSE envelope", verification.getDownloadPath()));
    }
    VerificationResult result = verification.getVerificationResult();
    byte[] pae;
    try {
      pae = Pae.encode(envelope.payloadType(), envelope.decodedPayload());
    } catch (IllegalArgumentException e) {
      result.setSignaturesVerificationStatus(VerificationStatus.FAILED);
      result.setFailureReason("envelope payload is not valid base64: " + e.getMessage());
      return;
    }

    List<SignatureVerifier> local = localVerifiers();
    if (!local.isEmpty() && verifyEnvelope(local, envelope, pae, result)) {
      result.setKeySource(USER_PROVIDED_KEY);
      logger.debug(format("%s verified with a user provided key", verification.getDownloadPath()));
      return;
    }
    if (!useArtifactoryKeys) {
      result.setSignaturesVerificationStatus(VerificationStatus.FAILED);
      result.setFailureReason(local.isEmpty()
          ? "no user provided keys configured and Artifactory keys are disabled"
          : "no signature matched any user provided key");
      return;
    }
    List<SignatureVerifier> embedded = artifactoryVerifiers(evidence);
    if (verifyEnvelope(embedded, envelope, pae, result)) {
      result.setKeySource(ARTIFACTORY_KEY);
      logger.debug(format("%s verified with the Artifactory key", verification.getDownloadPath()));
      return;
    }
    result.setFailureReason(embedded.isEmpty() && local.isEmpty()
        ? "no public key available to verify the envelope signatures"
        : "no signature matched any available public key");
  }

  private List<SignatureVerifier> localVerifiers() throws KeyLoadingException {
    if (localVerifiers != null) {
      return localVerifiers;
    }
    List<SignatureVerifier> verifiers = new ArrayList<>();
    for (Path keyPath : keyPaths) {
      if (keyPath == null || keyPath.toString().isBlank()) {
        continue;
      }
      verifiers.add(new PublicKeySignatureVerifier(keyLoader.loadFromFile(keyPath)));
    }
    logger.debug(format("Loaded %d user provided key(s)", verifiers.size()));
    localVerifiers = Collections.unmodifiableList(verifiers);
    return localVerifiers;
  }

  private List<SignatureVerifier> artifactoryVerifiers(EvidenceMetadata evidence) throws KeyLoadingException {
    String pem = evidence.embeddedPublicKey();
    if (pem.isEmpty()) {
      return Collections.emptyList();
    }
    try {
      return List.of(new PublicKeySignatureVerifier(keyLoader.loadFromPem(pem)));
    } catch (KeyLoadingException e) {
      throw new KeyLoadingException(format("failed to load artifactory key: %s", e.getMessage()), e);
    }
  }

  /**
   * Tries every verifier against every signature, verifiers in order, and records the outcome on
   * {@code result}. Returns true on the first pair that verifies.
   */
  static boolean verifyEnvelope(List<SignatureVerifier> verifiers, DsseEnvelope envelope, byte[] pae,
      VerificationResult result) {
    for (SignatureVerifier verifier : verifiers) {
      for (DsseSignature signature : envelope.signatures()) {
        if (verifier.verify(pae, decode(signature))) {
          result.setSignaturesVerificationStatus(VerificationStatus.SUCCESS);
          result.setFailureReason(null);
          try {
            result.setKeyFingerprint(KeyFingerprints.sha256(verifier.publicKey()));
          } catch (IllegalArgumentException e) {
            logger.warn(format("Failed to generate fingerprint for the key: %s", e.getMessage()));
          }
          return true;
        }
      }
    }
    result.setSignaturesVerificationStatus(VerificationStatus.FAILED);
    return false;
  }

  private static byte[] decode(DsseSignature signature) {
    try {
      return signature.decodedSig();
    } catch (IllegalArgumentException e) {
      return new byte[0];
    }
  }
}
