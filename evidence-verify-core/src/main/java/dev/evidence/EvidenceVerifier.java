package dev.evidence;

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

import static java.lang.String.format;

import dev.evidence.dsse.DsseVerifier;
import dev.evidence.model.EvidenceContent;
import dev.evidence.model.EvidenceMetadata;
import dev.evidence.model.EvidenceVerification;
import dev.evidence.model.ImmutableSubject;
import dev.evidence.model.ImmutableVerificationResponse;
import dev.evidence.model.VerificationResponse;
import dev.evidence.model.VerificationStatus;
import dev.evidence.parser.EvidenceParser;
import dev.evidence.parser.RemoteFileReader;
import dev.evidence.sigstore.SigstoreVerifier;
import dev.evidence.sigstore.TrustRootProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies every evidence record attached to a subject and aggregates the outcome. The overall
 * status starts as success and turns failed as soon as one record does not verify.
 */
public class EvidenceVerifier {

  private static final Logger logger = LoggerFactory.getLogger(EvidenceVerifier.class);

  private final EvidenceParser parser;
  private final DsseVerifier dsseVerifier;
  private final SigstoreVerifier sigstoreVerifier;

  public EvidenceVerifier(EvidenceVerificationRequest request, RemoteFileReader remoteFileReader,
      TrustRootProvider trustRootProvider) {
    this(new EvidenceParser(remoteFileReader),
        new DsseVerifier(request.keys(), request.useArtifactoryKeys()),
        new SigstoreVerifier(trustRootProvider, request.bundleVerificationPolicy()));
  }

  public EvidenceVerifier(EvidenceParser parser, DsseVerifier dsseVerifier, SigstoreVerifier sigstoreVerifier) {
    this.parser = parser;
    this.dsseVerifier = dsseVerifier;
    this.sigstoreVerifier = sigstoreVerifier;
  }

  public VerificationResponse verify(String subjectSha256, List<EvidenceMetadata> evidence, String subjectPath)
      throws EvidenceVerificationException {
    return verify(subjectSha256, evidence, subjectPath, ProgressListener.NONE);
  }

  public VerificationResponse verify(String subjectSha256, List<EvidenceMetadata> evidence, String subjectPath,
      ProgressListener progress) throws EvidenceVerificationException {
    if (evidence == null || evidence.isEmpty()) {
      throw new NoEvidenceException("no evidence metadata provided");
    }
    fire(progress, listener -> listener.start(evidence.size()));

    VerificationStatus overall = VerificationStatus.SUCCESS;
    List<EvidenceVerification> verifications = new ArrayList<>(evidence.size());
    for (EvidenceMetadata record : evidence) {
      EvidenceVerification verification = verifyEvidence(subjectSha256, record);
      verifications.add(verification);
      if (!verification.isVerified()) {
        overall = VerificationStatus.FAILED;
      }
      fire(progress, ProgressListener::increment);
    }
    logger.info(format("Verification passed for %d out of %d evidence",
        verifications.stream().filter(EvidenceVerification::isVerified).count(), verifications.size()));

    return ImmutableVerificationResponse.builder()
        .subject(ImmutableSubject.builder().path(subjectPath).sha256(subjectSha256).build())
        .evidenceVerifications(verifications)
        .overallVerificationStatus(overall)
        .build();
  }

  private EvidenceVerification verifyEvidence(String subjectSha256, EvidenceMetadata record)
      throws EvidenceVerificationException {
    if (record == null) {
      throw new InvalidEvidenceInputException("nil evidence provided");
    }
    EvidenceVerification verification = EvidenceVerification.from(record);
    EvidenceContent content;
    try {
      content = parser.parseEvidence(record);
    } catch (EvidenceParseException e) {
      throw new EvidenceParseException(format("failed to read envelope: %s", e.getMessage()), e);
    }
    verification.setContent(content);
    verification.getVerificationResult()
        .setSha256VerificationStatus(Checksums.verify(subjectSha256, verification.getSubjectChecksum()));

    switch (content.mediaType()) {
      case SIMPLE_DSSE:
        dsseVerifier.verify(subjectSha256, record, verification);
        break;
      case SIGSTORE_BUNDLE:
        sigstoreVerifier.verify(subjectSha256, verification);
        break;
      default:
        throw new UnsupportedMediaTypeException(format("unsupported verification mode: %s", content.mediaType()));
    }
    return verification;
  }

  private static void fire(ProgressListener progress, Consumer<ProgressListener> event) {
    if (progress == null) {
      return;
    }
    try {
      event.accept(progress);
    } catch (RuntimeException e) {
      logger.warn("Progress listener failed: " + e.getMessage());
    }
  }
}
