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

import dev.evidence.model.EvidenceMetadata;
import dev.evidence.model.VerificationResponse;
import dev.evidence.parser.RemoteFileReader;
import dev.evidence.repository.ArtifactoryRemoteFileReader;
import dev.evidence.repository.EvidenceLocator;
import dev.evidence.repository.JsonFileEvidenceLocator;
import dev.evidence.sigstore.TrustRootProvider;
import dev.evidence.sigstore.TufTrustRootProvider;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * End to end verification of one subject: resolve its digest, locate its evidence, verify it and
 * print the report in the requested format.
 */
public class VerifyEvidenceCommand {

  private static final Logger logger = LoggerFactory.getLogger(VerifyEvidenceCommand.class);

  private final EvidenceVerificationRequest request;
  private final EvidenceLocator locator;
  private final RemoteFileReader remoteFileReader;
  private final TrustRootProvider trustRootProvider;
  private final PrintStream out;

  public VerifyEvidenceCommand(EvidenceVerificationRequest request, PrintStream out) {
    this(request,
        request.metadataFile() == null ? null : new JsonFileEvidenceLocator(request.metadataFile()),
        request.artifactoryUrl() == null ? null
            : new ArtifactoryRemoteFileReader(request.artifactoryUrl(), request.accessToken(), request.sslVerification()),
        new TufTrustRootProvider(request.trustRootCacheDir()),
        out);
  }

  public VerifyEvidenceCommand(EvidenceVerificationRequest request, EvidenceLocator locator,
      RemoteFileReader remoteFileReader, TrustRootProvider trustRootProvider, PrintStream out) {
    this.request = request;
    this.locator = locator;
    this.remoteFileReader = remoteFileReader;
    this.trustRootProvider = trustRootProvider;
    this.out = out;
  }

  public VerificationResponse execute() throws EvidenceVerificationException, VerificationFailedException {
    if (locator == null) {
      throw new InvalidEvidenceInputException("an evidence search response is required");
    }
    if (remoteFileReader == null) {
      throw new InvalidEvidenceInputException("an Artifactory url is required to download evidence");
    }
    String subjectSha256 = subjectSha256();
    List<EvidenceMetadata> evidence = locator.locate();
    logger.info(format("Verifying %d evidence for %s", evidence.size(),
        request.subjectPath() == null ? subjectSha256 : request.subjectPath()));

    EvidenceVerifier verifier = new EvidenceVerifier(request, remoteFileReader, trustRootProvider);
    VerificationResponse response = verifier.verify(subjectSha256, evidence, request.subjectPath());
    request.format().printer(out).print(response);
    return response;
  }

  String subjectSha256() throws InvalidEvidenceInputException {
    if (request.subjectSha256() != null && !request.subjectSha256().isBlank()) {
      return request.subjectSha256().trim();
    }
    if (request.subjectFile() == null) {
      throw new InvalidEvidenceInputException("subject sha256 or a local subject file is required");
    }
    try {
      return Checksums.sha256(request.subjectFile());
    } catch (IOException e) {
      throw new InvalidEvidenceInputException(format("failed to compute sha256 of %s", request.subjectFile()), e);
    }
  }
}
