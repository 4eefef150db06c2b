package dev.evidence.model;

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

import static dev.evidence.model.VerificationStatus.SUCCESS;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Per-evidence accumulator filled in by the parser and the verifiers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"mediaType", "downloadPath", "evidenceSubjectSha256", "predicateType", "createdBy", "createdAt",
    "dsseEnvelope", "sigstoreBundle", "verificationResult"})
public class EvidenceVerification {

  private String downloadPath;
  private String subjectChecksum;
  private String predicateType;
  private String createdBy;
  private String createdAt;
  private EvidenceContent content;
  private final VerificationResult verificationResult = new VerificationResult();

  public EvidenceVerification() {
  }

  /**
   * Result shell for a record, before parsing.
   */
  public static EvidenceVerification from(EvidenceMetadata metadata) {
    EvidenceVerification verification = new EvidenceVerification();
    verification.setDownloadPath(metadata.downloadPath());
    verification.setSubjectChecksum(metadata.subjectSha256());
    verification.setPredicateType(metadata.predicateType());
    verification.setCreatedBy(metadata.createdBy());
    verification.setCreatedAt(metadata.createdAt());
    return verification;
  }

  public String getDownloadPath() {
    return downloadPath;
  }

  public void setDownloadPath(String downloadPath) {
    this.downloadPath = downloadPath;
  }

  @JsonProperty("evidenceSubjectSha256")
  public String getSubjectChecksum() {
    return subjectChecksum;
  }

  public void setSubjectChecksum(String subjectChecksum) {
    this.subjectChecksum = subjectChecksum;
  }

  public String getPredicateType() {
    return predicateType;
  }

  public void setPredicateType(String predicateType) {
    this.predicateType = predicateType;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public void setCreatedBy(String createdBy) {
    this.createdBy = createdBy;
  }

  public String getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(String createdAt) {
    this.createdAt = createdAt;
  }

  @JsonIgnore
  public EvidenceContent getContent() {
    return content;
  }

  public void setContent(EvidenceContent content) {
    this.content = content;
  }

  public MediaType getMediaType() {
    return content == null ? null : content.mediaType();
  }

  public DsseEnvelope getDsseEnvelope() {
    return content == null ? null : content.dsseEnvelope().orElse(null);
  }

  public SigstoreBundle getSigstoreBundle() {
    return content == null ? null : content.sigstoreBundle().orElse(null);
  }

  public VerificationResult getVerificationResult() {
    return verificationResult;
  }

  /**
   * Effective status: the subject checksum matched and the check belonging to this record's media
   * type succeeded. Anything unset counts as a failure.
   */
  @JsonIgnore
  public boolean isVerified() {
    if (verificationResult.getSha256VerificationStatus() != SUCCESS || content == null) {
      return false;
    }
    switch (content.mediaType()) {
      case SIMPLE_DSSE:
        return verificationResult.getSignaturesVerificationStatus() == SUCCESS;
      case SIGSTORE_BUNDLE:
        return verificationResult.getSigstoreBundleVerificationStatus() == SUCCESS;
      default:
        return false;
    }
  }
}
