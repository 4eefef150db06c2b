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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of the checks run against one evidence record. Only the status belonging to the
 * record's media type is meaningful: {@code signaturesVerificationStatus} for DSSE envelopes,
 * {@code sigstoreBundleVerificationStatus} for Sigstore bundles.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"sha256VerificationStatus", "signaturesVerificationStatus", "sigstoreBundleVerificationStatus",
    "keySource", "keyFingerprint", "failureReason", "sigstoreBundleVerificationResult"})
public class VerificationResult {

  public static final String USER_PROVIDED_KEY = "User Provided Key";
  public static final String ARTIFACTORY_KEY = "Artifactory Key";
  public static final String SIGSTORE_BUNDLE_KEY = "Sigstore Bundle Key";

  private VerificationStatus sha256VerificationStatus;
  private VerificationStatus signaturesVerificationStatus;
  private VerificationStatus sigstoreBundleVerificationStatus;
  private String keySource;
  private String keyFingerprint;
  private String failureReason;
  private SigstoreVerification sigstoreBundleVerificationResult;

  public VerificationStatus getSha256VerificationStatus() {
    return sha256VerificationStatus;
  }

  public void setSha256VerificationStatus(VerificationStatus sha256VerificationStatus) {
    this.sha256VerificationStatus = sha256VerificationStatus;
  }

  public VerificationStatus getSignaturesVerificationStatus() {
    return signaturesVerificationStatus;
  }

  public void setSignaturesVerificationStatus(VerificationStatus signaturesVerificationStatus) {
    this.signaturesVerificationStatus = signaturesVerificationStatus;
  }

  public VerificationStatus getSigstoreBundleVerificationStatus() {
    return sigstoreBundleVerificationStatus;
  }

  public void setSigstoreBundleVerificationStatus(VerificationStatus sigstoreBundleVerificationStatus) {
    this.sigstoreBundleVerificationStatus = sigstoreBundleVerificationStatus;
  }

  public String getKeySource() {
    return keySource;
  }

  public void setKeySource(String keySource) {
    this.keySource = keySource;
  }

  public String getKeyFingerprint() {
    return keyFingerprint;
  }

  public void setKeyFingerprint(String keyFingerprint) {
    this.keyFingerprint = keyFingerprint;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public void setFailureReason(String failureReason) {
    this.failureReason = failureReason;
  }

  public SigstoreVerification getSigstoreBundleVerificationResult() {
    return sigstoreBundleVerificationResult;
  }

  public void setSigstoreBundleVerificationResult(SigstoreVerification sigstoreBundleVerificationResult) {
    this.sigstoreBundleVerificationResult = sigstoreBundleVerificationResult;
  }
}
