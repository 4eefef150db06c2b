package dev.evidence.report;

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

import dev.evidence.model.EvidenceVerification;
import dev.evidence.model.MediaType;
import dev.evidence.model.SigstoreVerification;
import dev.evidence.model.VerificationResponse;
import dev.evidence.model.VerificationResult;
import java.io.PrintStream;
import java.util.List;

public class PlaintextReportPrinter extends ReportPrinterSupport {

  public PlaintextReportPrinter(PrintStream out) {
    super(out);
  }

  @Override
  protected void write(VerificationResponse response) {
    List<EvidenceVerification> verifications = response.evidenceVerifications();
    out.printf("Subject sha256:        %s%n", response.subject().sha256());
    out.printf("Subject:               %s%n", orDash(response.subject().path()));
    out.printf("Loaded %d evidence%n", verifications.size());
    out.println();
    out.printf("Verification passed for %d out of %d evidence%n", response.verifiedCount(), verifications.size());
    out.println();
    for (int i = 0; i < verifications.size(); i++) {
      writeEvidence(verifications.get(i), i + 1);
    }
  }

  private void writeEvidence(EvidenceVerification verification, int number) {
    VerificationResult result = verification.getVerificationResult();
    out.printf("- Evidence %d:%n", number);
    line("Media type", verification.getMediaType());
    line("Predicate type", verification.getPredicateType());
    line("Evidence subject sha256", verification.getSubjectChecksum());
    if (result.getKeySource() != null) {
      line("Key source", result.getKeySource());
    }
    if (result.getKeyFingerprint() != null) {
      line("Key fingerprint", result.getKeyFingerprint());
    }
    line("Sha256 verification status", status(result.getSha256VerificationStatus()));
    if (verification.getMediaType() == MediaType.SIMPLE_DSSE) {
      line("Signatures verification status", status(result.getSignaturesVerificationStatus()));
    }
    if (verification.getMediaType() == MediaType.SIGSTORE_BUNDLE) {
      line("Sigstore verification status", status(result.getSigstoreBundleVerificationStatus()));
      SigstoreVerification sigstore = result.getSigstoreBundleVerificationResult();
      if (sigstore != null && sigstore.signingIdentity() != null) {
        line("Signer identity", sigstore.signingIdentity());
      }
      if (sigstore != null && sigstore.logIndex() != null) {
        line("Transparency log index", sigstore.logIndex());
      }
    }
    if (result.getFailureReason() != null) {
      line("Failure reason", result.getFailureReason());
    }
  }

  // values line up in one column
  private void line(String label, Object value) {
    out.printf("    - %-31s %s%n", label + ":", value);
  }
}
