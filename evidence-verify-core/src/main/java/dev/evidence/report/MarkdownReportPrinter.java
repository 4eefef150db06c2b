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
import dev.evidence.model.SigstoreVerification;
import dev.evidence.model.VerificationResponse;
import dev.evidence.model.VerificationResult;
import java.io.PrintStream;

/**
 * GitHub flavoured Markdown: a summary table followed by every check of every evidence.
 */
public class MarkdownReportPrinter extends ReportPrinterSupport {

  public MarkdownReportPrinter(PrintStream out) {
    super(out);
  }

  @Override
  protected void write(VerificationResponse response) {
    int total = response.evidenceVerifications().size();
    long verified = response.verifiedCount();

    out.println("# Evidence Verification Result");
    out.println();
    out.printf("**Subject:** %s  %n", orDash(response.subject().path()));
    out.printf("**Subject sha256:** %s  %n", response.subject().sha256());
    out.printf("**Total loaded evidence:** %d  %n", total);
    out.printf("**Successful verifications:** %d  %n", verified);
    out.printf("**Failed verifications:** %d  %n", total - verified);
    out.printf("**Overall verification status:** %s  %n", response.overallVerificationStatus());
    out.println();

    out.println("## Evidence Verification Result Summary");
    out.println();
    out.println("| Predicate type | Media type | Key source | Key fingerprint | Verification status | Failure reason |");
    out.println("|-|-|-|-|-|-|");
    for (EvidenceVerification verification : response.evidenceVerifications()) {
      VerificationResult result = verification.getVerificationResult();
      out.printf("| %s | %s | %s | %s | %s | %s |%n",
          orDash(verification.getPredicateType()),
          orDash(verification.getMediaType()),
          orDash(result.getKeySource()),
          orDash(result.getKeyFingerprint()),
          verification.isVerified() ? "✅ Verified" : "❌ Failed",
          orDash(escape(result.getFailureReason())));
    }
    out.println();

    out.println("## Attestation Verification Full Results");
    out.println();
    out.println("| Predicate type | Download path | Created by | Created at | Evidence subject sha256 | Sha256 status "
        + "| Signatures status | Sigstore status | Signer identity | Log index |");
    out.println("|-|-|-|-|-|-|-|-|-|-|");
    for (EvidenceVerification verification : response.evidenceVerifications()) {
      VerificationResult result = verification.getVerificationResult();
      SigstoreVerification sigstore = result.getSigstoreBundleVerificationResult();
      out.printf("| %s | %s | %s | %s | %s | %s | %s | %s | %s | %s |%n",
          orDash(verification.getPredicateType()),
          orDash(verification.getDownloadPath()),
          orDash(verification.getCreatedBy()),
          orDash(verification.getCreatedAt()),
          orDash(verification.getSubjectChecksum()),
          orDash(result.getSha256VerificationStatus()),
          orDash(result.getSignaturesVerificationStatus()),
          orDash(result.getSigstoreBundleVerificationStatus()),
          orDash(sigstore == null ? null : sigstore.signingIdentity()),
          orDash(sigstore == null ? null : sigstore.logIndex()));
    }
    out.println();
  }

  private static String escape(String cell) {
    return cell == null ? null : cell.replace("|", "\\|").replace('\n', ' ');
  }
}
