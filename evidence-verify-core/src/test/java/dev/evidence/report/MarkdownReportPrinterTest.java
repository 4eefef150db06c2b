package dev.evidence.report;

import static dev.evidence.model.VerificationStatus.FAILED;
import static dev.evidence.model.VerificationStatus.SUCCESS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.evidence.InvalidEvidenceInputException;
import dev.evidence.VerificationFailedException;
import dev.evidence.model.EvidenceVerification;
import org.junit.Test;

public class MarkdownReportPrinterTest extends ReportPrinterTestSupport {

  @Test
  public void printsSummaryAndFullResults() throws Exception {
    assertThatThrownBy(() -> new MarkdownReportPrinter(out).print(response(FAILED,
        dsse("pred-1", SUCCESS, SUCCESS),
        sigstore("pred-2", SUCCESS, FAILED))))
        .isInstanceOf(VerificationFailedException.class);

    assertThat(output())
        .contains("**Subject:** test/path  ")
        .contains("**Overall verification status:** failed  ")
        .contains("## Evidence Verification Result Summary")
        .contains("| pred-1 | evidence.dsse | - | - | ✅ Verified | - |")
        .contains("| pred-2 | sigstore.bundle | - | - | ❌ Failed | - |")
        .contains("## Attestation Verification Full Results")
        .contains("| pred-1 | repo/.evidence/pred-1.json | - | - | " + EMPTY_SHA256 + " | success | success | - | - | - |");
  }

  @Test
  public void escapesTableSeparatorsInFailureReason() throws Exception {
    EvidenceVerification verification = dsse("pred-1", SUCCESS, FAILED);
    verification.getVerificationResult().setFailureReason("a|b");

    assertThatThrownBy(() -> new MarkdownReportPrinter(out).print(response(FAILED, verification)))
        .isInstanceOf(VerificationFailedException.class);
    assertThat(output()).contains("| ❌ Failed | a\\|b |");
  }

  @Test
  public void rejectsEmptyResponse() {
    assertThatThrownBy(() -> new MarkdownReportPrinter(out).print(null))
        .isInstanceOf(InvalidEvidenceInputException.class)
        .hasMessage("verification response is empty");
  }
}
