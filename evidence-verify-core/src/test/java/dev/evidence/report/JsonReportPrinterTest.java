package dev.evidence.report;

import static dev.evidence.model.VerificationStatus.SUCCESS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import dev.evidence.InvalidEvidenceInputException;
import dev.evidence.model.EvidenceVerification;
import org.junit.Test;

public class JsonReportPrinterTest extends ReportPrinterTestSupport {

  @Test
  public void printsResponseAsJson() throws Exception {
    EvidenceVerification dsse = dsse("pred-1", SUCCESS, SUCCESS);
    dsse.getVerificationResult().setKeySource("User Provided Key");

    new JsonReportPrinter(out).print(response(SUCCESS, dsse, sigstore("pred-2", SUCCESS, SUCCESS)));

    JsonNode json = mapper.readTree(output());
    assertThat(json.path("schemaVersion").asText()).isEqualTo("1.0");
    assertThat(json.path("subject").path("sha256").asText()).isEqualTo("test-checksum");
    assertThat(json.path("overallVerificationStatus").asText()).isEqualTo("success");
    assertThat(json.has("failed")).isFalse();

    JsonNode first = json.path("evidenceVerifications").path(0);
    assertThat(first.path("mediaType").asText()).isEqualTo("evidence.dsse");
    assertThat(first.path("evidenceSubjectSha256").asText()).isEqualTo(EMPTY_SHA256);
    assertThat(first.path("dsseEnvelope").path("payloadType").asText()).isEqualTo("application/vnd.in-toto+json");
    assertThat(first.path("verificationResult").path("keySource").asText()).isEqualTo("User Provided Key");
    assertThat(first.path("verificationResult").has("failureReason")).isFalse();
    assertThat(first.has("sigstoreBundle")).isFalse();

    JsonNode second = json.path("evidenceVerifications").path(1);
    assertThat(second.path("mediaType").asText()).isEqualTo("sigstore.bundle");
    assertThat(second.path("sigstoreBundle").path("mediaType").asText()).isEqualTo(BUNDLE_MEDIA_TYPE);
    assertThat(second.path("verificationResult").path("sigstoreBundleVerificationStatus").asText()).isEqualTo("success");
  }

  @Test
  public void rejectsEmptyResponse() {
    assertThatThrownBy(() -> new JsonReportPrinter(out).print(null))
        .isInstanceOf(InvalidEvidenceInputException.class)
        .hasMessage("verification response is empty");
  }
}
