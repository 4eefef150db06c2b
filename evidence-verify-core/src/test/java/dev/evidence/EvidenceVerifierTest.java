package dev.evidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.evidence.dsse.DsseVerifier;
import dev.evidence.model.EvidenceVerification;
import dev.evidence.model.ImmutableSigstoreVerification;
import dev.evidence.model.MediaType;
import dev.evidence.model.VerificationResponse;
import dev.evidence.model.VerificationResult;
import dev.evidence.model.VerificationStatus;
import dev.evidence.parser.EvidenceParser;
import dev.evidence.sigstore.BundleVerificationException;
import dev.evidence.sigstore.BundleVerificationPolicy;
import dev.evidence.sigstore.BundleVerifier;
import dev.evidence.sigstore.SigstoreVerifier;
import dev.sigstore.trustroot.SigstoreTrustedRoot;
import java.nio.file.Path;
import java.security.KeyPair;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class EvidenceVerifierTest extends EvidenceTestSupport {

  private KeyPair signer;
  private Path signerKey;
  private InMemoryRemoteFileReader repository;

  @Before
  public void setUp() throws Exception {
    signer = ecKeyPair();
    signerKey = writePem("signer.pub", signer.getPublic());
    repository = new InMemoryRemoteFileReader()
        .put("repo/dsse.json", envelopeJson(statement(EMPTY_SHA256), signer.getPrivate()))
        .put("repo/bundle.json", mapper.writeValueAsBytes(bundle(signingCertificate(ecKeyPair(), 1), 1, 0)));
  }

  @Test
  public void verifiesSignedEnvelopeForMatchingSubject() throws Exception {
    VerificationResponse response = verifier(passingBundles())
        .verify(EMPTY_SHA256, List.of(metadata("repo/dsse.json", EMPTY_SHA256)), "repo/app.jar");

    assertThat(response.schemaVersion()).isEqualTo(VerificationResponse.SCHEMA_VERSION);
    assertThat(response.subject().path()).isEqualTo("repo/app.jar");
    assertThat(response.subject().sha256()).isEqualTo(EMPTY_SHA256);
    assertThat(response.overallVerificationStatus()).isEqualTo(VerificationStatus.SUCCESS);
    EvidenceVerification verification = response.evidenceVerifications().get(0);
    assertThat(verification.getMediaType()).isEqualTo(MediaType.SIMPLE_DSSE);
    assertThat(verification.getVerificationResult().getSha256VerificationStatus()).isEqualTo(VerificationStatus.SUCCESS);
    assertThat(verification.getVerificationResult().getSignaturesVerificationStatus()).isEqualTo(VerificationStatus.SUCCESS);
    assertThat(verification.getVerificationResult().getSigstoreBundleVerificationStatus()).isNull();
    assertThat(verification.getPredicateType()).isEqualTo("https://slsa.dev/provenance/v1");
  }

  @Test
  public void subjectMismatchFailsOverall() throws Exception {
    VerificationResponse response = verifier(passingBundles())
        .verify(EMPTY_SHA256, List.of(metadata("repo/dsse.json", OTHER_SHA256)), "repo/app.jar");

    EvidenceVerification verification = response.evidenceVerifications().get(0);
    assertThat(verification.getVerificationResult().getSha256VerificationStatus()).isEqualTo(VerificationStatus.FAILED);
    assertThat(verification.getVerificationResult().getSignaturesVerificationStatus()).isEqualTo(VerificationStatus.SUCCESS);
    assertThat(response.overallVerificationStatus()).isEqualTo(VerificationStatus.FAILED);
    assertThat(response.verifiedCount()).isZero();
  }

  @Test
  public void oneFailedRecordFailsTheBatch() throws Exception {
    repository.put("repo/forged.json", envelopeJson(statement(EMPTY_SHA256), ecKeyPair().getPrivate()));

    VerificationResponse response = verifier(passingBundles()).verify(EMPTY_SHA256, List.of(
        metadata("repo/dsse.json", EMPTY_SHA256),
        metadata("repo/forged.json", EMPTY_SHA256),
        metadata("repo/bundle.json", EMPTY_SHA256)), null);

    assertThat(response.evidenceVerifications()).extracting(EvidenceVerification::getDownloadPath)
        .containsExactly("repo/dsse.json", "repo/forged.json", "repo/bundle.json");
    assertThat(response.evidenceVerifications()).extracting(EvidenceVerification::isVerified)
        .containsExactly(true, false, true);
    assertThat(response.overallVerificationStatus()).isEqualTo(VerificationStatus.FAILED);
    assertThat(response.verifiedCount()).isEqualTo(2);
  }

  @Test
  public void sigstoreRecordsUseOnlyTheBundleStatus() throws Exception {
    VerificationResponse response = verifier(passingBundles())
        .verify(EMPTY_SHA256, List.of(metadata("repo/bundle.json", EMPTY_SHA256)), "repo/app.jar");

    EvidenceVerification verification = response.evidenceVerifications().get(0);
    assertThat(verification.getMediaType()).isEqualTo(MediaType.SIGSTORE_BUNDLE);
    assertThat(verification.getVerificationResult().getSigstoreBundleVerificationStatus()).isEqualTo(VerificationStatus.SUCCESS);
    assertThat(verification.getVerificationResult().getSignaturesVerificationStatus()).isNull();
    assertThat(response.overallVerificationStatus()).isEqualTo(VerificationStatus.SUCCESS);
  }

  @Test
  public void rejectedBundleFailsOverall() throws Exception {
    BundleVerifier rejecting = (bundle, digest) -> {
      throw new BundleVerificationException("signature does not match");
    };

    VerificationResponse response = verifier(rejecting)
        .verify(EMPTY_SHA256, List.of(metadata("repo/bundle.json", EMPTY_SHA256)), "repo/app.jar");

    assertThat(response.overallVerificationStatus()).isEqualTo(VerificationStatus.FAILED);
    assertThat(response.evidenceVerifications().get(0).getVerificationResult().getFailureReason())
        .isEqualTo("signature does not match");
  }

  @Test
  public void verifiesSigstoreBundleEndToEnd() throws Exception {
    SigstoreTrustedRoot trustedRoot = trustedRoot(FIXTURE_TRUSTED_ROOT);
    repository.put("repo/provenance.sigstore.json", sigstoreResource(FIXTURE_BUNDLE));
    EvidenceVerifier verifier = new EvidenceVerifier(
        new EvidenceParser(repository),
        new DsseVerifier(List.of(signerKey), false),
        new SigstoreVerifier(() -> trustedRoot, BundleVerificationPolicy.defaults()));

    VerificationResponse matching = verifier.verify(EMPTY_SHA256,
        List.of(metadata("repo/provenance.sigstore.json", EMPTY_SHA256)), "repo/empty.txt");
    VerificationResponse other = verifier.verify(OTHER_SHA256,
        List.of(metadata("repo/provenance.sigstore.json", OTHER_SHA256)), "repo/other.txt");

    assertThat(matching.overallVerificationStatus()).isEqualTo(VerificationStatus.SUCCESS);
    assertThat(matching.evidenceVerifications().get(0).getVerificationResult().getKeySource())
        .isEqualTo(VerificationResult.SIGSTORE_BUNDLE_KEY);
    assertThat(other.overallVerificationStatus()).isEqualTo(VerificationStatus.FAILED);
    assertThat(other.evidenceVerifications().get(0).getVerificationResult().getFailureReason()).isNotBlank();
  }

  @Test
  public void rejectsEmptyEvidence() {
    EvidenceVerifier verifier = verifier(passingBundles());

    assertThatThrownBy(() -> verifier.verify(EMPTY_SHA256, Collections.emptyList(), "repo/app.jar"))
        .isInstanceOf(NoEvidenceException.class)
        .hasMessage("no evidence metadata provided");
    assertThatThrownBy(() -> verifier.verify(EMPTY_SHA256, null, "repo/app.jar"))
        .isInstanceOf(NoEvidenceException.class);
  }

  @Test
  public void parseFailureAbortsTheBatch() {
    repository.put("repo/readme.txt", "hello");

    assertThatThrownBy(() -> verifier(passingBundles()).verify(EMPTY_SHA256, List.of(
        metadata("repo/dsse.json", EMPTY_SHA256),
        metadata("repo/readme.txt", EMPTY_SHA256)), "repo/app.jar"))
        .isInstanceOf(EvidenceParseException.class)
        .hasMessageStartingWith("failed to read envelope: ");
  }

  @Test
  public void unparsableBundleYieldsNoResponse() {
    BundleVerifier unreadable = (bundle, digest) -> {
      throw new InvalidBundleException("invalid bundle: missing content");
    };

    assertThatThrownBy(() -> verifier(unreadable)
        .verify(EMPTY_SHA256, List.of(metadata("repo/bundle.json", EMPTY_SHA256)), "repo/app.jar"))
        .isInstanceOf(InvalidBundleException.class);
  }

  @Test
  public void reportsProgressAndIgnoresListenerFailures() throws Exception {
    List<String> events = new ArrayList<>();
    ProgressListener listener = new ProgressListener() {
      @Override
      public void start(int total) {
        events.add("start " + total);
      }

      @Override
      public void increment() {
        events.add("increment");
        throw new IllegalStateException("progress bar closed");
      }
    };

    VerificationResponse response = verifier(passingBundles()).verify(EMPTY_SHA256, List.of(
        metadata("repo/dsse.json", EMPTY_SHA256),
        metadata("repo/bundle.json", EMPTY_SHA256)), "repo/app.jar", listener);

    assertThat(events).containsExactly("start 2", "increment", "increment");
    assertThat(response.overallVerificationStatus()).isEqualTo(VerificationStatus.SUCCESS);
  }

  private EvidenceVerifier verifier(BundleVerifier bundleVerifier) {
    return new EvidenceVerifier(
        new EvidenceParser(repository),
        new DsseVerifier(List.of(signerKey), false),
        new SigstoreVerifier(() -> null, BundleVerificationPolicy.defaults(), (root, policy) -> bundleVerifier));
  }

  private static BundleVerifier passingBundles() {
    return (bundle, digest) -> ImmutableSigstoreVerification.builder().signingIdentity(SIGNER_EMAIL).build();
  }
}
