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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.evidence.dsse.Pae;
import dev.evidence.model.EvidenceMetadata;
import dev.evidence.model.ImmutableEvidenceMetadata;
import dev.evidence.model.ImmutableEvidenceSubject;
import dev.evidence.model.ImmutableSigningKey;
import dev.evidence.model.SigstoreBundle;
import dev.evidence.parser.RemoteFileReader;
import dev.evidence.sigstore.SignedCertificateTimestamps;
import dev.sigstore.TrustedRootProvider;
import dev.sigstore.trustroot.SigstoreTrustedRoot;
import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.util.Base64;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.DERUTF8String;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.junit.Rule;
import org.junit.rules.TemporaryFolder;

public class EvidenceTestSupport {

  public static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
  public static final String OTHER_SHA256 = "a948904f2f0f479b8f8197694b30184b0d2ed1c1cd2a1ec0fb85d299a192a447";
  public static final String BUNDLE_MEDIA_TYPE = "application/vnd.dev.sigstore.bundle.v0.3+json";
  public static final String SIGNER_EMAIL = "release-bot@example.com";
  public static final String OIDC_ISSUER = "https://token.actions.githubusercontent.com";

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  protected final ObjectMapper mapper = new ObjectMapper();

  // ---------------------------------------------------------------------------
  // Keys
  // ---------------------------------------------------------------------------

  protected static KeyPair ecKeyPair() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
    generator.initialize(new ECGenParameterSpec("secp256r1"));
    return generator.generateKeyPair();
  }

  protected static KeyPair ecKeyPair(String curve) throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
    generator.initialize(new ECGenParameterSpec(curve));
    return generator.generateKeyPair();
  }

  protected static KeyPair rsaKeyPair() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    return generator.generateKeyPair();
  }

  protected static KeyPair ed25519KeyPair() throws Exception {
    return KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
  }

  protected static String pem(PublicKey key) {
    return pem("PUBLIC KEY", key.getEncoded());
  }

  protected static String pem(String type, byte[] der) {
    String body = Base64.getMimeEncoder(64, "\n".getBytes(UTF_8)).encodeToString(der);
    return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
  }

  protected Path writePem(String name, PublicKey key) throws IOException {
    Path file = temporaryFolder.getRoot().toPath().resolve(name);
    Files.writeString(file, pem(key), UTF_8);
    return file;
  }

  // ---------------------------------------------------------------------------
  // DSSE
  // ---------------------------------------------------------------------------

  protected static byte[] sign(PrivateKey key, byte[] message) throws Exception {
    String algorithm;
    switch (key.getAlgorithm()) {
      case "EC":
        algorithm = "SHA256withECDSA";
        break;
      case "RSA":
        algorithm = "SHA256withRSA";
        break;
      default:
        algorithm = "Ed25519";
    }
    Signature signature = Signature.getInstance(algorithm);
    signature.initSign(key);
    signature.update(message);
    return signature.sign();
  }

  protected static String statement(String subjectSha256) {
    return "{\"_type\":\"https://in-toto.io/Statement/v1\",\"subject\":[{\"digest\":{\"sha256\":\""
        + subjectSha256 + "\"}}],\"predicateType\":\"https://slsa.dev/provenance/v1\",\"predicate\":{}}";
  }

  protected ObjectNode envelope(String payload, PrivateKey... signers) throws Exception {
    String payloadType = "application/vnd.in-toto+json";
    byte[] body = payload.getBytes(UTF_8);
    ObjectNode envelope = mapper.createObjectNode();
    envelope.put("payload", Base64.getEncoder().encodeToString(body));
    envelope.put("payloadType", payloadType);
    ArrayNode signatures = envelope.putArray("signatures");
    for (PrivateKey signer : signers) {
      signatures.addObject()
          .put("keyid", "")
          .put("sig", Base64.getEncoder().encodeToString(sign(signer, Pae.encode(payloadType, body))));
    }
    return envelope;
  }

  protected byte[] envelopeJson(String payload, PrivateKey... signers) throws Exception {
    return mapper.writeValueAsBytes(envelope(payload, signers));
  }

  // ---------------------------------------------------------------------------
  // Sigstore
  // ---------------------------------------------------------------------------

  /**
   * Leaf certificate shaped like a Fulcio one: email SAN, OIDC issuer and {@code scts} embedded
   * SCTs.
   */
  protected static byte[] signingCertificate(KeyPair keyPair, int scts) throws Exception {
    long now = System.currentTimeMillis();
    X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
        new X500Name("CN=sigstore-intermediate,O=sigstore.dev"),
        BigInteger.valueOf(now),
        new Date(now - 60_000),
        new Date(now + 600_000),
        new X500Name("CN=unused"),
        keyPair.getPublic());
    builder.addExtension(Extension.subjectAlternativeName, true,
        new GeneralNames(new GeneralName(GeneralName.rfc822Name, SIGNER_EMAIL)));
    builder.addExtension(new ASN1ObjectIdentifier("1.3.6.1.4.1.57264.1.8"), false, new DERUTF8String(OIDC_ISSUER));
    if (scts > 0) {
      builder.addExtension(SignedCertificateTimestamps.SCT_LIST_OID, false, new DEROctetString(sctList(scts)));
    }
    return builder.build(new JcaContentSignerBuilder("SHA256withECDSA").build(keyPair.getPrivate())).getEncoded();
  }

  // TLS encoded list of fake SCTs, 4 bytes each
  protected static byte[] sctList(int count) {
    int total = count * 6;
    byte[] list = new byte[2 + total];
    list[0] = (byte) (total >> 8);
    list[1] = (byte) total;
    for (int i = 0; i < count; i++) {
      int offset = 2 + i * 6;
      list[offset + 1] = 4;
      list[offset + 2] = 0;
      list[offset + 3] = (byte) i;
    }
    return list;
  }

  protected ObjectNode bundle(byte[] certificate, int tlogEntries, int rfc3161Timestamps) throws Exception {
    ObjectNode bundle = mapper.createObjectNode();
    bundle.put("mediaType", BUNDLE_MEDIA_TYPE);
    ObjectNode material = bundle.putObject("verificationMaterial");
    material.putObject("certificate").put("rawBytes", Base64.getEncoder().encodeToString(certificate));
    ArrayNode entries = material.putArray("tlogEntries");
    for (int i = 0; i < tlogEntries; i++) {
      ObjectNode entry = entries.addObject();
      entry.put("logIndex", String.valueOf(25579 + i));
      entry.putObject("logId").put("keyId", "wNI9atQGlz+VWfO6LRygH4QUfY/8W4RFwiT5i5WRgB0=");
      entry.put("integratedTime", "1700000000");
      entry.putObject("inclusionProof").put("logIndex", String.valueOf(25579 + i));
    }
    ArrayNode timestamps = material.putObject("timestampVerificationData").putArray("rfc3161Timestamps");
    for (int i = 0; i < rfc3161Timestamps; i++) {
      timestamps.addObject().put("signedTimestamp", "MIIC");
    }
    ObjectNode envelope = bundle.putObject("dsseEnvelope");
    envelope.put("payload", Base64.getEncoder().encodeToString(statement(EMPTY_SHA256).getBytes(UTF_8)));
    envelope.put("payloadType", "application/vnd.in-toto+json");
    envelope.putArray("signatures").addObject().put("sig", "MEUCIQ==");
    return bundle;
  }

  /**
   * Bundle in {@code src/test/resources/sigstore} issued by the test deployment described by
   * {@code trusted_root.json}: one DSSE in-toto statement about {@link #EMPTY_SHA256}, signed by
   * {@link #FIXTURE_SIGNER}, with one embedded SCT and one log entry carrying an inclusion proof.
   */
  protected static final String FIXTURE_BUNDLE = "provenance.sigstore.json";
  protected static final String FIXTURE_TRUSTED_ROOT = "trusted_root.json";
  protected static final String PUBLIC_GOOD_TRUSTED_ROOT = "public-good-trusted_root.json";
  protected static final String FIXTURE_SIGNER = "builder@evidence.test";
  protected static final String FIXTURE_OIDC_ISSUER = "https://issuer.evidence.test";
  protected static final long FIXTURE_INTEGRATED_TIME = 1717243260L;

  protected static byte[] sigstoreResource(String name) throws IOException {
    try (InputStream in = EvidenceTestSupport.class.getResourceAsStream("/sigstore/" + name)) {
      if (in == null) {
        throw new FileNotFoundException("/sigstore/" + name);
      }
      return in.readAllBytes();
    }
  }

  protected SigstoreBundle sigstoreBundle(byte[] json) throws IOException {
    return SigstoreBundle.from(mapper, mapper.readTree(json), new String(json, UTF_8));
  }

  protected SigstoreTrustedRoot trustedRoot(String name) throws Exception {
    Path file = temporaryFolder.getRoot().toPath().resolve(name);
    Files.write(file, sigstoreResource(name));
    return TrustedRootProvider.from(file).get();
  }

  // ---------------------------------------------------------------------------
  // Evidence records
  // ---------------------------------------------------------------------------

  protected static EvidenceMetadata metadata(String downloadPath, String subjectSha256) {
    return metadata(downloadPath, subjectSha256, null);
  }

  protected static EvidenceMetadata metadata(String downloadPath, String subjectSha256, String embeddedPem) {
    ImmutableEvidenceMetadata.Builder builder = ImmutableEvidenceMetadata.builder()
        .downloadPath(downloadPath)
        .predicateType("https://slsa.dev/provenance/v1")
        .createdBy("release-bot")
        .createdAt("2024-05-02T10:15:30Z")
        .subject(ImmutableEvidenceSubject.builder().sha256(subjectSha256).build());
    if (embeddedPem != null) {
      builder.signingKey(ImmutableSigningKey.builder().alias("release").publicKey(embeddedPem).build());
    }
    return builder.build();
  }

  /**
   * Repository contents keyed by download path.
   */
  public static class InMemoryRemoteFileReader implements RemoteFileReader {

    private final Map<String, byte[]> files = new HashMap<>();
    private final Map<String, Integer> reads = new HashMap<>();

    public InMemoryRemoteFileReader put(String path, byte[] content) {
      files.put(path, content);
      return this;
    }

    public InMemoryRemoteFileReader put(String path, String content) {
      return put(path, content.getBytes(UTF_8));
    }

    public int reads(String path) {
      return reads.getOrDefault(path, 0);
    }

    @Override
    public InputStream readRemoteFile(String path) throws IOException {
      reads.merge(path, 1, Integer::sum);
      byte[] content = files.get(path);
      if (content == null) {
        throw new FileNotFoundException(path);
      }
      return new ByteArrayInputStream(content);
    }
  }
}
