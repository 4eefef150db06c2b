package dev.evidence.sigstore;

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

import dev.evidence.InvalidBundleException;
import dev.evidence.TrustRootException;
import dev.evidence.model.ImmutableSigstoreVerification;
import dev.evidence.model.SigstoreBundle;
import dev.evidence.model.SigstoreBundle.TlogEntry;
import dev.evidence.model.SigstoreVerification;
import dev.sigstore.KeylessVerificationException;
import dev.sigstore.KeylessVerifier;
import dev.sigstore.VerificationOptions;
import dev.sigstore.bundle.Bundle;
import dev.sigstore.trustroot.SigstoreTrustedRoot;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.cert.X509CertificateHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BundleVerifier} backed by sigstore-java. The threshold policy is enforced first, then the
 * certificate chain, transparency log entries and signature are checked against the trusted
 * root. Signer identities are not constrained.
 */
public class KeylessBundleVerifier implements BundleVerifier {

  private static final Logger logger = LoggerFactory.getLogger(KeylessBundleVerifier.class);

  static final ASN1ObjectIdentifier OIDC_ISSUER_V1 = new ASN1ObjectIdentifier("1.3.6.1.4.1.57264.1.1");
  static final ASN1ObjectIdentifier OIDC_ISSUER_V2 = new ASN1ObjectIdentifier("1.3.6.1.4.1.57264.1.8");

  private final KeylessVerifier verifier;
  private final BundleVerificationPolicy policy;

  KeylessBundleVerifier(KeylessVerifier verifier, BundleVerificationPolicy policy) {
    this.verifier = verifier;
    this.policy = policy;
  }

  public static KeylessBundleVerifier create(SigstoreTrustedRoot trustedRoot, BundleVerificationPolicy policy)
      throws TrustRootException {
    try {
      KeylessVerifier verifier = KeylessVerifier.builder()
          .trustedRootProvider(() -> trustedRoot)
          .build();
      return new KeylessBundleVerifier(verifier, policy);
    } catch (Exception e) {
      throw new TrustRootException(format("failed to create signature verifier: %s", e.getMessage()), e);
    }
  }

  @Override
  public SigstoreVerification verify(SigstoreBundle bundle, byte[] artifactDigest)
      throws InvalidBundleException, BundleVerificationException {
    Bundle parsed;
    try {
      parsed = Bundle.from(new StringReader(bundle.json()));
    } catch (Exception e) {
      throw new InvalidBundleException(format("invalid bundle: %s", e.getMessage()), e);
    }
    policy.enforce(bundle);
    try {
      verifier.verify(artifactDigest, parsed, VerificationOptions.empty());
    } catch (KeylessVerificationException e) {
      throw new BundleVerificationException(e.getMessage(), e);
    } catch (RuntimeException e) {
      // the verifier signals malformed verification material with unchecked exceptions
      throw new InvalidBundleException(format("invalid bundle: %s", e.getMessage()), e);
    }
    return describe(bundle);
  }

  /**
   * Signer and log details of a bundle whose signature has been verified.
   */
  static SigstoreVerification describe(SigstoreBundle bundle) {
    ImmutableSigstoreVerification.Builder builder = ImmutableSigstoreVerification.builder();
    if (!bundle.tlogEntries().isEmpty()) {
      TlogEntry entry = bundle.tlogEntries().get(0);
      builder.logIndex(entry.logIndex()).logId(entry.logId());
      if (entry.integratedTime() > 0) {
        builder.integratedTime(entry.integratedTime());
      }
    }
    Optional<byte[]> leaf;
    try {
      leaf = bundle.leafCertificate();
    } catch (IllegalArgumentException e) {
      leaf = Optional.empty();
    }
    if (leaf.isPresent()) {
      try {
        X509CertificateHolder certificate = new X509CertificateHolder(leaf.get());
        builder.certificateIssuer(certificate.getIssuer().toString())
            .signingIdentity(subjectAlternativeName(certificate))
            .oidcIssuer(oidcIssuer(certificate));
      } catch (IOException | IllegalArgumentException e) {
        logger.warn("Unable to read signing certificate details: " + e.getMessage());
      }
    }
    return builder.build();
  }

  private static String subjectAlternativeName(X509CertificateHolder certificate) {
    if (certificate.getExtensions() == null) {
      return null;
    }
    GeneralNames names = GeneralNames.fromExtensions(certificate.getExtensions(), Extension.subjectAlternativeName);
    if (names == null) {
      return null;
    }
    for (GeneralName name : names.getNames()) {
      if (name.getTagNo() == GeneralName.rfc822Name || name.getTagNo() == GeneralName.uniformResourceIdentifier) {
        return ((ASN1String) name.getName()).getString();
      }
    }
    return null;
  }

  private static String oidcIssuer(X509CertificateHolder certificate) {
    Extension v2 = certificate.getExtension(OIDC_ISSUER_V2);
    if (v2 != null) {
      ASN1Primitive value = v2.getParsedValue().toASN1Primitive();
      if (value instanceof ASN1String) {
        return ((ASN1String) value).getString();
      }
    }
    Extension v1 = certificate.getExtension(OIDC_ISSUER_V1);
    if (v1 != null) {
      // raw UTF-8 bytes, not DER
      ASN1OctetString raw = v1.getExtnValue();
      return new String(raw.getOctets(), StandardCharsets.UTF_8);
    }
    return null;
  }
}
