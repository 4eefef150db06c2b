package dev.evidence.dsse;

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
import static java.nio.charset.StandardCharsets.UTF_8;

import dev.evidence.KeyLoadingException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PublicKey;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

/**
 * Reads a single PEM public key. {@code PUBLIC KEY} (PKIX) and {@code RSA PUBLIC KEY} (PKCS#1)
 * blocks are accepted, as is a {@code CERTIFICATE} whose subject key is then used.
 */
public class PemPublicKeyLoader implements PublicKeyLoader {

  private final JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(PublicKeySignatureVerifier.PROVIDER);

  @Override
  public PublicKey loadFromFile(Path path) throws KeyLoadingException {
    String pem;
    try {
      pem = Files.readString(path, UTF_8);
    } catch (IOException e) {
      throw new KeyLoadingException(format("failed to read key %s", path), e);
    }
    try {
      return parse(pem);
    } catch (KeyLoadingException e) {
      throw new KeyLoadingException(format("failed to load key %s: %s", path, e.getMessage()), e);
    }
  }

  @Override
  public PublicKey loadFromPem(String pem) throws KeyLoadingException {
    return parse(pem);
  }

  private PublicKey parse(String pem) throws KeyLoadingException {
    if (pem == null || pem.isBlank()) {
      throw new KeyLoadingException("key is null or empty");
    }
    Object parsed;
    try (Reader reader = new StringReader(pem); PEMParser parser = new PEMParser(reader)) {
      parsed = parser.readObject();
    } catch (IOException | RuntimeException e) {
      throw new KeyLoadingException("invalid PEM public key", e);
    }
    SubjectPublicKeyInfo keyInfo;
    if (parsed instanceof SubjectPublicKeyInfo) {
      keyInfo = (SubjectPublicKeyInfo) parsed;
    } else if (parsed instanceof X509CertificateHolder) {
      keyInfo = ((X509CertificateHolder) parsed).getSubjectPublicKeyInfo();
    } else if (parsed == null) {
      throw new KeyLoadingException("no PEM block found");
    } else {
      throw new KeyLoadingException(format("unsupported PEM content %s", parsed.getClass().getSimpleName()));
    }
    try {
      PublicKey key = converter.getPublicKey(keyInfo);
      PublicKeySignatureVerifier.signatureAlgorithm(key);
      return key;
    } catch (IOException | RuntimeException e) {
      throw new KeyLoadingException("unsupported public key: " + e.getMessage(), e);
    }
  }
}
