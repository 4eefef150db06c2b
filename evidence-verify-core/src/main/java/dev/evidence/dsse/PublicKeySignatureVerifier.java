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

import java.security.GeneralSecurityException;
import java.security.Provider;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SignatureVerifier} for RSA, ECDSA and Ed25519 keys. The digest follows the key: SHA-256
 * for RSA, the curve size for ECDSA (P-256, P-384, P-521), none for Ed25519.
 */
public class PublicKeySignatureVerifier implements SignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(PublicKeySignatureVerifier.class);

  static final Provider PROVIDER = new BouncyCastleProvider();

  private final PublicKey publicKey;
  private final String algorithm;

  public PublicKeySignatureVerifier(PublicKey publicKey) {
    this.publicKey = publicKey;
    this.algorithm = signatureAlgorithm(publicKey);
  }

  static String signatureAlgorithm(PublicKey key) {
    if (key instanceof RSAPublicKey) {
      return "SHA256withRSA";
    }
    if (key instanceof ECPublicKey) {
      int fieldSize = ((ECPublicKey) key).getParams().getCurve().getField().getFieldSize();
      if (fieldSize <= 256) {
        return "SHA256withECDSA";
      } else if (fieldSize <= 384) {
        return "SHA384withECDSA";
      }
      return "SHA512withECDSA";
    }
    if ("Ed25519".equals(key.getAlgorithm()) || "EdDSA".equals(key.getAlgorithm())) {
      return "Ed25519";
    }
    throw new IllegalArgumentException(format("unsupported public key algorithm %s", key.getAlgorithm()));
  }

  @Override
  public PublicKey publicKey() {
    return publicKey;
  }

  @Override
  public boolean verify(byte[] message, byte[] signature) {
    try {
      Signature verifier = Signature.getInstance(algorithm, PROVIDER);
      verifier.initVerify(publicKey);
      verifier.update(message);
      return verifier.verify(signature);
    } catch (GeneralSecurityException e) {
      logger.debug(format("%s signature rejected: %s", algorithm, e.getMessage()));
      return false;
    }
  }
}
