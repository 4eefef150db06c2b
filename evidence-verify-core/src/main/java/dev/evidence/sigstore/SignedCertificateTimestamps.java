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

import java.io.IOException;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.cert.X509CertificateHolder;

/**
 * Counts the SCTs embedded in a certificate (RFC 6962 section 3.3).
 */
public final class SignedCertificateTimestamps {

  public static final ASN1ObjectIdentifier SCT_LIST_OID = new ASN1ObjectIdentifier("1.3.6.1.4.1.11129.2.4.2");

  private SignedCertificateTimestamps() {
  }

  public static int count(byte[] certificateDer) {
    X509CertificateHolder certificate;
    try {
      certificate = new X509CertificateHolder(certificateDer);
    } catch (IOException e) {
      throw new IllegalArgumentException("invalid signing certificate", e);
    }
    Extension extension = certificate.getExtension(SCT_LIST_OID);
    if (extension == null) {
      return 0;
    }
    // extnValue wraps a second OCTET STRING holding the TLS encoded list
    byte[] list = ASN1OctetString.getInstance(extension.getParsedValue()).getOctets();
    return countTlsList(list);
  }

  // opaque SerializedSCT<1..2^16-1>; SignedCertificateTimestampList<1..2^16-1>
  static int countTlsList(byte[] list) {
    if (list.length < 2) {
      throw new IllegalArgumentException("truncated SCT list");
    }
    int total = readUint16(list, 0);
    if (total != list.length - 2) {
      throw new IllegalArgumentException("SCT list length mismatch");
    }
    int count = 0;
    int offset = 2;
    while (offset < list.length) {
      if (offset + 2 > list.length) {
        throw new IllegalArgumentException("truncated SCT entry");
      }
      int length = readUint16(list, offset);
      offset += 2 + length;
      if (length == 0 || offset > list.length) {
        throw new IllegalArgumentException("invalid SCT entry length");
      }
      count++;
    }
    return count;
  }

  private static int readUint16(byte[] data, int offset) {
    return ((data[offset] & 0xff) << 8) | (data[offset + 1] & 0xff);
  }
}
