package dev.evidence.model;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Base64;
import java.util.List;
import org.immutables.value.Value;

/**
 * Dead Simple Signing Envelope as found on the wire: {@code payload} (base64), {@code payloadType}
 * and detached {@code signatures}. Signatures are checked over the PAE encoding of the decoded
 * payload bytes, never over a re-serialization.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDsseEnvelope.class)
@JsonDeserialize(as = ImmutableDsseEnvelope.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"payload", "payloadType", "signatures"})
public abstract class DsseEnvelope {

  public static final String IN_TOTO_PAYLOAD_TYPE = "application/vnd.in-toto+json";

  public abstract String payload(); // b64

  public abstract String payloadType();

  public abstract List<DsseSignature> signatures();

  public byte[] decodedPayload() {
    return decodeBase64(payload());
  }

  // DSSE producers disagree on the base64 alphabet
  static byte[] decodeBase64(String value) {
    if (value.indexOf('-') >= 0 || value.indexOf('_') >= 0) {
      return Base64.getUrlDecoder().decode(value);
    }
    return Base64.getDecoder().decode(value);
  }
}
