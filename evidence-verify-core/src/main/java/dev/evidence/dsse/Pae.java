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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;

/**
 * Pre-Authentication Encoding of a DSSE envelope:
 *
 * <pre>
 * "DSSEv1" SP LEN(type) SP type SP LEN(body) SP body
 * </pre>
 *
 * <p>Lengths are the ASCII decimal byte counts.
 */
public final class Pae {

  private static final byte[] PREFIX = "DSSEv1 ".getBytes(UTF_8);

  private Pae() {
  }

  public static byte[] encode(String payloadType, byte[] payload) {
    byte[] type = payloadType.getBytes(UTF_8);
    ByteArrayOutputStream out = new ByteArrayOutputStream(PREFIX.length + type.length + payload.length + 32);
    out.writeBytes(PREFIX);
    out.writeBytes(Integer.toString(type.length).getBytes(UTF_8));
    out.write(' ');
    out.writeBytes(type);
    out.write(' ');
    out.writeBytes(Integer.toString(payload.length).getBytes(UTF_8));
    out.write(' ');
    out.writeBytes(payload);
    return out.toByteArray();
  }
}
