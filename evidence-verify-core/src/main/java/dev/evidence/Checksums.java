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

import dev.evidence.model.VerificationStatus;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.bouncycastle.util.encoders.Hex;

public final class Checksums {

  private Checksums() {
  }

  /**
   * Compares the sha256 of the subject as it is now with the sha256 recorded in the evidence. The
   * comparison is exact and case-sensitive; both sides are lower-case hex as served by the
   * repository.
   */
  public static VerificationStatus verify(String subjectSha256, String evidenceSubjectSha256) {
    return VerificationStatus.of(subjectSha256 != null && subjectSha256.equals(evidenceSubjectSha256));
  }

  public static String sha256(Path path) throws IOException {
    MessageDigest digest = sha256Digest();
    byte[] buffer = new byte[8192];
    try (InputStream in = Files.newInputStream(path)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
    }
    return Hex.toHexString(digest.digest());
  }

  public static String sha256(byte[] input) {
    return Hex.toHexString(sha256Digest().digest(input));
  }

  private static MessageDigest sha256Digest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
