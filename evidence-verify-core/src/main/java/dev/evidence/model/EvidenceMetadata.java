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
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * One evidence record as returned by the repository's evidence search. Read-only input to the
 * verifier; the verifier never constructs the search itself.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableEvidenceMetadata.class)
@JsonDeserialize(as = ImmutableEvidenceMetadata.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class EvidenceMetadata {

  /**
   * Repository path the raw evidence file is downloaded from.
   */
  @Nullable
  public abstract String downloadPath();

  @Nullable
  public abstract String name();

  @Nullable
  public abstract String repositoryKey();

  @Nullable
  public abstract String path();

  @Nullable
  public abstract String predicateType();

  @Nullable
  public abstract String predicateCategory();

  @Nullable
  public abstract String createdAt();

  @Nullable
  public abstract String createdBy();

  /**
   * The subject as recorded inside the evidence, in particular its sha256 at signing time.
   */
  @Nullable
  public abstract EvidenceSubject subject();

  @Nullable
  public abstract SigningKey signingKey();

  @Nullable
  public String subjectSha256() {
    return subject() == null ? null : subject().sha256();
  }

  /**
   * PEM public key embedded by the repository, or an empty string when none is stored.
   */
  public String embeddedPublicKey() {
    if (signingKey() == null || signingKey().publicKey() == null) {
      return "";
    }
    return signingKey().publicKey();
  }
}
