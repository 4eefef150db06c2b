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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Final report of one verification run.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableVerificationResponse.class)
@JsonPropertyOrder({"schemaVersion", "subject", "evidenceVerifications", "overallVerificationStatus"})
public abstract class VerificationResponse {

  // Bump whenever the shape of this report changes.
  public static final String SCHEMA_VERSION = "1.0";

  @Value.Default
  public String schemaVersion() {
    return SCHEMA_VERSION;
  }

  public abstract Subject subject();

  public abstract List<EvidenceVerification> evidenceVerifications();

  public abstract VerificationStatus overallVerificationStatus();

  @JsonIgnore
  public boolean isFailed() {
    return overallVerificationStatus() == VerificationStatus.FAILED;
  }

  public long verifiedCount() {
    return evidenceVerifications().stream().filter(EvidenceVerification::isVerified).count();
  }
}
