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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Format of a downloaded evidence file, as detected by the parser.
 */
public enum MediaType {
  SIMPLE_DSSE("evidence.dsse"),
  SIGSTORE_BUNDLE("sigstore.bundle");

  private final String value;

  MediaType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
