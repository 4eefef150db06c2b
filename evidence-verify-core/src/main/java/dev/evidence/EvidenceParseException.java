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

/**
 * The evidence file could not be downloaded or is neither a Sigstore bundle nor a DSSE envelope.
 */
public class EvidenceParseException extends EvidenceVerificationException {

  public EvidenceParseException(String message) {
    super(message);
  }

  public EvidenceParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
