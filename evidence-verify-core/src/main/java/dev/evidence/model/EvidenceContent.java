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

import static java.util.Objects.requireNonNull;

import java.util.Optional;

/**
 * Decoded evidence file, tagged by its {@link MediaType}. Exactly one representation exists per
 * instance: a plain DSSE envelope or a Sigstore bundle.
 */
public abstract class EvidenceContent {

  private EvidenceContent() {
  }

  public static EvidenceContent dsse(DsseEnvelope envelope) {
    return new Dsse(requireNonNull(envelope, "envelope"));
  }

  public static EvidenceContent sigstoreBundle(SigstoreBundle bundle) {
    return new Bundle(requireNonNull(bundle, "bundle"));
  }

  public abstract MediaType mediaType();

  public Optional<DsseEnvelope> dsseEnvelope() {
    return Optional.empty();
  }

  public Optional<SigstoreBundle> sigstoreBundle() {
    return Optional.empty();
  }

  private static final class Dsse extends EvidenceContent {

    private final DsseEnvelope envelope;

    private Dsse(DsseEnvelope envelope) {
      this.envelope = envelope;
    }

    @Override
    public MediaType mediaType() {
      return MediaType.SIMPLE_DSSE;
    }

    @Override
    public Optional<DsseEnvelope> dsseEnvelope() {
      return Optional.of(envelope);
    }
  }

  private static final class Bundle extends EvidenceContent {

    private final SigstoreBundle bundle;

    private Bundle(SigstoreBundle bundle) {
      this.bundle = bundle;
    }

    @Override
    public MediaType mediaType() {
      return MediaType.SIGSTORE_BUNDLE;
    }

    @Override
    public Optional<SigstoreBundle> sigstoreBundle() {
      return Optional.of(bundle);
    }
  }
}
