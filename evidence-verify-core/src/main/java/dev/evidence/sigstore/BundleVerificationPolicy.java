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

import static java.lang.String.format;

import dev.evidence.model.SigstoreBundle;
import dev.evidence.model.SigstoreBundle.TlogEntry;
import org.immutables.value.Value;

/**
 * Minimum amount of independent evidence a bundle must carry before its signature is checked.
 */
@Value.Immutable
public abstract class BundleVerificationPolicy {

  public static BundleVerificationPolicy defaults() {
    return ImmutableBundleVerificationPolicy.builder().build();
  }

  @Value.Default
  public int minSignedCertificateTimestamps() {
    return 1;
  }

  /**
   * Transparency log integrated times and RFC 3161 timestamps both count.
   */
  @Value.Default
  public int minObserverTimestamps() {
    return 1;
  }

  @Value.Default
  public int minTransparencyLogEntries() {
    return 1;
  }

  @Value.Check
  protected void check() {
    if (minSignedCertificateTimestamps() < 0 || minObserverTimestamps() < 0 || minTransparencyLogEntries() < 0) {
      throw new IllegalStateException("policy thresholds must not be negative");
    }
  }

  public void enforce(SigstoreBundle bundle) throws BundleVerificationException {
    int tlogEntries = bundle.tlogEntries().size();
    if (tlogEntries < minTransparencyLogEntries()) {
      throw new BundleVerificationException(
          format("threshold not met for verified log entries: %d < %d", tlogEntries, minTransparencyLogEntries()));
    }

    int observerTimestamps = bundle.rfc3161TimestampCount();
    for (TlogEntry entry : bundle.tlogEntries()) {
      if (entry.integratedTime() > 0) {
        observerTimestamps++;
      }
    }
    if (observerTimestamps < minObserverTimestamps()) {
      throw new BundleVerificationException(
          format("threshold not met for verified timestamps: %d < %d", observerTimestamps, minObserverTimestamps()));
    }

    if (minSignedCertificateTimestamps() > 0) {
      int scts;
      try {
        scts = bundle.leafCertificate().map(SignedCertificateTimestamps::count).orElse(0);
      } catch (IllegalArgumentException e) {
        throw new BundleVerificationException("unable to read signed certificate timestamps: " + e.getMessage(), e);
      }
      if (scts < minSignedCertificateTimestamps()) {
        throw new BundleVerificationException(format(
            "threshold not met for verified signed certificate timestamps: %d < %d", scts,
            minSignedCertificateTimestamps()));
      }
    }
  }
}
