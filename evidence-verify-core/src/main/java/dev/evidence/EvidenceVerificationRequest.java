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

import dev.evidence.report.ReportFormat;
import dev.evidence.sigstore.BundleVerificationPolicy;
import dev.evidence.sigstore.TufTrustRootProvider;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import javax.annotation.Nullable;
import org.immutables.value.Value;

@Value.Immutable
public abstract class EvidenceVerificationRequest {

  /**
   * Repository path of the subject, {@code <repoKey>/<path>}. Reported as is.
   */
  @Nullable
  public abstract String subjectPath();

  /**
   * Expected sha256 of the subject. When absent it is computed from {@link #subjectFile()}.
   */
  @Nullable
  public abstract String subjectSha256();

  @Nullable
  public abstract Path subjectFile();

  /**
   * Evidence search response to verify.
   */
  @Nullable
  public abstract Path metadataFile();

  public abstract List<Path> keys();

  @Value.Default
  public boolean useArtifactoryKeys() {
    return true;
  }

  @Value.Default
  public ReportFormat format() {
    return ReportFormat.TEXT;
  }

  @Nullable
  public abstract String artifactoryUrl();

  @Nullable
  public abstract String accessToken();

  @Value.Default
  public boolean sslVerification() {
    return true;
  }

  @Value.Default
  public Path trustRootCacheDir() {
    return Paths.get(System.getProperty("user.home"), ".evidence-cli").resolve(TufTrustRootProvider.CACHE_SUBDIRECTORY);
  }

  @Value.Default
  public BundleVerificationPolicy bundleVerificationPolicy() {
    return BundleVerificationPolicy.defaults();
  }
}
