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

import dev.evidence.TrustRootException;
import dev.sigstore.trustroot.SigstoreTrustedRoot;
import dev.sigstore.tuf.SigstoreTufClient;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches the public-good Sigstore trusted root over TUF, keeping the TUF metadata cache on disk
 * so later runs only download what changed.
 */
public class TufTrustRootProvider implements TrustRootProvider {

  private static final Logger logger = LoggerFactory.getLogger(TufTrustRootProvider.class);

  public static final String CACHE_SUBDIRECTORY = "evidence/security/certs";

  private final Path cacheDirectory;

  public TufTrustRootProvider(Path cacheDirectory) {
    this.cacheDirectory = cacheDirectory;
  }

  /**
   * Cache under {@code <home>/evidence/security/certs}.
   */
  public static TufTrustRootProvider inHome(Path home) {
    return new TufTrustRootProvider(home.resolve(Paths.get(CACHE_SUBDIRECTORY)));
  }

  public Path cacheDirectory() {
    return cacheDirectory;
  }

  @Override
  public SigstoreTrustedRoot loadTrustedRoot() throws TrustRootException {
    logger.info("Fetching Sigstore trusted root, cache " + cacheDirectory);
    try {
      SigstoreTufClient client = SigstoreTufClient.builder()
          .usePublicGoodInstance()
          .tufCacheLocation(cacheDirectory)
          .build();
      client.update();
      return client.getSigstoreTrustedRoot();
    } catch (Exception e) {
      throw new TrustRootException(format("failed to load TUF root certificate: %s", e.getMessage()), e);
    }
  }
}
