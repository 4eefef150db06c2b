package dev.evidence.plugin;

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

import dev.evidence.EvidenceVerificationException;
import dev.evidence.EvidenceVerificationRequest;
import dev.evidence.ImmutableEvidenceVerificationRequest;
import dev.evidence.VerificationFailedException;
import dev.evidence.VerifyEvidenceCommand;
import dev.evidence.report.ReportFormat;
import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the evidence attached to a repository artifact and prints a report.
 */
@Mojo(name = "verify-evidence", requiresProject = false, threadSafe = true)
public class VerifyEvidenceMojo extends AbstractMojo {

  private static final Logger logger = LoggerFactory.getLogger(VerifyEvidenceMojo.class);

  @Parameter(property = "evidence.skip", defaultValue = "false")
  private boolean skip;

  // ---------------------------------------------------------------------------
  // Subject
  // ---------------------------------------------------------------------------

  /**
   * Repository path of the subject, {@code <repoKey>/<path>}
   */
  @Parameter(property = "evidence.subjectPath")
  private String subjectPath;

  /**
   * Local copy of the subject; its sha256 is used when evidence.subjectSha256 is not given
   */
  @Parameter(property = "evidence.subjectFile")
  private File subjectFile;

  @Parameter(property = "evidence.subjectSha256")
  private String subjectSha256;

  /**
   * Saved evidence search response listing the evidence of the subject
   */
  @Parameter(property = "evidence.metadataFile", required = true)
  private File metadataFile;

  // ---------------------------------------------------------------------------
  // Keys
  // ---------------------------------------------------------------------------

  /**
   * PEM public key files tried before the keys stored in Artifactory
   */
  @Parameter(property = "evidence.keys")
  private List<File> keys;

  @Parameter(property = "evidence.useArtifactoryKeys", defaultValue = "true")
  private boolean useArtifactoryKeys;

  // ---------------------------------------------------------------------------
  // Artifactory
  // ---------------------------------------------------------------------------

  @Parameter(property = "evidence.artifactoryUrl", required = true)
  private String artifactoryUrl;

  @Parameter(property = "evidence.accessToken")
  private String accessToken;

  @Parameter(property = "evidence.sslVerification", defaultValue = "true")
  private boolean sslVerification;

  // ---------------------------------------------------------------------------
  // Sigstore and output
  // ---------------------------------------------------------------------------

  /**
   * TUF cache for the Sigstore trusted root; defaults to ~/.evidence-cli/evidence/security/certs
   */
  @Parameter(property = "evidence.trustRootCacheDir")
  private File trustRootCacheDir;

  /**
   * text, json or markdown
   */
  @Parameter(property = "evidence.format", defaultValue = "text")
  private String format;

  @Override
  public void execute() throws MojoExecutionException, MojoFailureException {
    if (skip) {
      logger.info("Evidence verification is skipped.");
      return;
    }
    EvidenceVerificationRequest request;
    try {
      request = request();
    } catch (IllegalArgumentException e) {
      throw new MojoExecutionException(e.getMessage(), e);
    }
    try {
      new VerifyEvidenceCommand(request, System.out).execute();
    } catch (VerificationFailedException e) {
      throw new MojoFailureException(e.getMessage(), e);
    } catch (EvidenceVerificationException e) {
      throw new MojoExecutionException(format("Error verifying evidence of %s: %s",
          subjectPath == null ? subjectSha256 : subjectPath, e.getMessage()), e);
    }
  }

  EvidenceVerificationRequest request() {
    ImmutableEvidenceVerificationRequest.Builder builder = ImmutableEvidenceVerificationRequest.builder()
        .subjectPath(subjectPath)
        .subjectSha256(subjectSha256)
        .subjectFile(subjectFile == null ? null : subjectFile.toPath())
        .metadataFile(metadataFile == null ? null : metadataFile.toPath())
        .useArtifactoryKeys(useArtifactoryKeys)
        .artifactoryUrl(artifactoryUrl)
        .accessToken(accessToken)
        .sslVerification(sslVerification)
        .format(ReportFormat.of(format));
    List<Path> keyPaths = new ArrayList<>();
    if (keys != null) {
      keys.forEach(key -> keyPaths.add(key.toPath()));
    }
    builder.keys(keyPaths);
    if (trustRootCacheDir != null) {
      builder.trustRootCacheDir(trustRootCacheDir.toPath());
    }
    return builder.build();
  }
}
