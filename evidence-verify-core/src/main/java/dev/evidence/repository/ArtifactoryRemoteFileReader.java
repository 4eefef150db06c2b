package dev.evidence.repository;

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

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.apache.v2.ApacheHttpTransport;
import dev.evidence.parser.RemoteFileReader;
import java.io.IOException;
import java.io.InputStream;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.impl.client.HttpClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads repository files with {@code GET <artifactoryUrl>/<path>}.
 */
public class ArtifactoryRemoteFileReader implements RemoteFileReader {

  private static final Logger logger = LoggerFactory.getLogger(ArtifactoryRemoteFileReader.class);

  private final String artifactoryUrl;
  private final String accessToken;
  private final HttpTransport transport;

  public ArtifactoryRemoteFileReader(String artifactoryUrl, String accessToken, boolean sslVerification) {
    this(artifactoryUrl, accessToken, getHttpTransport(sslVerification));
  }

  public ArtifactoryRemoteFileReader(String artifactoryUrl, String accessToken, HttpTransport transport) {
    if (artifactoryUrl == null || artifactoryUrl.isBlank()) {
      throw new IllegalArgumentException("artifactory url is required to download evidence");
    }
    this.artifactoryUrl = artifactoryUrl.endsWith("/") ? artifactoryUrl : artifactoryUrl + "/";
    this.accessToken = accessToken;
    this.transport = transport;
  }

  public static HttpTransport getHttpTransport(boolean sslVerification) {
    HttpClientBuilder hcb = ApacheHttpTransport.newDefaultHttpClientBuilder();
    if (!sslVerification) {
      hcb = hcb.setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE);
    }
    return new ApacheHttpTransport(hcb.build());
  }

  @Override
  public InputStream readRemoteFile(String path) throws IOException {
    String relative = path.startsWith("/") ? path.substring(1) : path;
    GenericUrl url = new GenericUrl(artifactoryUrl + relative);
    HttpRequest request = transport.createRequestFactory().buildGetRequest(url);
    request.setThrowExceptionOnExecuteError(false);
    if (accessToken != null && !accessToken.isEmpty()) {
      request.getHeaders().setAuthorization("Bearer " + accessToken);
    }
    logger.debug("Downloading " + url);
    HttpResponse response = request.execute();
    if (!response.isSuccessStatusCode()) {
      String body = response.parseAsString();
      response.disconnect();
      throw new IOException(format("bad response from %s: %d %s", url, response.getStatusCode(), body));
    }
    return response.getContent();
  }
}
