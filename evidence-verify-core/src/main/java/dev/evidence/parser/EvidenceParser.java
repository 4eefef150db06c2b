package dev.evidence.parser;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.evidence.EvidenceParseException;
import dev.evidence.model.DsseEnvelope;
import dev.evidence.model.EvidenceContent;
import dev.evidence.model.EvidenceMetadata;
import dev.evidence.model.SigstoreBundle;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads the raw evidence file of a record and decodes it.
 *
 * <p>A Sigstore bundle is tried first: it is also valid JSON that partially matches the generic
 * envelope shape, so the more specific format has to win.
 */
public class EvidenceParser {

  private static final Logger logger = LoggerFactory.getLogger(EvidenceParser.class);

  private final RemoteFileReader remoteFileReader;
  private final ObjectMapper mapper;

  public EvidenceParser(RemoteFileReader remoteFileReader) {
    this(remoteFileReader, new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
  }

  public EvidenceParser(RemoteFileReader remoteFileReader, ObjectMapper mapper) {
    this.remoteFileReader = remoteFileReader;
    this.mapper = mapper;
  }

  public EvidenceContent parseEvidence(EvidenceMetadata evidence) throws EvidenceParseException {
    if (evidence == null || evidence.downloadPath() == null || evidence.downloadPath().isEmpty()) {
      throw new EvidenceParseException("empty evidence or download path provided for parsing");
    }
    String downloadPath = evidence.downloadPath();
    byte[] content = download(downloadPath);

    Optional<EvidenceContent> parsed = tryParseSigstoreBundle(content)
        .or(() -> tryParseDsseEnvelope(content));
    if (parsed.isEmpty()) {
      throw new EvidenceParseException("unsupported evidence file for client-side verification: " + downloadPath);
    }
    logger.debug(format("Parsed %s as %s", downloadPath, parsed.get().mediaType()));
    return parsed.get();
  }

  private byte[] download(String downloadPath) throws EvidenceParseException {
    InputStream in;
    try {
      in = remoteFileReader.readRemoteFile(downloadPath);
    } catch (IOException e) {
      throw new EvidenceParseException(format("failed to read remote file: %s", downloadPath), e);
    }
    if (in == null) {
      throw new EvidenceParseException(format("failed to read remote file: %s", downloadPath));
    }
    try (InputStream stream = in) {
      return stream.readAllBytes();
    } catch (IOException e) {
      throw new EvidenceParseException(format("failed to read file content: %s", downloadPath), e);
    }
  }

  Optional<EvidenceContent> tryParseSigstoreBundle(byte[] content) {
    Optional<JsonNode> root = readTree(content);
    if (root.isEmpty() || !SigstoreBundle.hasBundleShape(root.get())) {
      return Optional.empty();
    }
    try {
      String json = new String(content, StandardCharsets.UTF_8);
      return Optional.of(EvidenceContent.sigstoreBundle(SigstoreBundle.from(mapper, root.get(), json)));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      logger.debug("Content is not a Sigstore bundle: " + e.getMessage());
      return Optional.empty();
    }
  }

  Optional<EvidenceContent> tryParseDsseEnvelope(byte[] content) {
    Optional<JsonNode> root = readTree(content);
    if (root.isEmpty() || !hasEnvelopeShape(root.get())) {
      return Optional.empty();
    }
    try {
      return Optional.of(EvidenceContent.dsse(mapper.treeToValue(root.get(), DsseEnvelope.class)));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      logger.debug("Content is not a DSSE envelope: " + e.getMessage());
      return Optional.empty();
    }
  }

  private static boolean hasEnvelopeShape(JsonNode root) {
    return root.isObject()
        && root.path("payload").isTextual()
        && root.path("payloadType").isTextual()
        && root.path("signatures").isArray();
  }

  private Optional<JsonNode> readTree(byte[] content) {
    if (content.length == 0) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(mapper.readTree(content));
    } catch (IOException e) {
      logger.debug("Evidence content is not JSON: " + e.getMessage());
      return Optional.empty();
    }
  }
}
