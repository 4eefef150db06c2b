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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.evidence.EvidenceParseException;
import dev.evidence.model.EvidenceMetadata;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a saved evidence search response:
 *
 * <pre>
 * { "data": { "evidence": { "searchEvidence": { "edges": [ { "node": { ... } } ] } } } }
 * </pre>
 */
public class JsonFileEvidenceLocator implements EvidenceLocator {

  private static final Logger logger = LoggerFactory.getLogger(JsonFileEvidenceLocator.class);

  private final Path searchResponse;
  private final ObjectMapper mapper;

  public JsonFileEvidenceLocator(Path searchResponse) {
    this(searchResponse, new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
  }

  public JsonFileEvidenceLocator(Path searchResponse, ObjectMapper mapper) {
    this.searchResponse = searchResponse;
    this.mapper = mapper;
  }

  @Override
  public List<EvidenceMetadata> locate() throws EvidenceParseException {
    JsonNode root;
    try (InputStream in = Files.newInputStream(searchResponse)) {
      root = mapper.readTree(in);
    } catch (IOException e) {
      throw new EvidenceParseException(format("failed to read evidence search response: %s", searchResponse), e);
    }
    if (root == null) {
      throw new EvidenceParseException(format("evidence search response is empty: %s", searchResponse));
    }
    JsonNode edges = root.path("data").path("evidence").path("searchEvidence").path("edges");
    List<EvidenceMetadata> evidence = new ArrayList<>();
    for (JsonNode edge : edges) {
      JsonNode node = edge.path("node");
      if (!node.isObject()) {
        continue;
      }
      try {
        evidence.add(mapper.treeToValue(node, EvidenceMetadata.class));
      } catch (IOException e) {
        throw new EvidenceParseException(format("invalid evidence record in %s", searchResponse), e);
      }
    }
    logger.info(format("Loaded %d evidence from %s", evidence.size(), searchResponse.getFileName()));
    return evidence;
  }
}
