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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A Sigstore bundle as downloaded from the repository.
 *
 * <p>The original JSON text is kept verbatim and handed to the cryptographic verifier; the
 * structural view exposed here (verification material, transparency log entries, timestamps,
 * embedded DSSE envelope) is what the verification policy and the report work with.
 */
public final class SigstoreBundle {

  public static final String MEDIA_TYPE_PREFIX = "application/vnd.dev.sigstore.bundle";

  private final String mediaType;
  private final JsonNode root;
  private final String json;
  private final DsseEnvelope dsseEnvelope;
  private final List<TlogEntry> tlogEntries;

  private SigstoreBundle(String mediaType, JsonNode root, String json, DsseEnvelope dsseEnvelope, List<TlogEntry> tlogEntries) {
    this.mediaType = mediaType;
    this.root = root;
    this.json = json;
    this.dsseEnvelope = dsseEnvelope;
    this.tlogEntries = Collections.unmodifiableList(tlogEntries);
  }

  /**
   * Returns true when the document carries the two fields every Sigstore bundle has: a bundle
   * media type and a verification material block.
   */
  public static boolean hasBundleShape(JsonNode root) {
    return root != null
        && root.isObject()
        && root.path("mediaType").isTextual()
        && root.path("mediaType").asText().startsWith(MEDIA_TYPE_PREFIX)
        && root.path("verificationMaterial").isObject();
  }

  public static SigstoreBundle from(ObjectMapper mapper, JsonNode root, String json) throws JsonProcessingException {
    if (!hasBundleShape(root)) {
      throw new IllegalArgumentException("not a Sigstore bundle: missing mediaType or verificationMaterial");
    }
    DsseEnvelope envelope = null;
    JsonNode envelopeNode = root.get("dsseEnvelope");
    if (envelopeNode != null && envelopeNode.isObject()) {
      envelope = mapper.treeToValue(envelopeNode, DsseEnvelope.class);
    }
    List<TlogEntry> entries = new ArrayList<>();
    for (JsonNode entry : root.path("verificationMaterial").path("tlogEntries")) {
      entries.add(TlogEntry.from(entry));
    }
    return new SigstoreBundle(root.get("mediaType").asText(), root, json, envelope, entries);
  }

  public String mediaType() {
    return mediaType;
  }

  public String json() {
    return json;
  }

  @JsonValue
  public JsonNode toJson() {
    return root;
  }

  public Optional<DsseEnvelope> dsseEnvelope() {
    return Optional.ofNullable(dsseEnvelope);
  }

  public List<TlogEntry> tlogEntries() {
    return tlogEntries;
  }

  public int rfc3161TimestampCount() {
    return root.path("verificationMaterial").path("timestampVerificationData").path("rfc3161Timestamps").size();
  }

  /**
   * DER bytes of the signing (leaf) certificate. Bundles v0.3 carry a single {@code certificate},
   * earlier versions an {@code x509CertificateChain} whose first element is the leaf.
   */
  public Optional<byte[]> leafCertificate() {
    JsonNode material = root.path("verificationMaterial");
    JsonNode rawBytes = material.path("certificate").path("rawBytes");
    if (!rawBytes.isTextual()) {
      rawBytes = material.path("x509CertificateChain").path("certificates").path(0).path("rawBytes");
    }
    if (!rawBytes.isTextual()) {
      return Optional.empty();
    }
    return Optional.of(Base64.getDecoder().decode(rawBytes.asText()));
  }

  public static final class TlogEntry {

    private final Long logIndex;
    private final String logId;
    private final long integratedTime;
    private final boolean inclusionProof;
    private final boolean inclusionPromise;

    private TlogEntry(Long logIndex, String logId, long integratedTime, boolean inclusionProof, boolean inclusionPromise) {
      this.logIndex = logIndex;
      this.logId = logId;
      this.integratedTime = integratedTime;
      this.inclusionProof = inclusionProof;
      this.inclusionPromise = inclusionPromise;
    }

    // int64 fields are rendered as strings by the protobuf JSON mapping
    static TlogEntry from(JsonNode entry) {
      JsonNode index = entry.path("logIndex");
      Long logIndex = index.isMissingNode() || index.isNull() ? null : index.asLong();
      String logId = entry.path("logId").path("keyId").isTextual() ? entry.path("logId").path("keyId").asText() : null;
      return new TlogEntry(
          logIndex,
          logId,
          entry.path("integratedTime").asLong(0),
          entry.path("inclusionProof").isObject(),
          entry.path("inclusionPromise").isObject());
    }

    @Nullable
    public Long logIndex() {
      return logIndex;
    }

    @Nullable
    public String logId() {
      return logId;
    }

    public long integratedTime() {
      return integratedTime;
    }

    public boolean hasInclusionProof() {
      return inclusionProof;
    }

    public boolean hasInclusionPromise() {
      return inclusionPromise;
    }
  }
}
