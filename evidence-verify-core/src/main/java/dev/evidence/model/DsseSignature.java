package dev.evidence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import javax.annotation.Nullable;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableDsseSignature.class)
@JsonDeserialize(as = ImmutableDsseSignature.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class DsseSignature {

  @Nullable
  @JsonProperty("keyid")
  public abstract String keyId();

  @JsonProperty("sig")
  public abstract String sig(); // b64

  public byte[] decodedSig() {
    return DsseEnvelope.decodeBase64(sig());
  }
}
