package dev.evidence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import javax.annotation.Nullable;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableEvidenceSubject.class)
@JsonDeserialize(as = ImmutableEvidenceSubject.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class EvidenceSubject {

  @Nullable
  public abstract String sha256();

  @Nullable
  public abstract String repositoryKey();

  @Nullable
  public abstract String path();

  @Nullable
  public abstract String name();
}
