package dev.evidence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * Signer key stored by the repository next to the evidence.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSigningKey.class)
@JsonDeserialize(as = ImmutableSigningKey.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class SigningKey {

  @Nullable
  public abstract String alias();

  @Nullable
  public abstract String publicKey(); // PEM
}
