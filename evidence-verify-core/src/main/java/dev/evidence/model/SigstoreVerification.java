package dev.evidence.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * What a successful Sigstore bundle verification established: who signed and where the signature
 * was logged. Kept on the result for auditing and reporting.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSigstoreVerification.class)
@JsonDeserialize(as = ImmutableSigstoreVerification.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class SigstoreVerification {

  @Nullable
  public abstract String signingIdentity(); // certificate SAN

  @Nullable
  public abstract String certificateIssuer();

  @Nullable
  public abstract String oidcIssuer();

  @Nullable
  public abstract Long logIndex();

  @Nullable
  public abstract String logId();

  @Nullable
  public abstract Long integratedTime(); // epoch seconds
}
