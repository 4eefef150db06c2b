package dev.evidence.sigstore;

/**
 * A well formed bundle that failed policy or cryptographic verification. Recorded on the result,
 * never propagated to the caller of the engine.
 */
public class BundleVerificationException extends Exception {

  public BundleVerificationException(String message) {
    super(message);
  }

  public BundleVerificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
