package dev.evidence.dsse;

import dev.evidence.KeyLoadingException;
import java.nio.file.Path;
import java.security.PublicKey;

/**
 * Turns PEM encoded public keys into {@link PublicKey} instances.
 */
public interface PublicKeyLoader {

  PublicKey loadFromFile(Path path) throws KeyLoadingException;

  PublicKey loadFromPem(String pem) throws KeyLoadingException;
}
