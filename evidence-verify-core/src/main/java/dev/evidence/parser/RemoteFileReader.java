package dev.evidence.parser;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a file from the repository. The caller closes the returned stream.
 */
public interface RemoteFileReader {

  InputStream readRemoteFile(String path) throws IOException;
}
