package dev.evidence.repository;

import dev.evidence.EvidenceVerificationException;
import dev.evidence.model.EvidenceMetadata;
import java.util.List;

/**
 * Finds the evidence records attached to a subject.
 */
public interface EvidenceLocator {

  List<EvidenceMetadata> locate() throws EvidenceVerificationException;
}
