package dev.evidence.report;

import dev.evidence.InvalidEvidenceInputException;
import dev.evidence.VerificationFailedException;
import dev.evidence.model.VerificationResponse;

public interface ReportPrinter {

  /**
   * Writes the report. Throws {@link VerificationFailedException} after writing when the overall
   * status is failed.
   */
  void print(VerificationResponse response) throws InvalidEvidenceInputException, VerificationFailedException;
}
