package dev.evidence.report;

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

import dev.evidence.InvalidEvidenceInputException;
import dev.evidence.VerificationFailedException;
import dev.evidence.model.EvidenceVerification;
import dev.evidence.model.VerificationResponse;
import dev.evidence.model.VerificationStatus;
import java.io.PrintStream;

public abstract class ReportPrinterSupport implements ReportPrinter {

  protected final PrintStream out;

  protected ReportPrinterSupport(PrintStream out) {
    this.out = out;
  }

  @Override
  public void print(VerificationResponse response) throws InvalidEvidenceInputException, VerificationFailedException {
    if (response == null) {
      throw new InvalidEvidenceInputException("verification response is empty");
    }
    write(response);
    out.flush();
    if (response.isFailed()) {
      throw new VerificationFailedException(response);
    }
  }

  protected abstract void write(VerificationResponse response);

  protected static String status(VerificationStatus status) {
    return status == VerificationStatus.SUCCESS ? "success" : "failed";
  }

  protected static String status(EvidenceVerification verification) {
    return verification.isVerified() ? "success" : "failed";
  }

  protected static String orDash(Object value) {
    return value == null || value.toString().isEmpty() ? "-" : value.toString();
  }
}
