package dev.evidence.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.evidence.model.VerificationResponse;
import java.io.PrintStream;

/**
 * Pretty printed JSON of the whole response.
 */
public class JsonReportPrinter extends ReportPrinterSupport {

  private final ObjectMapper mapper;

  public JsonReportPrinter(PrintStream out) {
    this(out, new ObjectMapper());
  }

  public JsonReportPrinter(PrintStream out, ObjectMapper mapper) {
    super(out);
    this.mapper = mapper;
  }

  @Override
  protected void write(VerificationResponse response) {
    try {
      out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("unable to serialize verification response", e);
    }
  }
}
