package dev.evidence.report;

import java.io.PrintStream;
import java.util.Locale;

public enum ReportFormat {

  TEXT("text"),
  JSON("json"),
  MARKDOWN("markdown");

  private final String value;

  ReportFormat(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ReportFormat of(String value) {
    if (value == null || value.isBlank()) {
      return TEXT;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ReportFormat format : values()) {
      if (format.value.equals(normalized) || ("md".equals(normalized) && format == MARKDOWN)) {
        return format;
      }
    }
    throw new IllegalArgumentException(String.format("unsupported report format '%s', expected text, json or markdown", value));
  }

  public ReportPrinter printer(PrintStream out) {
    switch (this) {
      case JSON:
        return new JsonReportPrinter(out);
      case MARKDOWN:
        return new MarkdownReportPrinter(out);
      default:
        return new PlaintextReportPrinter(out);
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
