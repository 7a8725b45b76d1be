package ca.gc.cra.hashmatch.infrastructure.persistence;

import ca.gc.cra.hashmatch.application.port.ReportWriterPort;
import ca.gc.cra.hashmatch.domain.match.MatchReport;
import ca.gc.cra.hashmatch.domain.match.MatchResult;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Writes a {@link MatchReport} as pretty-printed UTF-8 JSON.
 *
 * <p>Layout: {@code {"total_matches": n, "matches": [{"worker_id", "original", "hash", "algorithm"}, ...]}}. The
 * report is written to a sibling temporary file and moved into place, so a failed write never leaves a truncated
 * report behind.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportWriter implements ReportWriterPort {
  private final JsonFactory jsonFactory = new JsonFactory();
  private final Path target;

  /**
   * Creates a writer targeting {@code target}.
   *
   * @param target report file; parent directories are created on write
   */
  public JsonReportWriter(Path target) {
    this.target = Objects.requireNonNull(target, "target").toAbsolutePath();
  }

  @Override
  public synchronized void write(MatchReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(tmp);
          JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
        gen.useDefaultPrettyPrinter();
        writeReport(gen, report);
      }
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  private static void writeReport(JsonGenerator gen, MatchReport report) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("total_matches", report.totalMatches());
    gen.writeArrayFieldStart("matches");
    for (MatchResult match : report.matches()) {
      gen.writeStartObject();
      gen.writeNumberField("worker_id", match.workerId());
      gen.writeStringField("original", match.original());
      gen.writeStringField("hash", match.hash());
      gen.writeStringField("algorithm", match.algorithm().name());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  @Override
  public String describe() {
    return target.toString();
  }
}
