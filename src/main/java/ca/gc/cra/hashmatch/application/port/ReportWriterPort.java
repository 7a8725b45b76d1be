package ca.gc.cra.hashmatch.application.port;

import ca.gc.cra.hashmatch.domain.match.MatchReport;
import java.io.IOException;

/**
 * <strong>What:</strong> Durable sink for the collected match report.
 * <p><strong>Role:</strong> Output port implemented by {@code JsonReportWriter}.</p>
 * <p><strong>Error handling:</strong> Failures surface as {@link IOException}; the collector reports them as a
 * persistence outcome distinct from processing success.</p>
 *
 * @since 0.1.0
 */
public interface ReportWriterPort {
  /**
   * Persists the report, replacing any previous artifact at the same location.
   *
   * @param report report to write; never {@code null}
   * @throws IOException if the artifact cannot be written
   */
  void write(MatchReport report) throws IOException;

  /**
   * Describes where reports are written, for log messages.
   *
   * @return human-readable location
   */
  default String describe() {
    return getClass().getSimpleName();
  }
}
