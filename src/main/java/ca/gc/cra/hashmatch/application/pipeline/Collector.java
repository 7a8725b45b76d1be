package ca.gc.cra.hashmatch.application.pipeline;

import ca.gc.cra.hashmatch.application.port.MetricsPort;
import ca.gc.cra.hashmatch.application.port.ReportWriterPort;
import ca.gc.cra.hashmatch.domain.match.MatchReport;
import ca.gc.cra.hashmatch.domain.match.MatchResult;
import ca.gc.cra.hashmatch.logging.PipelineLog;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Reads the frozen {@link ResultStore}, orders the matches and persists them as a
 * {@link MatchReport}.
 * <p><strong>Ordering:</strong> by worker id, then original candidate by Unicode code point, then per-worker
 * sequence. This is the only
 * deterministic ordering in the pipeline.</p>
 * <p><strong>Failure handling:</strong> persistence errors are reported in the {@link CollectionOutcome}; they never
 * change the processing verdict.</p>
 *
 * @since 0.1.0
 */
public final class Collector {
  static final Comparator<MatchResult> REPORT_ORDER = Comparator.comparingInt(MatchResult::workerId)
      .thenComparing(MatchResult::original, Collector::compareCodePoints)
      .thenComparingLong(MatchResult::sequence);

  private final ReportWriterPort writer;
  private final PipelineLog log;
  private final MetricsPort metrics;

  /**
   * Creates a collector.
   *
   * @param writer destination of the report
   * @param log shared pipeline log
   * @param metrics metrics sink
   */
  public Collector(ReportWriterPort writer, PipelineLog log, MetricsPort metrics) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.log = Objects.requireNonNull(log, "log");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the ordered report from a frozen store.
   *
   * @param store store whose writers have all terminated
   * @return ordered report
   * @throws IllegalStateException if the store is not frozen
   */
  public MatchReport collect(ResultStore store) {
    Objects.requireNonNull(store, "store");
    if (!store.isFrozen()) {
      throw new IllegalStateException("Result store must be frozen before collection");
    }
    List<MatchResult> ordered = store.snapshot();
    ordered.sort(REPORT_ORDER);
    return MatchReport.of(ordered);
  }

  /**
   * Collects the report and persists it through the configured writer.
   *
   * @param store frozen store
   * @return report plus persistence verdict
   */
  public CollectionOutcome collectAndPersist(ResultStore store) {
    log.info("Collector started");
    MatchReport report = collect(store);
    try {
      writer.write(report);
      metrics.increment("match.report.persisted");
      log.info("Saved {} results to {}", report.totalMatches(), writer.describe());
      return new CollectionOutcome(report, true, Optional.empty());
    } catch (IOException | UncheckedIOException ex) {
      metrics.increment("match.report.failed");
      log.error("Error saving results to {}: {}", writer.describe(), ex.getMessage(), ex);
      return new CollectionOutcome(report, false, Optional.of(ex));
    } finally {
      log.info("Collector finished");
    }
  }

  /**
   * Writes a human-readable summary of the report to the pipeline log.
   *
   * @param report report to summarize
   */
  public void logReport(MatchReport report) {
    Objects.requireNonNull(report, "report");
    if (report.totalMatches() == 0) {
      log.info("No matches found");
      return;
    }
    log.info("MATCHES FOUND: {}", report.totalMatches());
    int n = 1;
    for (MatchResult match : report.matches()) {
      log.info("Match #{}: worker={} original='{}' algorithm={} hash={}",
          n++, match.workerId(), match.original(), match.algorithm(), match.hash());
    }
  }

  /**
   * Result of {@link #collectAndPersist(ResultStore)}.
   *
   * @param report collected report, available even when persistence failed
   * @param persisted whether the writer succeeded
   * @param failure persistence error when {@code persisted} is {@code false}
   */
  public record CollectionOutcome(MatchReport report, boolean persisted, Optional<Exception> failure) {
    /** Validates the outcome. */
    public CollectionOutcome {
      Objects.requireNonNull(report, "report");
      Objects.requireNonNull(failure, "failure");
    }
  }

  static int compareCodePoints(String left, String right) {
    int i = 0;
    int j = 0;
    while (i < left.length() && j < right.length()) {
      int a = left.codePointAt(i);
      int b = right.codePointAt(j);
      if (a != b) {
        return Integer.compare(a, b);
      }
      i += Character.charCount(a);
      j += Character.charCount(b);
    }
    return Integer.compare(left.length() - i, right.length() - j);
  }
}
