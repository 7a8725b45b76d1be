package ca.gc.cra.hashmatch.config;

import ca.gc.cra.hashmatch.application.pipeline.MatchPipelineUseCase;
import ca.gc.cra.hashmatch.application.port.CandidateSource;
import ca.gc.cra.hashmatch.application.port.ClockPort;
import ca.gc.cra.hashmatch.application.port.DigestPort;
import ca.gc.cra.hashmatch.application.port.MetricsPort;
import ca.gc.cra.hashmatch.application.port.ReportWriterPort;
import ca.gc.cra.hashmatch.infrastructure.digest.JcaDigestAdapter;
import ca.gc.cra.hashmatch.infrastructure.persistence.JsonReportWriter;
import ca.gc.cra.hashmatch.infrastructure.source.CsvCandidateSource;
import ca.gc.cra.hashmatch.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.hashmatch.logging.PipelineLog;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the match use case to its concrete adapters.
 * <p><strong>Role:</strong> The only place that knows which digest, source, writer and clock implementations are
 * in use.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods allocate new graphs.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final MatchConfig config;
  private final MetricsPort metrics;
  private final PipelineLog log;
  private final ClockPort clock;

  /**
   * Creates a composition root using the system clock.
   *
   * @param config validated match configuration
   * @param metrics metrics sink shared by every component
   * @param log shared pipeline log
   */
  public CompositionRoot(MatchConfig config, MetricsPort metrics, PipelineLog log) {
    this(config, metrics, log, new SystemClockAdapter());
  }

  CompositionRoot(MatchConfig config, MetricsPort metrics, PipelineLog log, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.log = Objects.requireNonNull(log, "log");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the CSV source for the configured input file.
   *
   * @return candidate source
   */
  public CandidateSource candidateSource() {
    return new CsvCandidateSource(config.input(), config.inputEncoding(), config.inputDelimiter());
  }

  /**
   * Builds the per-worker digest factory.
   *
   * @return digest factory salted from the target when PBKDF2 is selected
   */
  public DigestPort.Factory digestFactory() {
    return JcaDigestAdapter.factory(config.digest(), config.target());
  }

  /**
   * Builds the JSON report writer.
   *
   * @return report writer targeting the configured results file
   */
  public ReportWriterPort reportWriter() {
    return new JsonReportWriter(config.results());
  }

  /**
   * Builds the match use case.
   *
   * @return use case ready to run
   */
  public MatchPipelineUseCase matchUseCase() {
    MatchPipelineUseCase.Settings settings = new MatchPipelineUseCase.Settings(
        config.workers(), config.chunkSize(), config.pollTimeout(), config.target());
    return new MatchPipelineUseCase(settings, digestFactory(), reportWriter(), log, metrics, clock);
  }
}
