package ca.gc.cra.hashmatch.application.pipeline;

import ca.gc.cra.hashmatch.application.port.CandidateSource.CandidateBatch;
import ca.gc.cra.hashmatch.domain.match.MatchReport;
import ca.gc.cra.hashmatch.domain.match.WorkerStats;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Verdict of one pipeline run.
 *
 * <p>{@code processingSucceeded} covers the worker pool and the store consistency check;
 * {@code persisted} covers the report write. The two are independent.</p>
 *
 * @param processingSucceeded every worker exited normally and the store holds exactly the reported matches
 * @param persisted the report was written
 * @param report collected matches
 * @param workerStats statistics of every worker
 * @param elapsed wall-clock duration of the run
 * @param source candidate-source statistics
 * @param persistenceFailure write error when {@code persisted} is {@code false}
 * @since 0.1.0
 */
public record PipelineOutcome(
    boolean processingSucceeded,
    boolean persisted,
    MatchReport report,
    List<WorkerStats> workerStats,
    Duration elapsed,
    CandidateBatch source,
    Optional<Exception> persistenceFailure) {

  public PipelineOutcome {
    Objects.requireNonNull(report, "report");
    workerStats = List.copyOf(workerStats);
    Objects.requireNonNull(elapsed, "elapsed");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(persistenceFailure, "persistenceFailure");
  }

  /**
   * Indicates whether both processing and persistence succeeded.
   *
   * @return {@code true} on a fully successful run
   */
  public boolean succeeded() {
    return processingSucceeded && persisted;
  }

  /**
   * Sums candidates digested across workers.
   *
   * @return items processed
   */
  public long itemsProcessed() {
    return workerStats.stream().mapToLong(WorkerStats::itemsProcessed).sum();
  }
}
