package ca.gc.cra.hashmatch.application.pipeline;

import ca.gc.cra.hashmatch.domain.match.WorkerStats;
import java.util.Objects;

/**
 * Signals that a digest worker exited without consuming its shutdown marker. Carries the counters the worker had
 * accumulated so result accounting stays exact.
 *
 * @since 0.1.0
 */
public final class WorkerFailureException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient WorkerStats partialStats;

  /**
   * Creates the exception.
   *
   * @param partialStats counters accumulated before the failure
   * @param cause failure that stopped the worker
   */
  public WorkerFailureException(WorkerStats partialStats, Throwable cause) {
    super("Worker " + partialStats.workerId() + " failed: " + cause.getMessage(), cause);
    this.partialStats = Objects.requireNonNull(partialStats, "partialStats");
  }

  /**
   * Returns the counters accumulated before the failure.
   *
   * @return partial worker statistics
   */
  public WorkerStats partialStats() {
    return partialStats;
  }
}
