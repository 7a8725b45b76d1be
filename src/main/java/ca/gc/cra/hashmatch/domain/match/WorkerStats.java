package ca.gc.cra.hashmatch.domain.match;

import java.time.Duration;
import java.util.Objects;

/**
 * Counters reported once by a worker when it consumes its shutdown marker.
 *
 * @param workerId worker identity
 * @param itemsProcessed candidates digested successfully
 * @param matchesFound candidates whose digest equalled the target
 * @param failures candidates skipped because digesting them failed
 * @param elapsed wall time between worker start and shutdown
 * @since 0.1.0
 */
public record WorkerStats(
    int workerId, long itemsProcessed, long matchesFound, long failures, Duration elapsed) {

  /** Rejects negative counters. */
  public WorkerStats {
    if (itemsProcessed < 0 || matchesFound < 0 || failures < 0) {
      throw new IllegalArgumentException("worker counters must be >= 0");
    }
    Objects.requireNonNull(elapsed, "elapsed");
  }
}
