package ca.gc.cra.hashmatch.application.port;

/**
 * <strong>What:</strong> Monotonic time source used to measure worker and pipeline durations.
 * <p><strong>Why:</strong> Lets tests drive elapsed-time reporting deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; every worker reads the clock.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.hashmatch.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp in nanoseconds; only differences are meaningful.
   *
   * @return nanosecond reading
   */
  long nanoTime();
}
