package ca.gc.cra.hashmatch.application.pipeline;

/**
 * Lifecycle of a {@link WorkerPool}. Transitions only move forward:
 * {@code IDLE → RUNNING → DRAINING → TERMINATED}; any state may jump to {@code TERMINATED} on abort.
 *
 * @since 0.1.0
 */
public enum PoolState {
  /** Constructed; no worker threads exist. */
  IDLE,
  /** Workers are consuming chunks. */
  RUNNING,
  /** Every shutdown marker has been queued; workers finish their remaining chunks and exit. */
  DRAINING,
  /** Every worker has exited; results may be collected. */
  TERMINATED
}
