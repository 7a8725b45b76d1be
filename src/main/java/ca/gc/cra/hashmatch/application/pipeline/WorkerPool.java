package ca.gc.cra.hashmatch.application.pipeline;

import ca.gc.cra.hashmatch.application.port.ClockPort;
import ca.gc.cra.hashmatch.application.port.DigestPort;
import ca.gc.cra.hashmatch.application.port.MetricsPort;
import ca.gc.cra.hashmatch.domain.digest.TargetDigest;
import ca.gc.cra.hashmatch.domain.match.WorkerStats;
import ca.gc.cra.hashmatch.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.hashmatch.logging.PipelineLog;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Supervised pool of {@link DigestWorker}s sharing one task channel and one result store.
 * <p><strong>Lifecycle:</strong> {@link PoolState#IDLE} → {@link #start()} → {@link PoolState#RUNNING} →
 * {@link #drain()} → {@link PoolState#DRAINING} → {@link #awaitTermination()} → {@link PoolState#TERMINATED}.
 * The orchestrator only collects results once the pool reports {@code TERMINATED}.</p>
 * <p><strong>Concurrency:</strong> lifecycle methods are meant for a single orchestrating thread. Workers run on
 * non-daemon threads named {@code hashmatch-worker-<n>}; each owns its own {@link DigestPort}.</p>
 * <p><strong>Failure handling:</strong> a worker that dies is reported in {@link PoolResult#failures()}; the
 * remaining workers keep running until they consume their markers.</p>
 *
 * @since 0.1.0
 */
public final class WorkerPool {
  private static final Duration ABORT_TIMEOUT = Duration.ofSeconds(5);

  private final Settings settings;
  private final TaskChannel channel;
  private final ResultStore store;
  private final DigestPort.Factory digestFactory;
  private final TargetDigest target;
  private final PipelineLog log;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.IDLE);
  private final List<Future<WorkerStats>> futures = new ArrayList<>();

  private ExecutorService executor;

  /**
   * Creates an idle pool.
   *
   * @param settings worker count and poll timeout
   * @param channel channel the workers take tasks from
   * @param store store the workers record matches in
   * @param digestFactory creates one digest instance per worker
   * @param target normalized target digest
   * @param log shared pipeline log
   * @param metrics metrics sink
   * @param clock time source for worker durations
   */
  public WorkerPool(
      Settings settings,
      TaskChannel channel,
      ResultStore store,
      DigestPort.Factory digestFactory,
      TargetDigest target,
      PipelineLog log,
      MetricsPort metrics,
      ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.store = Objects.requireNonNull(store, "store");
    this.digestFactory = Objects.requireNonNull(digestFactory, "digestFactory");
    this.target = Objects.requireNonNull(target, "target");
    this.log = Objects.requireNonNull(log, "log");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates every worker's digest instance, then launches the workers.
   *
   * <p>Digest instances are created before any thread starts, so a digest setup failure (for example an algorithm
   * the JVM does not provide) aborts the pool before a single chunk is processed.</p>
   *
   * @throws IllegalStateException if the pool is not {@link PoolState#IDLE}
   * @throws RuntimeException if a digest instance cannot be created; the pool moves to {@code TERMINATED}
   */
  public void start() {
    transition(PoolState.IDLE, PoolState.RUNNING);
    List<DigestPort> digests = new ArrayList<>(settings.workers());
    try {
      for (int i = 0; i < settings.workers(); i++) {
        digests.add(Objects.requireNonNull(digestFactory.create(), "digestFactory returned null"));
      }
    } catch (RuntimeException ex) {
      state.set(PoolState.TERMINATED);
      throw ex;
    }

    executor = ExecutorFactories.newWorkerPool(settings.workers(), "hashmatch-worker");
    for (int i = 0; i < settings.workers(); i++) {
      DigestWorker worker = new DigestWorker(
          i, channel, store, digests.get(i), target, settings.pollTimeout(), log, metrics, clock);
      futures.add(executor.submit(worker));
    }
    log.info("Started {} workers (poll timeout {} ms, algorithm {})",
        settings.workers(), settings.pollTimeout().toMillis(), target.algorithm());
  }

  /**
   * Records that every shutdown marker has been queued.
   *
   * @throws IllegalStateException if the pool is not {@link PoolState#RUNNING}
   */
  public void drain() {
    transition(PoolState.RUNNING, PoolState.DRAINING);
    log.debug("Worker pool draining; {} tasks queued", channel.approximateSize());
  }

  /**
   * Blocks until every worker has exited and gathers their statistics.
   *
   * @return statistics of every worker plus the failures of workers that died
   * @throws IllegalStateException if the pool is not {@link PoolState#DRAINING}
   * @throws InterruptedException if the orchestrating thread is interrupted; the workers are interrupted and
   *     the pool is {@code TERMINATED}
   */
  public PoolResult awaitTermination() throws InterruptedException {
    if (state.get() != PoolState.DRAINING) {
      throw new IllegalStateException("Worker pool must be DRAINING to await termination (was " + state.get() + ")");
    }
    List<WorkerStats> stats = new ArrayList<>(futures.size());
    List<Throwable> failures = new ArrayList<>();
    try {
      for (Future<WorkerStats> future : futures) {
        try {
          stats.add(future.get());
        } catch (ExecutionException ex) {
          Throwable cause = ex.getCause() == null ? ex : ex.getCause();
          failures.add(cause);
          if (cause instanceof WorkerFailureException failure) {
            stats.add(failure.partialStats());
            log.error("Worker exited abnormally: {}", cause.toString());
          } else {
            // the worker already counted channel failures before wrapping them
            metrics.increment("match.worker.failed");
            log.critical("Worker crashed with an uncaught exception", cause);
          }
        }
      }
    } catch (InterruptedException ex) {
      abort();
      throw ex;
    }
    executor.shutdown();
    state.set(PoolState.TERMINATED);
    log.debug("Worker pool terminated; {} workers reported, {} failed", stats.size(), failures.size());
    return new PoolResult(stats, failures);
  }

  /**
   * Interrupts every worker and waits briefly for them to exit. Safe to call in any state.
   */
  public void abort() {
    PoolState previous = state.getAndSet(PoolState.TERMINATED);
    if (previous == PoolState.TERMINATED || executor == null) {
      return;
    }
    log.warning("Aborting worker pool from state {}", previous);
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(ABORT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.error("Workers still running {} ms after abort", ABORT_TIMEOUT.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Returns the current lifecycle state.
   *
   * @return pool state
   */
  public PoolState state() {
    return state.get();
  }

  private void transition(PoolState expected, PoolState next) {
    if (!state.compareAndSet(expected, next)) {
      throw new IllegalStateException(
          "Worker pool must be " + expected + " to move to " + next + " (was " + state.get() + ")");
    }
  }

  /**
   * Pool tuning.
   *
   * @param workers number of parallel workers, {@code >= 1}
   * @param pollTimeout how long a worker waits on the channel before re-checking for interruption
   */
  public record Settings(int workers, Duration pollTimeout) {
    /** Validates the settings. */
    public Settings {
      if (workers < 1) {
        throw new IllegalArgumentException("workers must be >= 1 (was " + workers + ")");
      }
      Objects.requireNonNull(pollTimeout, "pollTimeout");
      if (pollTimeout.isNegative() || pollTimeout.isZero()) {
        throw new IllegalArgumentException("pollTimeout must be positive");
      }
    }
  }

  /**
   * Outcome of {@link #awaitTermination()}.
   *
   * @param stats statistics of every worker, partial for failed ones
   * @param failures causes of abnormal worker exits
   */
  public record PoolResult(List<WorkerStats> stats, List<Throwable> failures) {
    /** Freezes the lists. */
    public PoolResult {
      stats = List.copyOf(stats);
      failures = List.copyOf(failures);
    }

    /**
     * Indicates whether every worker consumed its marker and exited normally.
     *
     * @return {@code true} when no worker failed
     */
    public boolean succeeded() {
      return failures.isEmpty();
    }

    /**
     * Sums candidates digested across workers.
     *
     * @return total items processed
     */
    public long totalItems() {
      return stats.stream().mapToLong(WorkerStats::itemsProcessed).sum();
    }

    /**
     * Sums matches across workers.
     *
     * @return total matches found
     */
    public long totalMatches() {
      return stats.stream().mapToLong(WorkerStats::matchesFound).sum();
    }

    /**
     * Sums skipped candidates across workers.
     *
     * @return total per-candidate failures
     */
    public long totalFailures() {
      return stats.stream().mapToLong(WorkerStats::failures).sum();
    }
  }
}
