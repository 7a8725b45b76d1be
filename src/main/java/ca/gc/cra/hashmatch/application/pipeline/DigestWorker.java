package ca.gc.cra.hashmatch.application.pipeline;

import ca.gc.cra.hashmatch.application.port.ClockPort;
import ca.gc.cra.hashmatch.application.port.DigestPort;
import ca.gc.cra.hashmatch.application.port.MetricsPort;
import ca.gc.cra.hashmatch.domain.digest.TargetDigest;
import ca.gc.cra.hashmatch.domain.match.MatchResult;
import ca.gc.cra.hashmatch.domain.match.WorkerStats;
import ca.gc.cra.hashmatch.domain.work.Chunk;
import ca.gc.cra.hashmatch.domain.work.Task;
import ca.gc.cra.hashmatch.logging.PipelineLog;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.MDC;

/**
 * One worker of the pool: takes tasks until it receives its shutdown marker, digesting every candidate of every
 * chunk it takes and recording matches in the result store.
 *
 * <p>A match does not stop the worker; it keeps going until its marker arrives. A candidate whose digest fails is
 * logged and skipped. A channel failure ends the worker with a {@link WorkerFailureException}.</p>
 */
final class DigestWorker implements Callable<WorkerStats> {
  private final int workerId;
  private final TaskChannel channel;
  private final ResultStore store;
  private final DigestPort digest;
  private final TargetDigest target;
  private final Duration pollTimeout;
  private final PipelineLog log;
  private final MetricsPort metrics;
  private final ClockPort clock;

  private long itemsProcessed;
  private long matchesFound;
  private long failures;

  DigestWorker(
      int workerId,
      TaskChannel channel,
      ResultStore store,
      DigestPort digest,
      TargetDigest target,
      Duration pollTimeout,
      PipelineLog log,
      MetricsPort metrics,
      ClockPort clock) {
    this.workerId = workerId;
    this.channel = Objects.requireNonNull(channel, "channel");
    this.store = Objects.requireNonNull(store, "store");
    this.digest = Objects.requireNonNull(digest, "digest");
    this.target = Objects.requireNonNull(target, "target");
    this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
    this.log = Objects.requireNonNull(log, "log");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public WorkerStats call() {
    MDC.put("worker", Integer.toString(workerId));
    long startNanos = clock.nanoTime();
    try {
      log.workerStarted(workerId, "waiting for tasks");
      while (true) {
        Optional<Task> next;
        try {
          next = channel.take(pollTimeout);
        } catch (TaskChannelException ex) {
          metrics.increment("match.worker.failed");
          log.error("Worker {} lost its task channel; exiting", workerId, ex);
          throw new WorkerFailureException(stats(startNanos), ex);
        }
        if (next.isEmpty()) {
          continue;
        }
        Task task = next.get();
        if (task instanceof Task.Shutdown) {
          log.debug("Worker {} received shutdown marker", workerId);
          break;
        } else if (task instanceof Task.Work work) {
          processChunk(work.chunk());
        } else {
          throw new IllegalStateException("Unsupported task type: " + task.getClass().getName());
        }
      }
      WorkerStats stats = stats(startNanos);
      log.workerCompleted(stats);
      return stats;
    } finally {
      MDC.remove("worker");
    }
  }

  private void processChunk(Chunk chunk) {
    long chunkStart = clock.nanoTime();
    for (String candidate : chunk.candidates()) {
      String computed;
      try {
        computed = digest.digest(candidate);
      } catch (Exception ex) {
        failures++;
        metrics.increment("match.candidates.failed");
        log.error("Worker {} error processing '{}': {}", workerId, candidate, ex.toString());
        continue;
      }
      itemsProcessed++;
      metrics.increment("match.candidates.hashed");
      if (target.matches(computed)) {
        recordMatch(candidate, computed);
      }
    }
    metrics.observe("match.chunk.latencyNanos", clock.nanoTime() - chunkStart);
    log.debug("Worker {} finished chunk {} ({} candidates)", workerId, chunk.index(), chunk.size());
  }

  private void recordMatch(String candidate, String computed) {
    long sequence = matchesFound + 1;
    MatchResult result = new MatchResult(workerId, candidate, computed, target.algorithm(), sequence);
    if (!store.insert(result)) {
      metrics.increment("match.store.collision");
      log.critical("Worker {} found key {} already present; match for '{}' not recorded",
          workerId, result.key(), candidate);
      return;
    }
    matchesFound = sequence;
    metrics.increment("match.matches.found");
    log.matchFound(workerId, candidate, computed);
  }

  private WorkerStats stats(long startNanos) {
    return new WorkerStats(
        workerId,
        itemsProcessed,
        matchesFound,
        failures,
        Duration.ofNanos(Math.max(0L, clock.nanoTime() - startNanos)));
  }
}
