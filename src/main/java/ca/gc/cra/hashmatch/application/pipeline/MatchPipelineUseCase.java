package ca.gc.cra.hashmatch.application.pipeline;

import ca.gc.cra.hashmatch.application.port.CandidateSource;
import ca.gc.cra.hashmatch.application.port.CandidateSource.CandidateBatch;
import ca.gc.cra.hashmatch.application.port.ClockPort;
import ca.gc.cra.hashmatch.application.port.DigestPort;
import ca.gc.cra.hashmatch.application.port.MetricsPort;
import ca.gc.cra.hashmatch.application.port.ReportWriterPort;
import ca.gc.cra.hashmatch.domain.digest.TargetDigest;
import ca.gc.cra.hashmatch.domain.match.MatchReport;
import ca.gc.cra.hashmatch.domain.work.Chunk;
import ca.gc.cra.hashmatch.domain.work.Task;
import ca.gc.cra.hashmatch.logging.PipelineLog;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Orchestrates one matching run: chunk, fan out to the worker pool, fan in through the
 * result store, collect and persist.
 * <p><strong>Why:</strong> Owns the ordering guarantees between stages. Chunks are queued before the shutdown
 * markers, exactly one marker is queued per worker, and the store is frozen before the collector reads it.</p>
 * <p><strong>Role:</strong> Application use case; adapters are injected through ports.</p>
 * <p><strong>Thread-safety:</strong> a single instance runs one pipeline at a time.</p>
 *
 * @since 0.1.0
 */
public final class MatchPipelineUseCase {
  private final Settings settings;
  private final DigestPort.Factory digestFactory;
  private final ReportWriterPort reportWriter;
  private final PipelineLog log;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the use case.
   *
   * @param settings validated run settings
   * @param digestFactory creates one digest instance per worker
   * @param reportWriter destination of the report
   * @param log shared pipeline log
   * @param metrics metrics sink
   * @param clock time source
   */
  public MatchPipelineUseCase(
      Settings settings,
      DigestPort.Factory digestFactory,
      ReportWriterPort reportWriter,
      PipelineLog log,
      MetricsPort metrics,
      ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.digestFactory = Objects.requireNonNull(digestFactory, "digestFactory");
    this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
    this.log = Objects.requireNonNull(log, "log");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Reads the candidates from {@code source} and runs the pipeline on them.
   *
   * @param source candidate source
   * @return run verdict
   * @throws IOException if the source cannot be read; no chunk is submitted
   * @throws InterruptedException if the calling thread is interrupted while waiting for workers
   */
  public PipelineOutcome run(CandidateSource source) throws IOException, InterruptedException {
    Objects.requireNonNull(source, "source");
    CandidateBatch batch = source.read();
    log.info("Loaded {} candidates ({} records read)", batch.validRecords(), batch.totalRecords());
    if (batch.invalidRecords() > 0) {
      log.warning("Skipped {} empty or invalid records", batch.invalidRecords());
    }
    return execute(batch);
  }

  /**
   * Runs the pipeline on an in-memory candidate list.
   *
   * @param candidates candidates in input order
   * @return run verdict
   * @throws InterruptedException if the calling thread is interrupted while waiting for workers
   */
  public PipelineOutcome run(List<String> candidates) throws InterruptedException {
    return execute(CandidateBatch.of(Objects.requireNonNull(candidates, "candidates")));
  }

  private PipelineOutcome execute(CandidateBatch batch) throws InterruptedException {
    MDC.put("pipeline", "match");
    long startNanos = clock.nanoTime();
    try {
      List<String> candidates = batch.candidates();
      log.info("Starting match pipeline: {} candidates, {} workers, chunk size {}, algorithm {}",
          candidates.size(), settings.workers(), settings.chunkSize(), settings.target().algorithm());

      TaskChannel channel = new TaskChannel();
      ResultStore store = new ResultStore();
      WorkerPool pool = new WorkerPool(
          new WorkerPool.Settings(settings.workers(), settings.pollTimeout()),
          channel, store, digestFactory, settings.target(), log, metrics, clock);
      pool.start();

      WorkerPool.PoolResult poolResult;
      try {
        int chunks = 0;
        for (Chunk chunk : Chunker.chunk(candidates, settings.chunkSize())) {
          channel.submit(Task.work(chunk));
          metrics.increment("match.chunks.submitted");
          chunks++;
        }
        log.info("Submitted {} chunks", chunks);
        channel.broadcastShutdown(settings.workers());
        metrics.observe("match.channel.depth", channel.approximateSize());
        pool.drain();
        poolResult = pool.awaitTermination();
      } catch (RuntimeException ex) {
        pool.abort();
        throw ex;
      }
      store.freeze();

      boolean processingOk = poolResult.succeeded();
      if (!processingOk) {
        log.error("{} worker(s) exited abnormally; results may be incomplete", poolResult.failures().size());
      }
      if (store.size() != poolResult.totalMatches()) {
        log.critical("Result store holds {} matches but workers reported {}",
            store.size(), poolResult.totalMatches());
        processingOk = false;
      }

      Collector collector = new Collector(reportWriter, log, metrics);
      Collector.CollectionOutcome collected = collector.collectAndPersist(store);
      MatchReport report = collected.report();
      collector.logReport(report);

      Duration elapsed = Duration.ofNanos(Math.max(0L, clock.nanoTime() - startNanos));
      log.pipelineSummary(elapsed, poolResult.totalItems(), report.totalMatches());
      if (poolResult.totalFailures() > 0) {
        log.warning("{} candidates could not be digested and were skipped", poolResult.totalFailures());
      }
      return new PipelineOutcome(
          processingOk,
          collected.persisted(),
          report,
          poolResult.stats(),
          elapsed,
          batch,
          collected.failure());
    } finally {
      MDC.remove("pipeline");
    }
  }

  /**
   * Run settings.
   *
   * @param workers number of parallel workers, {@code >= 1}
   * @param chunkSize maximum candidates per chunk, {@code >= 1}
   * @param pollTimeout worker poll timeout, positive
   * @param target normalized target digest
   */
  public record Settings(int workers, int chunkSize, Duration pollTimeout, TargetDigest target) {
    /** Validates the settings. */
    public Settings {
      if (workers < 1) {
        throw new IllegalArgumentException("workers must be >= 1 (was " + workers + ")");
      }
      if (chunkSize < 1) {
        throw new IllegalArgumentException("chunkSize must be >= 1 (was " + chunkSize + ")");
      }
      Objects.requireNonNull(pollTimeout, "pollTimeout");
      if (pollTimeout.isNegative() || pollTimeout.isZero()) {
        throw new IllegalArgumentException("pollTimeout must be positive");
      }
      Objects.requireNonNull(target, "target");
    }
  }
}
