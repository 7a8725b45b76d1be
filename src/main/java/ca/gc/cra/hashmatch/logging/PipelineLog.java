package ca.gc.cra.hashmatch.logging;

import ca.gc.cra.hashmatch.domain.match.WorkerStats;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * <strong>What:</strong> Synchronized logging handle shared by the orchestrator, workers, and collector.
 * <p><strong>Why:</strong> Worker threads log concurrently; the write lock guarantees no record is torn or
 * interleaved with another, independent of the backend's own buffering.</p>
 * <p><strong>Role:</strong> Built once by the composition root and passed explicitly to every pipeline component;
 * there is no hidden global instance.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Leveled writes (debug, info, warning, error, critical) through SLF4J.</li>
 *   <li>Pipeline-specific convenience records: worker start/completion, match found, run summary.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All writes acquire an internal {@link ReentrantLock}. The lock serializes
 * records but does not promise that record order matches real-time call order across threads.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator#configureSink(java.nio.file.Path, boolean)
 */
public final class PipelineLog {
  /** Logger name used by {@link #create()}. */
  public static final String LOGGER_NAME = "ca.gc.cra.hashmatch.pipeline";
  /** Marker attached to {@link #critical(String, Object...)} records. */
  public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

  private final Logger delegate;
  private final ReentrantLock writeLock = new ReentrantLock();

  /**
   * Wraps an SLF4J logger.
   *
   * @param delegate logger receiving the records; must not be {@code null}
   */
  public PipelineLog(Logger delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  /**
   * Creates a handle bound to {@value #LOGGER_NAME}.
   *
   * @return new pipeline log
   */
  public static PipelineLog create() {
    return new PipelineLog(LoggerFactory.getLogger(LOGGER_NAME));
  }

  /**
   * Logs at DEBUG; skipped entirely when DEBUG is disabled.
   *
   * @param format SLF4J message pattern
   * @param args pattern arguments
   */
  public void debug(String format, Object... args) {
    if (delegate.isDebugEnabled()) {
      write(log -> log.debug(format, args));
    }
  }

  /**
   * Logs at INFO.
   *
   * @param format SLF4J message pattern
   * @param args pattern arguments
   */
  public void info(String format, Object... args) {
    write(log -> log.info(format, args));
  }

  /**
   * Logs at WARN.
   *
   * @param format SLF4J message pattern
   * @param args pattern arguments
   */
  public void warning(String format, Object... args) {
    write(log -> log.warn(format, args));
  }

  /**
   * Logs at ERROR.
   *
   * @param format SLF4J message pattern
   * @param args pattern arguments
   */
  public void error(String format, Object... args) {
    write(log -> log.error(format, args));
  }

  /**
   * Logs an unrecoverable condition at ERROR with the {@link #CRITICAL} marker.
   *
   * @param format SLF4J message pattern
   * @param args pattern arguments; a trailing {@link Throwable} is logged with its stack trace
   */
  public void critical(String format, Object... args) {
    write(log -> log.error(CRITICAL, format, args));
  }

  /**
   * Records that a worker entered its take loop.
   *
   * @param workerId worker identity
   * @param detail short description of what the worker is waiting for
   */
  public void workerStarted(int workerId, String detail) {
    info("Worker {} started processing {}", workerId, detail);
  }

  /**
   * Records a worker's final counters.
   *
   * @param stats statistics produced at worker shutdown
   */
  public void workerCompleted(WorkerStats stats) {
    info(
        "Worker {} completed: {} items in {}s",
        stats.workerId(),
        stats.itemsProcessed(),
        seconds(stats.elapsed()));
  }

  /**
   * Records a confirmed match.
   *
   * @param workerId worker that found the match
   * @param original matching candidate
   * @param hash digest that equalled the target
   */
  public void matchFound(int workerId, String original, String hash) {
    info("Worker {} FOUND MATCH: {} -> {}", workerId, original, hash);
  }

  /**
   * Records the run summary as a single block so concurrent writers cannot split it.
   *
   * @param elapsed total pipeline duration
   * @param itemsProcessed candidates digested across all workers
   * @param matchesFound matches across all workers
   */
  public void pipelineSummary(Duration elapsed, long itemsProcessed, long matchesFound) {
    double secs = elapsed.toNanos() / 1_000_000_000d;
    write(log -> {
      log.info("Pipeline completed in {}s", seconds(elapsed));
      log.info("Total items processed: {}", itemsProcessed);
      log.info("Matches found: {}", matchesFound);
      if (secs > 0) {
        log.info("Processing rate: {} items/sec",
            String.format(Locale.ROOT, "%.2f", itemsProcessed / secs));
      }
    });
  }

  /**
   * Indicates whether DEBUG records would be emitted.
   *
   * @return {@code true} when the delegate accepts DEBUG
   */
  public boolean isDebugEnabled() {
    return delegate.isDebugEnabled();
  }

  private void write(Consumer<Logger> action) {
    writeLock.lock();
    try {
      action.accept(delegate);
    } finally {
      writeLock.unlock();
    }
  }

  private static String seconds(Duration duration) {
    return String.format(Locale.ROOT, "%.2f", duration.toNanos() / 1_000_000_000d);
  }
}
