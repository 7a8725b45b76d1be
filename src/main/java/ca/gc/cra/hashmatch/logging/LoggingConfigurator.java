package ca.gc.cra.hashmatch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures HASHMATCH runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> Operators pick the log file and verbosity per run without editing {@code logback.xml}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Raise the root level to DEBUG on request.</li>
 *   <li>Attach the append-only pipeline file sink with the
 *   {@code timestamp - LEVEL - [thread] - message} record format.</li>
 * </ul>
 * <p><strong>Sink semantics:</strong> the file sink is process-wide and the first caller wins. Later calls reuse the
 * sink that is already attached, even when they pass a different path or verbosity; a warning names the ignored
 * arguments.</p>
 * <p><strong>Thread-safety:</strong> Sink attachment is guarded by an atomic reference; intended for single-threaded
 * CLI bootstrap.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain their defaults.
 * @since 0.1.0
 * @see PipelineLog
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss} - %level - [%thread] - %msg%n";
  static final String APPENDER_NAME = "HASHMATCH_FILE";

  private static final AtomicReference<SinkSettings> ACTIVE_SINK = new AtomicReference<>();

  private LoggingConfigurator() {
    // Utility
  }

  /** Elevates the root logger level to DEBUG within the running JVM. */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  /**
   * Attaches the pipeline file sink, or reuses the one attached by an earlier caller.
   *
   * @param logFile append-only log file; parent directories are created
   * @param verbose {@code true} to log DEBUG records to the file
   * @return settings of the sink actually in effect, which may differ from the arguments
   * @throws IOException if the log directory cannot be created
   */
  public static SinkSettings configureSink(Path logFile, boolean verbose) throws IOException {
    Objects.requireNonNull(logFile, "logFile");
    SinkSettings requested = new SinkSettings(logFile.toAbsolutePath().normalize(), verbose);
    SinkSettings existing = ACTIVE_SINK.get();
    if (existing != null) {
      warnIfIgnored(existing, requested);
      return existing;
    }
    Path parent = requested.logFile().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    if (!ACTIVE_SINK.compareAndSet(null, requested)) {
      SinkSettings winner = ACTIVE_SINK.get();
      warnIfIgnored(winner, requested);
      return winner;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Log sink {} requested but backend {} cannot attach appenders",
          requested.logFile(), factory.getClass().getName());
      return requested;
    }
    attachFileAppender(context, requested);
    log.debug("Attached pipeline log sink at {} (verbose={})", requested.logFile(), verbose);
    return requested;
  }

  /**
   * Returns the sink attached by the first caller, if any.
   *
   * @return active sink settings or {@code null}
   */
  public static SinkSettings activeSink() {
    return ACTIVE_SINK.get();
  }

  /** Detaches the file sink so tests can attach a fresh one. */
  static void resetSinkForTesting() {
    SinkSettings previous = ACTIVE_SINK.getAndSet(null);
    if (previous != null && LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      var appender = root.getAppender(APPENDER_NAME);
      if (appender != null) {
        root.detachAppender(appender);
        appender.stop();
      }
    }
  }

  private static void attachFileAppender(LoggerContext context, SinkSettings settings) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(FILE_PATTERN);
    encoder.start();

    FileAppender<ILoggingEvent> appender = new FileAppender<>();
    appender.setContext(context);
    appender.setName(APPENDER_NAME);
    appender.setFile(settings.logFile().toString());
    appender.setAppend(true);
    appender.setEncoder(encoder);
    if (!settings.verbose()) {
      ch.qos.logback.classic.filter.ThresholdFilter threshold =
          new ch.qos.logback.classic.filter.ThresholdFilter();
      threshold.setLevel(Level.INFO.levelStr);
      threshold.start();
      appender.addFilter(threshold);
    }
    appender.start();

    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.addAppender(appender);
    if (settings.verbose()) {
      Logger pipeline = context.getLogger(PipelineLog.LOGGER_NAME);
      pipeline.setLevel(Level.DEBUG);
    }
  }

  private static void warnIfIgnored(SinkSettings active, SinkSettings requested) {
    if (!active.equals(requested)) {
      log.warn("Log sink already attached at {} (verbose={}); ignoring request for {} (verbose={})",
          active.logFile(), active.verbose(), requested.logFile(), requested.verbose());
    }
  }

  /**
   * Settings of the attached file sink.
   *
   * @param logFile absolute log file path
   * @param verbose whether DEBUG records reach the file
   */
  public record SinkSettings(Path logFile, boolean verbose) {}
}
