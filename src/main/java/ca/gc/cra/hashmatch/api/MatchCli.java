package ca.gc.cra.hashmatch.api;

import ca.gc.cra.hashmatch.application.pipeline.MatchPipelineUseCase;
import ca.gc.cra.hashmatch.application.pipeline.PipelineOutcome;
import ca.gc.cra.hashmatch.config.CompositionRoot;
import ca.gc.cra.hashmatch.config.DefaultsForMode;
import ca.gc.cra.hashmatch.config.MatchConfig;
import ca.gc.cra.hashmatch.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.hashmatch.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.hashmatch.logging.LoggingConfigurator;
import ca.gc.cra.hashmatch.logging.PipelineLog;
import ca.gc.cra.hashmatch.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point for the {@code match} command: digest every candidate of a file and report those matching the
 * target.
 */
public final class MatchCli {
  private static final Logger log = LoggerFactory.getLogger(MatchCli.class);
  private static final Set<String> KNOWN_FLAGS = Set.of("--dry-run", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: match input=PATH target=HEX [algorithm=SHA256|SHA384|SHA512|PBKDF2] [workers=N] "
          + "[chunkSize=N] [results=PATH] [log=PATH] [config=PATH] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      HASHMATCH match pipeline

      Usage:
        match input=PATH target=HEX [options]

      Required:
        input=PATH                 Candidate file; the first column of each row is one candidate
        target=HEX                 Target digest (PBKDF2: <saltHex>$<keyHex>)

      Options:
        algorithm=NAME             SHA256 (default), SHA384, SHA512 or PBKDF2
        pbkdf2Iterations=N         PBKDF2 iteration count (default 100000)
        pbkdf2SaltLength=N         PBKDF2 salt length in bytes (default 32)
        workers=N                  Parallel workers, 1..256 (default: available processors)
        chunkSize=N                Candidates per chunk, 1..1000000 (default 1000)
        pollTimeoutMillis=N        Worker poll timeout, 1..60000 (default 5000)
        inputEncoding=CHARSET      Candidate file encoding (default UTF-8)
        inputDelimiter=C           Candidate file delimiter (default ','; 'tab' for tab)
        results=PATH               JSON report (default out/results.json)
        log=PATH                   Pipeline log file (default logs/hashmatch.log)
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V,...
        config=PATH                YAML file with 'common' and 'match' sections
        --dry-run                  Validate inputs and print the plan without hashing
        --allow-overwrite          Replace an existing results file
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Exit codes:
        0 success, 2 invalid arguments, 3 I/O error, 4 setup error, 5 processing failure, 130 interrupted
      """;

  private MatchCli() {}

  /**
   * Runs the command and exits the JVM with its exit code.
   *
   * @param args command arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for match CLI");
    }
    List<String> unknownFlags = input.unknownFlags(KNOWN_FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      if (input.hasFlag("--dry-run")) {
        kv.put("dryRun", "true");
      }
      if (input.hasFlag("--allow-overwrite")) {
        kv.put("allowOverwrite", "true");
      }
      effective = ConfigCliUtils.effectiveConfig(DefaultsForMode.MODE_MATCH, kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid match arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean verbose = input.verbose() || ConfigCliUtils.parseBoolean(effective, "verbose");
    MatchConfig config;
    TelemetrySettings telemetry;
    try {
      config = MatchConfig.fromMap(effective);
      telemetry = TelemetryConfigurator.fromConfig(effective);
      validatePaths(config, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid match configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, telemetry);
      return ExitCode.SUCCESS;
    }

    try {
      LoggingConfigurator.configureSink(config.log(), verbose);
    } catch (IOException ex) {
      log.error("Unable to open log file {}", config.log(), ex);
      return ExitCode.IO_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry)) {
      PipelineLog pipelineLog = PipelineLog.create();
      CompositionRoot root = new CompositionRoot(config, metrics, pipelineLog);
      MatchPipelineUseCase useCase = root.matchUseCase();
      log.info("Configured match pipeline: input={}, algorithm={}, workers={}, chunkSize={}, results={}",
          config.input(), config.digest().algorithm(), config.workers(), config.chunkSize(), config.results());
      PipelineOutcome outcome = useCase.run(root.candidateSource());
      printSummary(outcome, config);
      if (!outcome.processingSucceeded()) {
        log.error("Match pipeline processing failed; see log for worker errors");
        return ExitCode.RUNTIME_FAILURE;
      }
      if (!outcome.persisted()) {
        log.error("Match pipeline finished but results were not saved to {}", config.results());
        return ExitCode.IO_ERROR;
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read candidates from {}", config.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Match pipeline setup error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Match pipeline interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in match pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void validatePaths(MatchConfig config, boolean createParents) {
    Paths.validateReadableFile("input", config.input());
    Path results = Paths.validateWritableFile("results", config.results(), createParents, config.allowOverwrite());
    Path logFile = Paths.validateWritableFile("log", config.log(), createParents, true);
    if (results.equals(logFile)) {
      throw new IllegalArgumentException("results and log must be different files");
    }
  }

  private static void printDryRunPlan(MatchConfig config, TelemetrySettings telemetry) {
    CliPrinter.printLines(
        "Match dry-run: no candidates will be hashed.",
        " Input            : " + config.input().toAbsolutePath()
            + " (" + config.inputEncoding().name() + ", delimiter '" + config.inputDelimiter() + "')",
        " Algorithm        : " + config.digest().algorithm()
            + (config.digest().algorithm().salted()
                ? " (" + config.digest().pbkdf2Iterations() + " iterations)" : ""),
        " Target           : " + config.target().value(),
        " Workers          : " + config.workers(),
        " Chunk size       : " + config.chunkSize(),
        " Poll timeout     : " + config.pollTimeout().toMillis() + " ms",
        " Results          : " + config.results().toAbsolutePath(),
        " Log              : " + config.log().toAbsolutePath(),
        " Metrics exporter : " + telemetry.exporter(),
        " Allow overwrite  : " + config.allowOverwrite(),
        " Re-run without --dry-run to start matching.");
  }

  private static void printSummary(PipelineOutcome outcome, MatchConfig config) {
    CliPrinter.printLines(
        "Items processed : " + outcome.itemsProcessed(),
        "Matches found   : " + outcome.report().totalMatches(),
        "Results         : " + (outcome.persisted() ? config.results().toAbsolutePath() : "<not saved>"));
  }
}
