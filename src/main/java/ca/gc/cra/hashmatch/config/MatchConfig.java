package ca.gc.cra.hashmatch.config;

import ca.gc.cra.hashmatch.domain.digest.DigestSettings;
import ca.gc.cra.hashmatch.domain.digest.HashAlgorithm;
import ca.gc.cra.hashmatch.domain.digest.TargetDigest;
import ca.gc.cra.hashmatch.validation.Numbers;
import ca.gc.cra.hashmatch.validation.Strings;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for the {@code match} command.
 * <p><strong>Why:</strong> Every setup error (bad target, unknown algorithm, out-of-range worker count) surfaces here,
 * before a single chunk is submitted.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param input candidate file
 * @param inputEncoding candidate file encoding
 * @param inputDelimiter candidate file field delimiter
 * @param target parsed target digest
 * @param digest algorithm and PBKDF2 parameters
 * @param workers number of parallel workers
 * @param chunkSize maximum candidates per chunk
 * @param pollTimeout worker poll timeout
 * @param results JSON report location
 * @param log pipeline log file
 * @param allowOverwrite whether an existing report may be replaced
 * @since 0.1.0
 */
public record MatchConfig(
    Path input,
    Charset inputEncoding,
    char inputDelimiter,
    TargetDigest target,
    DigestSettings digest,
    int workers,
    int chunkSize,
    Duration pollTimeout,
    Path results,
    Path log,
    boolean allowOverwrite) {
  public static final Charset DEFAULT_INPUT_ENCODING = StandardCharsets.UTF_8;
  public static final char DEFAULT_INPUT_DELIMITER = ',';
  public static final int DEFAULT_CHUNK_SIZE = 1_000;
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(5);
  public static final Path DEFAULT_RESULTS = Path.of("out", "results.json");
  public static final Path DEFAULT_LOG = Path.of("logs", "hashmatch.log");
  public static final int MAX_WORKERS = 256;
  public static final int MAX_CHUNK_SIZE = 1_000_000;
  public static final int MAX_POLL_TIMEOUT_MILLIS = 60_000;

  public MatchConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(inputEncoding, "inputEncoding");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(digest, "digest");
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("chunkSize", chunkSize, 1, MAX_CHUNK_SIZE);
    Objects.requireNonNull(pollTimeout, "pollTimeout");
    Numbers.requireRange("pollTimeoutMillis", pollTimeout.toMillis(), 1, MAX_POLL_TIMEOUT_MILLIS);
    Objects.requireNonNull(results, "results");
    Objects.requireNonNull(log, "log");
    if (target.algorithm() != digest.algorithm()) {
      throw new IllegalArgumentException("target algorithm does not match configured algorithm");
    }
  }

  /**
   * Worker count used when none is configured: the available processors, capped at {@link #MAX_WORKERS}.
   *
   * @return default worker count
   */
  public static int defaultWorkers() {
    return Math.max(1, Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors()));
  }

  /**
   * Builds a configuration from a merged key/value map.
   *
   * @param args merged configuration; see {@link DefaultsForMode} for keys
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or invalid
   */
  public static MatchConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    HashAlgorithm algorithm = HashAlgorithm.fromString(value(args, "algorithm", "SHA256"));
    DigestSettings digest = new DigestSettings(
        algorithm,
        Numbers.parseIntInRange("pbkdf2Iterations",
            value(args, "pbkdf2Iterations", Integer.toString(DigestSettings.DEFAULT_PBKDF2_ITERATIONS)),
            1, Integer.MAX_VALUE),
        Numbers.parseIntInRange("pbkdf2SaltLength",
            value(args, "pbkdf2SaltLength", Integer.toString(DigestSettings.DEFAULT_PBKDF2_SALT_LENGTH)),
            1, 1_024));
    TargetDigest target = TargetDigest.parse(Strings.requireNonBlank("target", args.getOrDefault("target", "")),
        digest);

    return new MatchConfig(
        path("input", Strings.requireNonBlank("input", args.getOrDefault("input", ""))),
        charset(value(args, "inputEncoding", DEFAULT_INPUT_ENCODING.name())),
        delimiter(value(args, "inputDelimiter", String.valueOf(DEFAULT_INPUT_DELIMITER))),
        target,
        digest,
        Numbers.parseIntInRange("workers", value(args, "workers", Integer.toString(defaultWorkers())),
            1, MAX_WORKERS),
        Numbers.parseIntInRange("chunkSize", value(args, "chunkSize", Integer.toString(DEFAULT_CHUNK_SIZE)),
            1, MAX_CHUNK_SIZE),
        Duration.ofMillis(Numbers.parseIntInRange("pollTimeoutMillis",
            value(args, "pollTimeoutMillis", Long.toString(DEFAULT_POLL_TIMEOUT.toMillis())),
            1, MAX_POLL_TIMEOUT_MILLIS)),
        path("results", value(args, "results", DEFAULT_RESULTS.toString())),
        path("log", value(args, "log", DEFAULT_LOG.toString())),
        Boolean.parseBoolean(value(args, "allowOverwrite", "false")));
  }

  private static String value(Map<String, String> args, String key, String fallback) {
    String raw = args.get(key);
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }

  private static Path path(String key, String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static Charset charset(String raw) {
    try {
      return Charset.forName(raw);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      throw new IllegalArgumentException("inputEncoding is not a supported charset: " + raw, ex);
    }
  }

  private static char delimiter(String raw) {
    String value = "\\t".equals(raw) || "tab".equalsIgnoreCase(raw) ? "\t" : raw;
    if (value.length() != 1) {
      throw new IllegalArgumentException("inputDelimiter must be a single character (was '" + raw + "')");
    }
    char c = value.charAt(0);
    if (c == '"' || c == '\n' || c == '\r') {
      throw new IllegalArgumentException("inputDelimiter must not be a quote or line break");
    }
    return c;
  }
}
