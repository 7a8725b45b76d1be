package ca.gc.cra.hashmatch.config;

import ca.gc.cra.hashmatch.domain.digest.DigestSettings;
import ca.gc.cra.hashmatch.domain.digest.HashAlgorithm;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The key set returned here is also the set of keys a mode understands; {@link ConfigMerger} warns about
 * anything else.</p>
 */
public final class DefaultsForMode {
  public static final String MODE_MATCH = "match";
  public static final String MODE_DIGEST = "digest";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode {@code match} or {@code digest}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case MODE_MATCH -> buildMatchDefaults();
      case MODE_DIGEST -> buildDigestDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("algorithm", HashAlgorithm.SHA256.name());
    map.put("pbkdf2Iterations", Integer.toString(DigestSettings.DEFAULT_PBKDF2_ITERATIONS));
    map.put("pbkdf2SaltLength", Integer.toString(DigestSettings.DEFAULT_PBKDF2_SALT_LENGTH));
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildMatchDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("input", "");
    map.put("inputEncoding", MatchConfig.DEFAULT_INPUT_ENCODING.name());
    map.put("inputDelimiter", String.valueOf(MatchConfig.DEFAULT_INPUT_DELIMITER));
    map.put("target", "");
    map.put("workers", Integer.toString(MatchConfig.defaultWorkers()));
    map.put("chunkSize", Integer.toString(MatchConfig.DEFAULT_CHUNK_SIZE));
    map.put("pollTimeoutMillis", Long.toString(MatchConfig.DEFAULT_POLL_TIMEOUT.toMillis()));
    map.put("results", MatchConfig.DEFAULT_RESULTS.toString());
    map.put("log", MatchConfig.DEFAULT_LOG.toString());
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildDigestDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("value", "");
    map.put("salt", "");
    return map;
  }
}
