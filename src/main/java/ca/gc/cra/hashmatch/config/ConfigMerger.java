package ca.gc.cra.hashmatch.config;

import ca.gc.cra.hashmatch.domain.digest.HashAlgorithm;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and cross-field rules.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode; also the set of recognised keys
   * @param warn consumer receiving override and unknown-key warnings
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when cross-field validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> sink = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(entry.getKey())) {
        sink.accept("Ignoring unknown " + mode + " YAML key: " + entry.getKey());
        continue;
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(key)) {
        throw new IllegalArgumentException("unknown " + mode + " argument: " + key);
      }
      if (yamlCopy.containsKey(key)) {
        sink.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    HashAlgorithm algorithm = HashAlgorithm.fromString(effective.getOrDefault("algorithm", "SHA256"));
    String salt = trim(effective.get("salt"));
    if (!salt.isEmpty() && !algorithm.salted()) {
      throw new IllegalArgumentException("salt is only valid with algorithm PBKDF2 (was " + algorithm + ")");
    }
    if (DefaultsForMode.MODE_MATCH.equalsIgnoreCase(mode)) {
      String exporter = trim(effective.get("metricsExporter"));
      if (trim(effective.get("otelEndpoint")).length() > 0 && !"otlp".equalsIgnoreCase(exporter)) {
        throw new IllegalArgumentException("otelEndpoint requires metricsExporter=otlp");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
