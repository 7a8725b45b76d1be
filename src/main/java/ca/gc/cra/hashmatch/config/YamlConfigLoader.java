package ca.gc.cra.hashmatch.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads configuration from a YAML document and flattens it into a key/value map for one mode.
 *
 * <p>The {@code common} section applies to every mode and the section named after the mode overrides it. Nested
 * mappings are flattened with dotted keys; the sectioned layout of older configuration files
 * ({@code general.worker_count}, {@code hash.algorithm}, {@code input.csv_path}, ...) is translated to the flat
 * key names through {@link #LEGACY_KEYS}.</p>
 */
public final class YamlConfigLoader {
  static final Map<String, String> LEGACY_KEYS = Map.ofEntries(
      Map.entry("general.worker_count", "workers"),
      Map.entry("general.chunk_size", "chunkSize"),
      Map.entry("general.poll_timeout_ms", "pollTimeoutMillis"),
      Map.entry("hash.algorithm", "algorithm"),
      Map.entry("hash.target", "target"),
      Map.entry("hash.target_hash", "target"),
      Map.entry("hash.pbkdf2_iterations", "pbkdf2Iterations"),
      Map.entry("hash.salt_length", "pbkdf2SaltLength"),
      Map.entry("input.csv_path", "input"),
      Map.entry("input.csv_encoding", "inputEncoding"),
      Map.entry("input.csv_delimiter", "inputDelimiter"),
      Map.entry("output.results_file", "results"),
      Map.entry("output.log_file", "log"));

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode ({@code match} or {@code digest})
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object common = findSection(root, "common");
      if (common != null) {
        flatten(asMap(common, "common"), "", flattened);
      }
      Object modeSection = findSection(root, normalizedMode);
      if (modeSection != null) {
        flatten(asMap(modeSection, normalizedMode), "", flattened);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key.trim() : prefix + '.' + key.trim();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(LEGACY_KEYS.getOrDefault(composite, composite), value == null ? "" : value.toString());
      }
    }
  }
}
