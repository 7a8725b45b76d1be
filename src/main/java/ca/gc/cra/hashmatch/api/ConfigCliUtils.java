package ca.gc.cra.hashmatch.api;

import ca.gc.cra.hashmatch.config.ConfigMerger;
import ca.gc.cra.hashmatch.config.DefaultsForMode;
import ca.gc.cra.hashmatch.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared CLI plumbing for resolving the effective configuration of a command.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable argument map
   * @return configuration path or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Loads YAML (when {@code config=} was given) and merges it with defaults and CLI arguments.
   *
   * @param mode CLI mode
   * @param cli mutable CLI argument map; {@code config} is removed from it
   * @param log logger receiving merge warnings
   * @return effective configuration
   * @throws IOException if the configuration file cannot be read
   * @throws IllegalArgumentException if the file is missing or the merged configuration is invalid
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli, Logger log) throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} configuration from {}", mode, yamlPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
