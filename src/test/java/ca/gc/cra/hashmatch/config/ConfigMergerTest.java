package ca.gc.cra.hashmatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private final Map<String, String> matchDefaults = DefaultsForMode.asFlatMap("match");

  @Test
  void cliOverridesYamlOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "match",
        Optional.of(Map.of("workers", "4", "chunkSize", "50")),
        Map.of("workers", "2"),
        matchDefaults,
        warnings::add);

    assertEquals("2", effective.get("workers"));
    assertEquals("50", effective.get("chunkSize"));
    assertEquals("SHA256", effective.get("algorithm"));
    assertEquals(List.of("CLI overrides YAML for key: workers"), warnings);
  }

  @Test
  void unknownYamlKeyWarnsAndIsDropped() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "match", Optional.of(Map.of("colour", "blue")), Map.of(), matchDefaults, warnings::add);

    assertFalse(effective.containsKey("colour"));
    assertEquals(List.of("Ignoring unknown match YAML key: colour"), warnings);
  }

  @Test
  void unknownCliKeyIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "match", Optional.empty(), Map.of("colour", "blue"), matchDefaults, null));

    assertEquals("unknown match argument: colour", ex.getMessage());
  }

  @Test
  void saltRequiresPbkdf2() {
    Map<String, String> digestDefaults = DefaultsForMode.asFlatMap("digest");

    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "digest", Optional.empty(), Map.of("salt", "00ff"), digestDefaults, null));
    Map<String, String> ok = ConfigMerger.buildEffectiveConfig(
        "digest", Optional.empty(), Map.of("salt", "00ff", "algorithm", "PBKDF2"), digestDefaults, null);
    assertEquals("00ff", ok.get("salt"));
  }

  @Test
  void otelEndpointRequiresOtlpExporter() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "match", Optional.empty(), Map.of("otelEndpoint", "http://collector:4317"), matchDefaults, null));
    ConfigMerger.buildEffectiveConfig("match", Optional.empty(),
        Map.of("otelEndpoint", "http://collector:4317", "metricsExporter", "otlp"), matchDefaults, null);
  }

  @Test
  void defaultsExposeEveryRecognisedKey() {
    assertTrue(matchDefaults.keySet().containsAll(
        List.of("input", "target", "algorithm", "workers", "chunkSize", "results", "log", "dryRun")));
    assertEquals("none", matchDefaults.get("metricsExporter"));
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("serve"));
  }
}
