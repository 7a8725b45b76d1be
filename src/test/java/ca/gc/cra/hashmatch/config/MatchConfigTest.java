package ca.gc.cra.hashmatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hashmatch.domain.digest.HashAlgorithm;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MatchConfigTest {
  private static final String BOB_SHA256 =
      "81b637d8fcd2c6da6359e6963113a1170de795e4b725b84d1e0b4cfd9ec58ce9";

  @Test
  void defaultsApplyWhenOnlyRequiredKeysGiven() {
    MatchConfig config = MatchConfig.fromMap(Map.of("input", "in.csv", "target", BOB_SHA256));

    assertEquals(Path.of("in.csv"), config.input());
    assertEquals(StandardCharsets.UTF_8, config.inputEncoding());
    assertEquals(',', config.inputDelimiter());
    assertEquals(HashAlgorithm.SHA256, config.digest().algorithm());
    assertEquals(MatchConfig.defaultWorkers(), config.workers());
    assertEquals(1_000, config.chunkSize());
    assertEquals(Duration.ofSeconds(5), config.pollTimeout());
    assertEquals(MatchConfig.DEFAULT_RESULTS, config.results());
    assertEquals(MatchConfig.DEFAULT_LOG, config.log());
    assertFalse(config.allowOverwrite());
  }

  @Test
  void parsesExplicitValues() {
    Map<String, String> args = new HashMap<>();
    args.put("input", "data.tsv");
    args.put("target", BOB_SHA256.toUpperCase());
    args.put("workers", "3");
    args.put("chunkSize", "25");
    args.put("pollTimeoutMillis", "200");
    args.put("inputDelimiter", "tab");
    args.put("inputEncoding", "ISO-8859-1");
    args.put("allowOverwrite", "true");

    MatchConfig config = MatchConfig.fromMap(args);

    assertEquals(3, config.workers());
    assertEquals(25, config.chunkSize());
    assertEquals(Duration.ofMillis(200), config.pollTimeout());
    assertEquals('\t', config.inputDelimiter());
    assertEquals(StandardCharsets.ISO_8859_1, config.inputEncoding());
    assertEquals(BOB_SHA256, config.target().value());
    assertTrue(config.allowOverwrite());
  }

  @Test
  void rejectsMissingOrInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> MatchConfig.fromMap(Map.of("target", BOB_SHA256)));
    assertThrows(IllegalArgumentException.class, () -> MatchConfig.fromMap(Map.of("input", "in.csv")));
    assertThrows(IllegalArgumentException.class,
        () -> MatchConfig.fromMap(Map.of("input", "in.csv", "target", BOB_SHA256, "workers", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> MatchConfig.fromMap(Map.of("input", "in.csv", "target", BOB_SHA256, "workers", "257")));
    assertThrows(IllegalArgumentException.class,
        () -> MatchConfig.fromMap(Map.of("input", "in.csv", "target", BOB_SHA256, "chunkSize", "ten")));
    assertThrows(IllegalArgumentException.class,
        () -> MatchConfig.fromMap(Map.of("input", "in.csv", "target", BOB_SHA256, "algorithm", "MD5")));
    assertThrows(IllegalArgumentException.class,
        () -> MatchConfig.fromMap(Map.of("input", "in.csv", "target", BOB_SHA256, "inputDelimiter", ";;")));
    assertThrows(IllegalArgumentException.class,
        () -> MatchConfig.fromMap(Map.of("input", "in.csv", "target", BOB_SHA256, "inputEncoding", "no-such")));
  }

  @Test
  void targetMustFitAlgorithm() {
    assertThrows(IllegalArgumentException.class,
        () -> MatchConfig.fromMap(Map.of("input", "in.csv", "target", BOB_SHA256, "algorithm", "SHA512")));
  }
}
