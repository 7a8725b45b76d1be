package ca.gc.cra.hashmatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsAndStripsDashes() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"input=a.csv", "--workers=4", " target = ff "});
    assertEquals("a.csv", map.get("input"));
    assertEquals("4", map.get("workers"));
    assertEquals("ff", map.get("target"));
  }

  @Test
  void keepsEverythingAfterFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=team=cra,env=test"});
    assertEquals("team=cra,env=test", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=x"}));
  }

  @Test
  void emptyValueIsKept() {
    assertEquals("", CliArgsParser.toMap(new String[] {"log="}).get("log"));
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void cliInputSeparatesFlagsFromPairs() {
    CliInput input = CliInput.parse(new String[] {"input=a.csv", "--DRY-RUN", "-v", "--bogus"});

    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--dry-run"));
    assertEquals(List.of("input=a.csv"), List.of(input.keyValueArgs()));
    assertEquals(List.of("--bogus"), input.unknownFlags(Set.of("--dry-run")));
  }
}
