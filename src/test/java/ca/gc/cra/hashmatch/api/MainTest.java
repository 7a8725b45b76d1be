package ca.gc.cra.hashmatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: hashmatch <match|digest>"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"serve"}));
    assertTrue(buffer.toString().contains("usage: hashmatch"));
  }

  @Test
  void helpWithoutCommandPrintsOverview() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("HASHMATCH command dispatcher"));
  }

  @Test
  void dispatchesToDigest() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"digest", "value=bob"}));
    assertTrue(buffer.toString().contains("81b637d8fcd2c6da6359e6963113a1170de795e4b725b84d1e0b4cfd9ec58ce9"));
  }

  @Test
  void commandNameIsCaseInsensitive() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"MATCH", "--help"}));
    assertTrue(buffer.toString().contains("HASHMATCH match pipeline"));
  }
}
