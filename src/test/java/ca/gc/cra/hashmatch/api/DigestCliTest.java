package ca.gc.cra.hashmatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DigestCliTest {
  private final StringWriter buffer = new StringWriter();

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsSha256OfValue() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));

    assertEquals(ExitCode.SUCCESS, DigestCli.run(new String[] {"value=bob"}));
    assertEquals("81b637d8fcd2c6da6359e6963113a1170de795e4b725b84d1e0b4cfd9ec58ce9", buffer.toString().trim());
  }

  @Test
  void pbkdf2WithExplicitSaltIsDeterministic() {
    String[] args = {"value=bob", "algorithm=PBKDF2", "pbkdf2Iterations=1000", "pbkdf2SaltLength=4",
        "salt=0a0b0c0d"};
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    assertEquals(ExitCode.SUCCESS, DigestCli.run(args));
    String first = buffer.toString().trim();

    StringWriter second = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(second));
    assertEquals(ExitCode.SUCCESS, DigestCli.run(args));

    assertTrue(first.matches("0a0b0c0d\\$[0-9a-f]{64}"), first);
    assertEquals(first, second.toString().trim());
  }

  @Test
  void pbkdf2WithoutSaltGeneratesOne() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));

    assertEquals(ExitCode.SUCCESS,
        DigestCli.run(new String[] {"value=bob", "algorithm=pbkdf2", "pbkdf2Iterations=1000"}));
    assertTrue(buffer.toString().trim().matches("[0-9a-f]{64}\\$[0-9a-f]{64}"));
  }

  @Test
  void missingValueReturnsInvalidArgs() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));

    assertEquals(ExitCode.INVALID_ARGS, DigestCli.run(new String[] {"algorithm=SHA512"}));
    assertTrue(buffer.toString().contains("usage: digest"));
  }

  @Test
  void saltWithoutPbkdf2ReturnsInvalidArgs() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));

    assertEquals(ExitCode.INVALID_ARGS, DigestCli.run(new String[] {"value=bob", "salt=00"}));
  }
}
