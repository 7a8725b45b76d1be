package ca.gc.cra.hashmatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hashmatch.logging.LogSinks;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class MatchCliTest {
  private static final String BOB_SHA256 =
      "81b637d8fcd2c6da6359e6963113a1170de795e4b725b84d1e0b4cfd9ec58ce9";

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(MatchCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
    LogSinks.reset();
  }

  @Test
  void fullRunWritesReportAndLog() throws Exception {
    Path input = writeInput("alice,1\nbob,2\ncarol,3\n");
    Path results = tempDir.resolve("out/results.json");
    Path log = tempDir.resolve("logs/hashmatch.log");

    ExitCode code = MatchCli.run(new String[] {
        "input=" + input,
        "target=" + BOB_SHA256,
        "workers=2",
        "chunkSize=2",
        "pollTimeoutMillis=50",
        "results=" + results,
        "log=" + log});

    assertEquals(ExitCode.SUCCESS, code);
    String json = Files.readString(results, StandardCharsets.UTF_8);
    assertTrue(json.contains("\"total_matches\" : 1"), json);
    assertTrue(json.contains("\"original\" : \"bob\""), json);
    assertTrue(buffer.toString().contains("Items processed : 3"));
    assertTrue(buffer.toString().contains("Matches found   : 1"));
    String logText = Files.readString(log, StandardCharsets.UTF_8);
    assertTrue(logText.contains("FOUND MATCH: bob -> " + BOB_SHA256), logText);
    assertTrue(logText.contains("Saved 1 results to"), logText);
  }

  @Test
  void noMatchStillWritesEmptyReport() throws Exception {
    Path input = writeInput("alice\ncarol\n");
    Path results = tempDir.resolve("results.json");

    ExitCode code = MatchCli.run(new String[] {
        "input=" + input,
        "target=" + BOB_SHA256,
        "workers=1",
        "pollTimeoutMillis=50",
        "results=" + results,
        "log=" + tempDir.resolve("run.log")});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.readString(results, StandardCharsets.UTF_8).replaceAll("\\s", "")
        .equals("{\"total_matches\":0,\"matches\":[]}"));
  }

  @Test
  void dryRunPrintsPlanAndDoesNotWriteOutputs() throws Exception {
    Path input = writeInput("bob\n");
    Path results = tempDir.resolve("plan/results.json");

    ExitCode code = MatchCli.run(new String[] {
        "input=" + input,
        "target=" + BOB_SHA256,
        "results=" + results,
        "log=" + tempDir.resolve("plan/run.log"),
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Match dry-run"));
    assertTrue(Files.notExists(results.getParent()), "dry-run should not create output directories");
  }

  @Test
  void existingResultsRequireAllowOverwrite() throws Exception {
    Path input = writeInput("bob\n");
    Path results = Files.writeString(tempDir.resolve("results.json"), "{}", StandardCharsets.UTF_8);
    String[] args = {
        "input=" + input,
        "target=" + BOB_SHA256,
        "workers=1",
        "pollTimeoutMillis=50",
        "results=" + results,
        "log=" + tempDir.resolve("run.log")};

    assertEquals(ExitCode.INVALID_ARGS, MatchCli.run(args));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("--allow-overwrite")));

    String[] overwrite = Arrays.copyOf(args, args.length + 1);
    overwrite[args.length] = "--allow-overwrite";
    assertEquals(ExitCode.SUCCESS, MatchCli.run(overwrite));
    assertTrue(Files.readString(results, StandardCharsets.UTF_8).contains("bob"));
  }

  @Test
  void missingInputReturnsInvalidArgs() {
    ExitCode code = MatchCli.run(new String[] {
        "input=" + tempDir.resolve("absent.csv"),
        "target=" + BOB_SHA256});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: match"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Invalid match configuration")
            && event.getFormattedMessage().contains("input file not found")));
  }

  @Test
  void invalidTargetReturnsInvalidArgs() throws Exception {
    Path input = writeInput("bob\n");

    assertEquals(ExitCode.INVALID_ARGS, MatchCli.run(new String[] {"input=" + input, "target=xyz"}));
  }

  @Test
  void unknownFlagOrKeyReturnsInvalidArgs() throws Exception {
    Path input = writeInput("bob\n");

    assertEquals(ExitCode.INVALID_ARGS,
        MatchCli.run(new String[] {"input=" + input, "target=" + BOB_SHA256, "--turbo"}));
    assertEquals(ExitCode.INVALID_ARGS,
        MatchCli.run(new String[] {"input=" + input, "target=" + BOB_SHA256, "colour=blue"}));
  }

  @Test
  void yamlConfigSuppliesSettings() throws Exception {
    Path input = writeInput("bob\n");
    Path config = tempDir.resolve("hashmatch.yaml");
    Files.writeString(config, String.join("\n",
        "match:",
        "  input: " + input,
        "  target: " + BOB_SHA256,
        "  workers: 3",
        ""), StandardCharsets.UTF_8);

    ExitCode code = MatchCli.run(new String[] {"config=" + config, "workers=2", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains(" Workers          : 2"));
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS,
        MatchCli.run(new String[] {"config=" + tempDir.resolve("none.yaml")}));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, MatchCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("HASHMATCH match pipeline"));
  }

  private Path writeInput(String content) throws Exception {
    return Files.writeString(tempDir.resolve("candidates.csv"), content, StandardCharsets.UTF_8);
  }
}
