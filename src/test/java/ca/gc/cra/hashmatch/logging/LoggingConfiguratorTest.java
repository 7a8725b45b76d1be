package ca.gc.cra.hashmatch.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoggingConfiguratorTest {
  @TempDir Path tempDir;

  @AfterEach
  void reset() {
    LoggingConfigurator.resetSinkForTesting();
  }

  @Test
  void sinkWritesFormattedRecords() throws Exception {
    Path logFile = tempDir.resolve("logs").resolve("run.log");

    LoggingConfigurator.configureSink(logFile, false);
    PipelineLog.create().info("Worker {} started processing {}", 0, "waiting for tasks");
    LoggingConfigurator.resetSinkForTesting();

    String content = Files.readString(logFile, StandardCharsets.UTF_8);
    assertTrue(content.matches(
        "(?s)\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} - INFO - \\[[^\\]]+\\] - "
            + "Worker 0 started processing waiting for tasks\\R.*"),
        content);
  }

  @Test
  void firstCallerWins() throws Exception {
    Path first = tempDir.resolve("first.log");
    Path second = tempDir.resolve("second.log");

    LoggingConfigurator.SinkSettings winner = LoggingConfigurator.configureSink(first, false);
    LoggingConfigurator.SinkSettings reused = LoggingConfigurator.configureSink(second, true);

    assertEquals(winner, reused);
    assertEquals(first.toAbsolutePath().normalize(), LoggingConfigurator.activeSink().logFile());
    PipelineLog.create().info("only one sink");
    assertTrue(Files.exists(first));
    assertTrue(Files.notExists(second));
  }

  @Test
  void resetDetachesSink() throws Exception {
    LoggingConfigurator.configureSink(tempDir.resolve("a.log"), false);
    LoggingConfigurator.resetSinkForTesting();

    assertNull(LoggingConfigurator.activeSink());
  }
}
