package ca.gc.cra.hashmatch.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hashmatch.application.port.ReportWriterPort;
import ca.gc.cra.hashmatch.domain.digest.HashAlgorithm;
import ca.gc.cra.hashmatch.domain.match.MatchReport;
import ca.gc.cra.hashmatch.domain.match.MatchResult;
import ca.gc.cra.hashmatch.logging.PipelineLog;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class CollectorTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void ordersByWorkerThenOriginalThenSequence() {
    ResultStore store = new ResultStore();
    store.insert(result(2, "alpha", 1));
    store.insert(result(0, "zulu", 1));
    store.insert(result(0, "alpha", 3));
    store.insert(result(0, "alpha", 2));
    store.insert(result(1, "mike", 1));
    store.freeze();

    MatchReport report = new Collector(new CapturingWriter(), PipelineLog.create(), metrics).collect(store);

    assertEquals(5, report.totalMatches());
    assertEquals(List.of("0:alpha:2", "0:alpha:3", "0:zulu:1", "1:mike:1", "2:alpha:1"),
        report.matches().stream()
            .map(m -> m.workerId() + ":" + m.original() + ":" + m.sequence())
            .collect(Collectors.toList()));
  }

  @Test
  void ordersOriginalsByCodePoint() {
    String fullwidthA = "\uFF21";
    String grinningFace = "\uD83D\uDE00";
    ResultStore store = new ResultStore();
    store.insert(result(0, grinningFace, 1));
    store.insert(result(0, fullwidthA, 2));
    store.insert(result(0, fullwidthA + "b", 3));
    store.freeze();

    MatchReport report = new Collector(new CapturingWriter(), PipelineLog.create(), metrics).collect(store);

    assertEquals(List.of(fullwidthA, fullwidthA + "b", grinningFace),
        report.matches().stream().map(MatchResult::original).collect(Collectors.toList()));
  }

  @Test
  void refusesToReadStoreThatIsStillWritable() {
    ResultStore store = new ResultStore();
    store.insert(result(0, "alpha", 1));
    Collector collector = new Collector(new CapturingWriter(), PipelineLog.create(), metrics);

    assertThrows(IllegalStateException.class, () -> collector.collect(store));
  }

  @Test
  void persistsReportThroughWriter() {
    ResultStore store = new ResultStore();
    store.insert(result(1, "bob", 1));
    store.freeze();
    CapturingWriter writer = new CapturingWriter();

    Collector.CollectionOutcome outcome =
        new Collector(writer, PipelineLog.create(), metrics).collectAndPersist(store);

    assertTrue(outcome.persisted());
    assertTrue(outcome.failure().isEmpty());
    assertEquals(1, writer.written.size());
    assertSame(outcome.report(), writer.written.get(0));
    assertEquals(1, metrics.count("match.report.persisted"));
  }

  @Test
  void emptyStoreStillProducesReport() {
    ResultStore store = new ResultStore();
    store.freeze();
    CapturingWriter writer = new CapturingWriter();

    Collector.CollectionOutcome outcome =
        new Collector(writer, PipelineLog.create(), metrics).collectAndPersist(store);

    assertTrue(outcome.persisted());
    assertEquals(MatchReport.empty(), outcome.report());
    assertEquals(1, writer.written.size());
  }

  @Test
  void writeFailureIsReportedWithoutLosingTheReport() {
    ResultStore store = new ResultStore();
    store.insert(result(0, "bob", 1));
    store.freeze();
    ReportWriterPort failing = report -> {
      throw new IOException("disk full");
    };

    Collector.CollectionOutcome outcome =
        new Collector(failing, PipelineLog.create(), metrics).collectAndPersist(store);

    assertFalse(outcome.persisted());
    assertEquals("disk full", outcome.failure().orElseThrow().getMessage());
    assertEquals(1, outcome.report().totalMatches());
    assertEquals(1, metrics.count("match.report.failed"));
    assertEquals(0, metrics.count("match.report.persisted"));
  }

  private static MatchResult result(int worker, String original, long sequence) {
    return new MatchResult(worker, original, Sha256.hex(original), HashAlgorithm.SHA256, sequence);
  }

  private static final class CapturingWriter implements ReportWriterPort {
    private final List<MatchReport> written = new ArrayList<>();

    @Override
    public void write(MatchReport report) {
      written.add(report);
    }
  }
}
