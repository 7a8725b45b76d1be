package ca.gc.cra.hashmatch.infrastructure.metrics;

import ca.gc.cra.hashmatch.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> {@link MetricsPort} that records pipeline counters and histograms through OpenTelemetry.
 * <p><strong>Naming:</strong> metric keys such as {@code match.candidates.hashed} become instrument names after
 * sanitizing; the raw key is kept as the {@code hashmatch.metric.key} attribute.</p>
 * <p><strong>Thread-safety:</strong> instruments are created lazily in concurrent maps; safe for every worker.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} flushes and shuts the provider down at the end of a run.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("hashmatch.metric.key");
  private static final String FALLBACK_METRIC_NAME = "hashmatch.metric";

  private final OpenTelemetryBootstrap.Handle handle;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting according to {@code settings}.
   *
   * @param settings exporter selection
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (handle.isNoop()) {
      return;
    }
    Counter counter = counters.computeIfAbsent(key, this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (handle.isNoop()) {
      return;
    }
    Histogram histogram = histograms.computeIfAbsent(key, this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /**
   * Indicates whether metrics are discarded.
   *
   * @return {@code true} when no exporter is active
   */
  public boolean isNoop() {
    return handle.isNoop();
  }

  void forceFlush() {
    handle.forceFlush();
  }

  /** Flushes pending metrics and shuts the meter provider down. */
  @Override
  public void close() {
    handle.forceFlush();
    handle.close();
  }

  private Counter newCounter(String key) {
    LongCounter counter = meter.counterBuilder(sanitize(key))
        .setUnit("1")
        .setDescription("Match pipeline counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram newHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitize(key))
        .ofLongs()
        .setDescription("Match pipeline observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitize(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return name.toString();
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
