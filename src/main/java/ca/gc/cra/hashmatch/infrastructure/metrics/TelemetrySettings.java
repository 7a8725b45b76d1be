package ca.gc.cra.hashmatch.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Exporter selection for the OpenTelemetry meter provider.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint, used when {@code exporter} is {@link Exporter#OTLP}
 * @param resourceAttributes comma-separated {@code key=value} resource attributes; may be blank
 * @param exportInterval periodic reader interval
 * @since 0.1.0
 */
public record TelemetrySettings(
    Exporter exporter, String endpoint, String resourceAttributes, Duration exportInterval) {
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  public static final Duration DEFAULT_EXPORT_INTERVAL = Duration.ofSeconds(30);

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    Objects.requireNonNull(exportInterval, "exportInterval");
  }

  /**
   * Settings that disable export entirely.
   *
   * @return disabled settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, DEFAULT_ENDPOINT, "", DEFAULT_EXPORT_INTERVAL);
  }

  /**
   * Builds settings from configuration values.
   *
   * @param exporter {@code otlp} or {@code none}; blank means {@code none}
   * @param endpoint OTLP endpoint; blank means {@link #DEFAULT_ENDPOINT}
   * @param resourceAttributes extra resource attributes
   * @return settings
   */
  public static TelemetrySettings of(String exporter, String endpoint, String resourceAttributes) {
    return new TelemetrySettings(Exporter.parse(exporter), endpoint, resourceAttributes, DEFAULT_EXPORT_INTERVAL);
  }

  /** Supported metric exporters. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive; blank means {@code none}
     * @return exporter
     * @throws IllegalArgumentException for any other value
     */
    public static Exporter parse(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + raw + "')");
      };
    }
  }
}
