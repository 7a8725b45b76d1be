package ca.gc.cra.hashmatch.api;

import ca.gc.cra.hashmatch.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.hashmatch.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;

/**
 * Translates the telemetry keys of the effective configuration into {@link TelemetrySettings}.
 */
final class TelemetryConfigurator {
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Reads {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   *
   * @param effective merged configuration
   * @return validated telemetry settings
   * @throws IllegalArgumentException if a value is invalid
   */
  static TelemetrySettings fromConfig(Map<String, String> effective) {
    if (effective == null || effective.isEmpty()) {
      return TelemetrySettings.disabled();
    }
    String endpoint = Strings.trimToEmpty(effective.get("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    String attributes = Strings.trimToEmpty(effective.get("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    return TelemetrySettings.of(effective.get("metricsExporter"), endpoint, attributes);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
