/**
 * Metrics adapters implementing {@link ca.gc.cra.hashmatch.application.port.MetricsPort}.
 * <p><strong>Role:</strong> Adapter layer bridging pipeline counters to OpenTelemetry.</p>
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; every worker records through the same instance.</p>
 */
package ca.gc.cra.hashmatch.infrastructure.metrics;
