/**
 * Ports between the matching pipeline and its collaborators: candidate sources, digest engines, report
 * sinks, metrics, and time.
 * <p><strong>Concurrency:</strong> Each port documents whether implementations are shared across workers.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.hashmatch.application.port;
