/**
 * Match results, per-worker statistics, and the collected report.
 * <p><strong>Concurrency:</strong> Immutable records; results are shared between workers and the collector
 * only through the result store.</p>
 * <p><strong>Security:</strong> {@code original} holds the recovered candidate; treat reports as sensitive.</p>
 */
package ca.gc.cra.hashmatch.domain.match;
