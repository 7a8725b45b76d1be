/**
 * Executor construction for the digest worker pool.
 * <p><strong>Concurrency:</strong> Worker threads are non-daemon so a run is never cut short by JVM exit.</p>
 */
package ca.gc.cra.hashmatch.infrastructure.exec;
