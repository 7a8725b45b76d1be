/**
 * <strong>Purpose:</strong> Logging handle and Logback sink configuration shared by every pipeline stage.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.hashmatch.logging.PipelineLog} serializes record writes from
 * worker threads; sink configuration is a one-shot bootstrap step.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.hashmatch.logging;
