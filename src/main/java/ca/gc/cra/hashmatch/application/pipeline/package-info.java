/**
 * Concurrent matching pipeline: chunker, task channel, worker pool, result store and collector, wired together
 * by {@link ca.gc.cra.hashmatch.application.pipeline.MatchPipelineUseCase}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hashmatch.application.pipeline;
