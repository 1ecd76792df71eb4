/**
 * <strong>Purpose:</strong> Pipeline orchestration: sequencing stages, retrying transient failures, and running
 * batches in parallel.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.textpipe.application.pipeline.TextPipeline} is immutable and
 * shared across batch workers.
 * <p><strong>Observability:</strong> Logs carry the {@code traceId} and {@code stage} MDC keys.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.application.pipeline;
