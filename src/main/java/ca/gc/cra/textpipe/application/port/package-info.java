/**
 * <strong>Purpose:</strong> Ports between the pipeline orchestrator, its stages, and external collaborators.
 * <p><strong>Pipeline role:</strong> Stage contract plus store, metrics, and clock ports.
 * <p><strong>Concurrency:</strong> Implementations document their guarantees; stages must be stateless per call.
 * <p><strong>Observability:</strong> Metrics flow through {@link ca.gc.cra.textpipe.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.application.port;
