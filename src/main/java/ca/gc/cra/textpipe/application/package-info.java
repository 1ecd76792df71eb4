/**
 * Application layer: ports, error taxonomy, stages, and orchestration.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.application;
