/**
 * <strong>Purpose:</strong> Configuration loading (defaults, YAML, CLI), typed pipeline settings, and wiring.
 * <p><strong>Observability:</strong> Validation failures raise {@link java.lang.IllegalArgumentException} which the
 * CLI maps to a configuration exit code.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.config;
