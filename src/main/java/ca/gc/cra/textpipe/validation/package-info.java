/**
 * <strong>Purpose:</strong> Argument and configuration validation helpers.
 * <p><strong>Observability:</strong> Failures raise {@link java.lang.IllegalArgumentException} with the offending
 * parameter name.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.validation;
