/**
 * <strong>Purpose:</strong> Command-line entry points ({@code process}, {@code batch}, {@code show}) and their
 * argument parsing and exit codes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.api;
