/**
 * Logging helpers: verbosity control for the CLI and bounded previews of submitted text.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.logging;
