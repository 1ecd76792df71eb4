/**
 * Pipeline error taxonomy: one checked exception type per stage concern plus construction-time configuration errors.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.application.error;
