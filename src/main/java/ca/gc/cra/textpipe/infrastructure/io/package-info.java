/**
 * File input adapters for batch submissions.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.infrastructure.io;
