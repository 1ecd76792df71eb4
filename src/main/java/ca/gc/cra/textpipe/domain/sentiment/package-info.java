/**
 * Lexicon-based sentiment scoring primitives.
 * <p><strong>Concurrency:</strong> Immutable values; lexicons are shared read-only between submissions.</p>
 */
package ca.gc.cra.textpipe.domain.sentiment;
