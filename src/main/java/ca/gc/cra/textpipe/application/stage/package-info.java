/**
 * <strong>Purpose:</strong> Concrete pipeline stages: text cleaning, lexicon sentiment analysis, and transactional
 * storage.
 * <p><strong>Concurrency:</strong> All stages are safe for concurrent submissions.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.application.stage;
