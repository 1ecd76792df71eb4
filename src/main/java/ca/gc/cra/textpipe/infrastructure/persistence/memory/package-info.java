/**
 * In-process transactional store used for {@code store=MEMORY} runs and tests.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.infrastructure.persistence.memory;
