/**
 * <strong>Purpose:</strong> Domain model of the text pipeline.
 * <p><strong>Pipeline role:</strong> Values flowing raw -> cleaned -> analyzed -> stored.
 * <p><strong>Concurrency:</strong> Everything here is immutable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.domain;
