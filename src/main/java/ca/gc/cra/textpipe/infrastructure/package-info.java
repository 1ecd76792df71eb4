/**
 * <strong>Purpose:</strong> Adapters for stores, metrics, worker pools, and file input.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.infrastructure;
