/**
 * JDBC store adapter: schema migration, per-transaction connections, and SQL failure classification.
 *
 * @since 0.1.0
 */
package ca.gc.cra.textpipe.infrastructure.persistence.jdbc;
