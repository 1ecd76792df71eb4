package ca.gc.cra.textpipe.application.port;

import ca.gc.cra.textpipe.domain.text.AnalyzedText;
import java.time.Duration;

/**
 * <strong>What:</strong> One transactional scope opened against a store.
 * <p><strong>Why:</strong> Gives the storage stage begin/write/commit/rollback semantics without exposing the driver.</p>
 * <p><strong>Role:</strong> Port object returned by {@link StoreConnector#begin()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write records within the transaction and report the identifier and timestamp each is stored with.</li>
 *   <li>Publish writes atomically on {@link #commit()}, discard them on {@link #rollback()}.</li>
 *   <li>Roll back on {@link #close()} when the transaction was never committed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a transaction belongs to one submission.</p>
 * <p><strong>Performance:</strong> Writes may block on network or disk I/O.</p>
 * <p><strong>Observability:</strong> Adapters log driver failures at DEBUG; callers log classified failures.</p>
 *
 * @since 0.1.0
 */
public interface StoreTransaction extends AutoCloseable {
  /**
   * Writes one analyzed record.
   *
   * @param record record to persist; must not be {@code null}
   * @param timeout upper bound for the write; adapters map it onto driver timeouts
   * @return storage identifier (unique per successful write) and the {@code storedAt} value persisted with it
   * @throws StoreException if the write fails; the transaction must then be rolled back
   */
  StoreReceipt write(AnalyzedText record, Duration timeout) throws StoreException;

  /**
   * Commits all writes of this transaction.
   *
   * @throws StoreException if the commit fails; nothing from this transaction is visible afterwards
   */
  void commit() throws StoreException;

  /**
   * Discards all writes of this transaction.
   *
   * @throws StoreException if the store cannot confirm the rollback
   */
  void rollback() throws StoreException;

  /**
   * Releases the transaction, rolling back first when it was not committed.
   *
   * @throws StoreException if releasing the underlying resources fails
   */
  @Override
  void close() throws StoreException;
}
