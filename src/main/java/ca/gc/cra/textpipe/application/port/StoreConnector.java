package ca.gc.cra.textpipe.application.port;

import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port to the external transactional store holding processed results.
 * <p><strong>Why:</strong> Keeps the storage stage independent of the database engine and its connection management.</p>
 * <p><strong>Role:</strong> Output port on the sink side; implemented by JDBC and in-memory adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open independent transactions, one per storage call.</li>
 *   <li>Retrieve stored results by storage identifier or by source label.</li>
 *   <li>Release pooled resources on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent transactions from batch workers; any
 * coordination is the store's own concurrency control.</p>
 * <p><strong>Performance:</strong> {@link #begin()} may acquire a connection.</p>
 * <p><strong>Observability:</strong> Adapters log schema migration and connection failures.</p>
 *
 * @since 0.1.0
 */
public interface StoreConnector extends AutoCloseable {
  /**
   * Opens a new transaction.
   *
   * @return transaction owned by the caller; close it on every exit path
   * @throws StoreException if no transaction can be opened
   */
  StoreTransaction begin() throws StoreException;

  /**
   * Looks up a committed record.
   *
   * @param storageId identifier returned by {@link StoreTransaction#write}
   * @return stored record, or empty when no committed record has that identifier
   * @throws StoreException if the lookup fails
   */
  Optional<ProcessedResult> findById(String storageId) throws StoreException;

  /**
   * Lists committed records with the given source label, oldest first.
   *
   * @param source origin label
   * @return matching records; empty when none
   * @throws StoreException if the lookup fails
   */
  List<ProcessedResult> findBySource(String source) throws StoreException;

  /**
   * Releases connector resources.
   *
   * @throws StoreException if shutdown fails
   */
  @Override
  default void close() throws StoreException {}
}
