package ca.gc.cra.textpipe.application.stage;

import ca.gc.cra.textpipe.application.error.StorageException;
import ca.gc.cra.textpipe.application.error.StorageFailureKind;
import ca.gc.cra.textpipe.application.port.Stage;
import ca.gc.cra.textpipe.application.port.StageContext;
import ca.gc.cra.textpipe.application.port.StoreConnector;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.application.port.StoreReceipt;
import ca.gc.cra.textpipe.application.port.StoreTransaction;
import ca.gc.cra.textpipe.domain.text.AnalyzedText;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Final pipeline stage; persists analyzed records in one store transaction each.
 * <p><strong>Why:</strong> A submission either leaves exactly one committed record or none at all.</p>
 * <p><strong>Role:</strong> {@link Stage} from {@link AnalyzedText} to {@link ProcessedResult} wrapping a
 * {@link StoreConnector}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open a transaction, write, commit, and return the storage id and timestamp the store recorded.</li>
 *   <li>Roll back on any failure and raise a classified {@link StorageException}.</li>
 *   <li>Bound the write by the earlier of the caller deadline and the configured write timeout.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; each call has its own transaction.</p>
 * <p><strong>Performance:</strong> Blocks on store I/O; never retries internally.</p>
 * <p><strong>Observability:</strong> DEBUG on commit, WARN on rollback; rollback failures are attached as
 * suppressed exceptions.</p>
 *
 * @since 0.1.0
 */
public final class TransactionalStorageStage implements Stage<AnalyzedText, ProcessedResult> {
  private static final Logger log = LoggerFactory.getLogger(TransactionalStorageStage.class);

  /** Stage label used in logs, metrics, and errors. */
  public static final String NAME = "DatabaseStorer";

  private final StoreConnector connector;
  private final Duration writeTimeout;

  /**
   * Creates the stage.
   *
   * @param connector store connector opening one transaction per call
   * @param writeTimeout upper bound for a single write and commit; must be positive
   */
  public TransactionalStorageStage(StoreConnector connector, Duration writeTimeout) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
    if (writeTimeout.isZero() || writeTimeout.isNegative()) {
      throw new IllegalArgumentException("writeTimeout must be positive");
    }
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Class<AnalyzedText> inputType() {
    return AnalyzedText.class;
  }

  @Override
  public Class<ProcessedResult> outputType() {
    return ProcessedResult.class;
  }

  @Override
  public ProcessedResult process(AnalyzedText input, StageContext context) throws StorageException {
    Instant deadline = effectiveDeadline(context);
    StoreTransaction tx;
    try {
      tx = connector.begin();
    } catch (StoreException ex) {
      throw failure(input, context, ex.kind(), "unable to open transaction: " + ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      throw failure(input, context, StorageFailureKind.PERMANENT, "unable to open transaction: " + describe(ex), ex);
    }

    StoreReceipt receipt;
    try {
      receipt = tx.write(input, remaining(input, context, deadline, "write"));
      remaining(input, context, deadline, "commit");
      tx.commit();
    } catch (StoreException ex) {
      throw abort(tx, failure(input, context, ex.kind(), ex.getMessage(), ex));
    } catch (StorageException ex) {
      throw abort(tx, ex);
    } catch (RuntimeException ex) {
      // Unclassified adapter failures are treated as permanent.
      throw abort(tx, failure(input, context, StorageFailureKind.PERMANENT, describe(ex), ex));
    }

    try {
      tx.close();
    } catch (StoreException | RuntimeException ex) {
      log.warn("Record {} committed but releasing the transaction failed", receipt.storageId(), ex);
    }
    log.debug("Committed record {} from source '{}'", receipt.storageId(), input.source());
    return ProcessedResult.from(input, receipt.storageId(), receipt.storedAt());
  }

  private static String describe(RuntimeException ex) {
    String message = ex.getMessage();
    return (message == null || message.isBlank()) ? ex.getClass().getSimpleName() : message;
  }

  private Instant effectiveDeadline(StageContext context) {
    Instant timeoutLimit = context.clock().now().plus(writeTimeout);
    return context.deadline()
        .filter(deadline -> deadline.isBefore(timeoutLimit))
        .orElse(timeoutLimit);
  }

  private static Duration remaining(AnalyzedText input, StageContext context, Instant deadline, String phase)
      throws StorageException {
    Duration left = Duration.between(context.clock().now(), deadline);
    if (left.isZero() || left.isNegative()) {
      throw failure(input, context, StorageFailureKind.TRANSIENT, "deadline expired before " + phase, null);
    }
    return left;
  }

  private static <T extends Exception> T abort(StoreTransaction tx, T failure) {
    try {
      tx.rollback();
    } catch (StoreException | RuntimeException ex) {
      failure.addSuppressed(ex);
    }
    try {
      tx.close();
    } catch (StoreException | RuntimeException ex) {
      failure.addSuppressed(ex);
    }
    log.warn("Rolled back storage transaction: {}", failure.getMessage());
    return failure;
  }

  private static StorageException failure(
      AnalyzedText input, StageContext context, StorageFailureKind kind, String reason, Throwable cause) {
    return new StorageException(NAME, context.traceId(), kind, input.source(), reason, cause);
  }
}
