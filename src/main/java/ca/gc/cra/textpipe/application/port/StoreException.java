package ca.gc.cra.textpipe.application.port;

import ca.gc.cra.textpipe.application.error.StorageFailureKind;
import java.util.Objects;

/**
 * Failure reported by a {@link StoreConnector} or {@link StoreTransaction}, already classified as transient or
 * permanent by the adapter that raised it.
 *
 * @since 0.1.0
 */
public class StoreException extends Exception {
  private static final long serialVersionUID = 1L;

  private final StorageFailureKind kind;

  /**
   * Creates a store failure.
   *
   * @param kind classification decided by the adapter
   * @param message human-readable reason
   * @param cause underlying driver failure; may be {@code null}
   */
  public StoreException(StorageFailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates a store failure without an underlying cause.
   *
   * @param kind classification decided by the adapter
   * @param message human-readable reason
   */
  public StoreException(StorageFailureKind kind, String message) {
    this(kind, message, null);
  }

  /**
   * Returns whether retrying the same write may succeed.
   *
   * @return failure classification
   */
  public StorageFailureKind kind() {
    return kind;
  }
}
