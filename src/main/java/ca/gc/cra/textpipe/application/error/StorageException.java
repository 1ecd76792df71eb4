package ca.gc.cra.textpipe.application.error;

import java.util.Locale;
import java.util.Objects;

/**
 * Raised when the storage stage could not commit a record. The transaction has been rolled back by the time this
 * is thrown, so no partial record is visible.
 *
 * @since 0.1.0
 */
public final class StorageException extends StageException {
  private static final long serialVersionUID = 1L;

  private final StorageFailureKind kind;
  private final String source;
  private final String reason;

  /**
   * Creates a storage failure.
   *
   * @param stageName label of the failing stage
   * @param traceId trace identifier of the failing submission
   * @param kind transient or permanent classification
   * @param source origin label of the record that failed to persist
   * @param reason short description of the failure
   * @param cause underlying failure; may be {@code null}
   */
  public StorageException(
      String stageName,
      String traceId,
      StorageFailureKind kind,
      String source,
      String reason,
      Throwable cause) {
    super(
        stageName,
        traceId,
        kind.name().toLowerCase(Locale.ROOT) + " failure storing record from '" + source + "': " + reason,
        cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.source = Objects.requireNonNull(source, "source");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /**
   * Returns the failure classification.
   *
   * @return transient or permanent
   */
  public StorageFailureKind kind() {
    return kind;
  }

  /** @return origin label of the record that failed to persist */
  public String source() {
    return source;
  }

  /** @return short failure description without the stage/trace prefix */
  public String reason() {
    return reason;
  }

  @Override
  public boolean retryable() {
    return kind.retryable();
  }
}
