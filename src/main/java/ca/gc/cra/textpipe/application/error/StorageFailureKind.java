package ca.gc.cra.textpipe.application.error;

/**
 * Classification of a storage failure.
 *
 * @since 0.1.0
 */
public enum StorageFailureKind {
  /** Store unavailable, lock contention, or deadline expiry; a retry may succeed. */
  TRANSIENT,
  /** Constraint violation or malformed record; a retry fails the same way. */
  PERMANENT;

  /**
   * Returns whether callers may resubmit after this failure.
   *
   * @return {@code true} for {@link #TRANSIENT}
   */
  public boolean retryable() {
    return this == TRANSIENT;
  }
}
