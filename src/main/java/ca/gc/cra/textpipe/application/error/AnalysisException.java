package ca.gc.cra.textpipe.application.error;

/**
 * Raised when sentiment analysis cannot produce a score, typically because the lexicon could not be read or is
 * malformed.
 *
 * @since 0.1.0
 */
public final class AnalysisException extends StageException {
  private static final long serialVersionUID = 1L;

  private final boolean retryable;

  /**
   * Creates an analysis failure.
   *
   * @param stageName label of the failing stage
   * @param traceId trace identifier of the failing submission
   * @param message reason
   * @param cause underlying failure; may be {@code null}
   * @param retryable {@code true} when the resource may become readable later (I/O), {@code false} for bad content
   */
  public AnalysisException(
      String stageName, String traceId, String message, Throwable cause, boolean retryable) {
    super(stageName, traceId, message, cause);
    this.retryable = retryable;
  }

  @Override
  public boolean retryable() {
    return retryable;
  }
}
