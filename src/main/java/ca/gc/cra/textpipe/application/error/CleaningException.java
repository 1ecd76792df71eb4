package ca.gc.cra.textpipe.application.error;

import ca.gc.cra.textpipe.logging.Logs;

/**
 * Raised when raw input cannot be normalized, e.g. absent content or markup left unbalanced after stripping.
 * Never retryable: the same input fails the same way.
 *
 * @since 0.1.0
 */
public final class CleaningException extends StageException {
  private static final long serialVersionUID = 1L;
  private static final int PREVIEW_BYTES = 64;

  private final String offendingText;

  /**
   * Creates a cleaning failure.
   *
   * @param stageName label of the failing stage
   * @param traceId trace identifier of the failing submission
   * @param message reason
   * @param offendingText raw content that could not be cleaned; may be {@code null}
   */
  public CleaningException(String stageName, String traceId, String message, String offendingText) {
    super(stageName, traceId, message + preview(offendingText), null);
    this.offendingText = offendingText;
  }

  /**
   * Returns the raw content that failed cleaning.
   *
   * @return original text, or {@code null} when the content was absent
   */
  public String offendingText() {
    return offendingText;
  }

  @Override
  public boolean retryable() {
    return false;
  }

  private static String preview(String text) {
    return text == null ? "" : " (input: \"" + Logs.truncate(text, PREVIEW_BYTES) + "\")";
  }
}
