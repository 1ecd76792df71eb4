package ca.gc.cra.textpipe.application.error;

import java.util.Objects;

/**
 * <strong>What:</strong> Base of the pipeline error taxonomy.
 * <p><strong>Why:</strong> Callers need to tell which stage failed, for which submission, and whether a retry could
 * help, without parsing messages.</p>
 * <p><strong>Role:</strong> Checked exception thrown by {@link ca.gc.cra.textpipe.application.port.Stage} and
 * propagated unchanged by the orchestrator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Carry the failing stage name and the submission trace identifier.</li>
 *   <li>Expose {@link #retryable()} so retry policies can decide without {@code instanceof} ladders.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public abstract sealed class StageException extends Exception
    permits CleaningException, AnalysisException, StorageException {
  private static final long serialVersionUID = 1L;

  private final String stageName;
  private final String traceId;

  /**
   * Creates a stage failure.
   *
   * @param stageName label of the failing stage
   * @param traceId trace identifier of the failing submission
   * @param message human-readable reason
   * @param cause underlying failure; may be {@code null}
   */
  protected StageException(String stageName, String traceId, String message, Throwable cause) {
    super("[" + traceId + "] " + stageName + ": " + message, cause);
    this.stageName = Objects.requireNonNull(stageName, "stageName");
    this.traceId = Objects.requireNonNull(traceId, "traceId");
  }

  /**
   * Returns the label of the stage that failed.
   *
   * @return stage name, e.g. {@code TextCleaner}
   */
  public String stageName() {
    return stageName;
  }

  /**
   * Returns the trace identifier of the failed submission.
   *
   * @return trace identifier
   */
  public String traceId() {
    return traceId;
  }

  /**
   * Returns whether resubmitting the same input may succeed.
   *
   * @return {@code true} when the failure is transient
   */
  public abstract boolean retryable();
}
