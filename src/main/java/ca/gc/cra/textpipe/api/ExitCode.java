package ca.gc.cra.textpipe.api;

/**
 * <strong>What:</strong> Exit codes shared by the textpipe commands.
 * <p><strong>Why:</strong> Lets scripts tell argument mistakes, environment problems, and rejected submissions
 * apart without parsing output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A file or the store could not be read or written. */
  IO_ERROR(3),
  /** Configuration or lexicon was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** A submission was rejected by a pipeline stage, or a requested record does not exist. */
  STAGE_FAILURE(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
