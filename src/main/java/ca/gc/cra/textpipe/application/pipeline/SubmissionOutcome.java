package ca.gc.cra.textpipe.application.pipeline;

import ca.gc.cra.textpipe.application.error.StageException;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import java.util.Objects;

/**
 * Result of one pipeline submission: either the stored record or the typed failure that stopped it.
 *
 * @since 0.1.0
 */
public sealed interface SubmissionOutcome
    permits SubmissionOutcome.Completed, SubmissionOutcome.Failed {

  /**
   * Returns the trace identifier of the submission.
   *
   * @return trace identifier
   */
  String traceId();

  /**
   * Returns whether the submission stored a record.
   *
   * @return {@code true} for {@link Completed}
   */
  default boolean succeeded() {
    return this instanceof Completed;
  }

  /**
   * Submission that committed a record.
   *
   * @param result stored record
   */
  record Completed(ProcessedResult result) implements SubmissionOutcome {
    public Completed {
      Objects.requireNonNull(result, "result");
    }

    @Override
    public String traceId() {
      return result.traceId();
    }
  }

  /**
   * Submission stopped by a stage failure; no record was stored.
   *
   * @param error first stage failure, unchanged
   */
  record Failed(StageException error) implements SubmissionOutcome {
    public Failed {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public String traceId() {
      return error.traceId();
    }
  }
}
