package ca.gc.cra.textpipe.application.port;

import ca.gc.cra.textpipe.application.error.StageException;

/**
 * <strong>What:</strong> Capability contract implemented by every pipeline stage.
 * <p><strong>Why:</strong> Lets the orchestrator drive cleaning, analysis, and storage without knowing the concrete
 * implementations, so any stage can be replaced independently.</p>
 * <p><strong>Role:</strong> Port between the orchestrator and stage implementations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Transform one input record into one output record.</li>
 *   <li>Expose runtime type tokens so the orchestrator can verify the chain once at construction.</li>
 *   <li>Raise a stage-specific {@link StageException} when no valid output can be produced.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must hold no per-call mutable state; the orchestrator may be
 * invoked from several threads at once.</p>
 * <p><strong>Performance:</strong> Only storage stages are expected to block.</p>
 * <p><strong>Observability:</strong> {@link #name()} labels logs, metrics, and errors.</p>
 *
 * @param <I> input record type
 * @param <O> output record type
 * @since 0.1.0
 */
public interface Stage<I, O> {
  /**
   * Returns the stage label used in logs, metrics, and errors.
   *
   * @return stable, non-blank name
   */
  String name();

  /**
   * Returns the record type accepted by {@link #process(Object, StageContext)}.
   *
   * @return input type token
   */
  Class<I> inputType();

  /**
   * Returns the record type produced by {@link #process(Object, StageContext)}.
   *
   * @return output type token
   */
  Class<O> outputType();

  /**
   * Processes one record.
   *
   * @param input record produced by the previous stage (or the caller); never {@code null}
   * @param context trace identifier, deadline, and clock of the current submission
   * @return new output record; never {@code null}, never the mutated input
   * @throws StageException when the stage cannot produce valid output; the subtype names the failing concern
   */
  O process(I input, StageContext context) throws StageException;
}
