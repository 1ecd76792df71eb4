package ca.gc.cra.textpipe.application.pipeline;

import ca.gc.cra.textpipe.application.error.PipelineConfigurationException;
import ca.gc.cra.textpipe.application.error.StageException;
import ca.gc.cra.textpipe.application.port.ClockPort;
import ca.gc.cra.textpipe.application.port.MetricsPort;
import ca.gc.cra.textpipe.application.port.Stage;
import ca.gc.cra.textpipe.application.port.StageContext;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import ca.gc.cra.textpipe.domain.text.RawText;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Orchestrator that runs one submission through an ordered list of stages.
 * <p><strong>Why:</strong> Keeps sequencing, tracing, and error propagation in one place so stages stay focused on
 * their single transformation.</p>
 * <p><strong>Role:</strong> Application service invoked by the CLI, {@link RetryingSubmitter}, and
 * {@link BatchProcessingUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Verify once, at construction, that the stage chain turns {@link RawText} into {@link ProcessedResult}.</li>
 *   <li>Run stages strictly in order, feeding each output to the next stage.</li>
 *   <li>Stop at the first {@link StageException} and surface it unchanged.</li>
 *   <li>Tag logs with the submission trace id and the running stage.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent submissions provided the
 * stages are.</p>
 * <p><strong>Performance:</strong> Adds two MDC updates and one metrics observation per stage.</p>
 * <p><strong>Observability:</strong> Emits {@code pipeline.submission.started|completed|failed},
 * {@code pipeline.stage.<name>.latencyNanos}, and {@code pipeline.stage.<name>.failed}; MDC keys
 * {@value #MDC_TRACE_ID} and {@value #MDC_STAGE}.</p>
 *
 * @since 0.1.0
 */
public final class TextPipeline {
  private static final Logger log = LoggerFactory.getLogger(TextPipeline.class);

  /** MDC key holding the trace id of the running submission. */
  public static final String MDC_TRACE_ID = "traceId";
  /** MDC key holding the name of the running stage. */
  public static final String MDC_STAGE = "stage";

  private final List<Stage<?, ?>> stages;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a pipeline.
   *
   * @param stages ordered stages; the first accepts {@link RawText}, the last produces {@link ProcessedResult}
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   * @param clock time source for stage contexts; {@code null} selects {@link ClockPort#SYSTEM}
   * @throws PipelineConfigurationException if the list is empty, contains {@code null}, or adjacent stages do not
   *     fit together
   */
  public TextPipeline(List<? extends Stage<?, ?>> stages, MetricsPort metrics, ClockPort clock) {
    this.stages = validate(stages);
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Runs a submission without a deadline.
   *
   * @param raw input record
   * @return stored record
   * @throws StageException first failure raised by a stage
   */
  public ProcessedResult process(RawText raw) throws StageException {
    return process(raw, null);
  }

  /**
   * Runs a submission.
   *
   * @param raw input record; must not be {@code null}
   * @param deadline optional instant bounding I/O-bound stages; {@code null} for none
   * @return stored record
   * @throws StageException first failure raised by a stage; later stages did not run
   */
  public ProcessedResult process(RawText raw, Instant deadline) throws StageException {
    Objects.requireNonNull(raw, "raw");
    StageContext context = new StageContext(raw.traceId(), Optional.ofNullable(deadline), clock);
    String previousTrace = MDC.get(MDC_TRACE_ID);
    MDC.put(MDC_TRACE_ID, raw.traceId());
    metrics.increment("pipeline.submission.started");
    try {
      log.debug("Submission from source '{}' started", raw.source());
      Object current = raw;
      for (Stage<?, ?> stage : stages) {
        current = runStage(stage, current, context);
      }
      ProcessedResult result = (ProcessedResult) current;
      metrics.increment("pipeline.submission.completed");
      log.info("Submission stored as {} ({}, score={})",
          result.storageId(), result.sentiment(), result.sentimentScore());
      return result;
    } catch (StageException ex) {
      metrics.increment("pipeline.submission.failed");
      log.warn("Submission failed in {} (retryable={}): {}", ex.stageName(), ex.retryable(), ex.getMessage());
      throw ex;
    } finally {
      restore(MDC_TRACE_ID, previousTrace);
    }
  }

  /**
   * Runs a submission and reports the outcome as a value instead of an exception.
   *
   * @param raw input record
   * @return completed or failed outcome
   */
  public SubmissionOutcome submit(RawText raw) {
    return submit(raw, null);
  }

  /**
   * Runs a submission with a deadline and reports the outcome as a value.
   *
   * @param raw input record
   * @param deadline optional deadline; {@code null} for none
   * @return completed or failed outcome
   */
  public SubmissionOutcome submit(RawText raw, Instant deadline) {
    try {
      return new SubmissionOutcome.Completed(process(raw, deadline));
    } catch (StageException ex) {
      return new SubmissionOutcome.Failed(ex);
    }
  }

  /**
   * Lists stage names in execution order.
   *
   * @return immutable list of names
   */
  public List<String> stageNames() {
    return stages.stream().map(Stage::name).toList();
  }

  private Object runStage(Stage<?, ?> stage, Object input, StageContext context) throws StageException {
    String previousStage = MDC.get(MDC_STAGE);
    MDC.put(MDC_STAGE, stage.name());
    long started = System.nanoTime();
    try {
      log.debug("Stage {} started", stage.name());
      Object output = invoke(stage, input, context);
      if (output == null) {
        throw new IllegalStateException("stage " + stage.name() + " returned null");
      }
      log.debug("Stage {} completed", stage.name());
      return output;
    } catch (StageException ex) {
      metrics.increment("pipeline.stage." + stage.name() + ".failed");
      throw ex;
    } finally {
      metrics.observe("pipeline.stage." + stage.name() + ".latencyNanos", System.nanoTime() - started);
      restore(MDC_STAGE, previousStage);
    }
  }

  private static <I, O> O invoke(Stage<I, O> stage, Object input, StageContext context) throws StageException {
    return stage.process(stage.inputType().cast(input), context);
  }

  private static List<Stage<?, ?>> validate(List<? extends Stage<?, ?>> stages) {
    if (stages == null || stages.isEmpty()) {
      throw new PipelineConfigurationException("pipeline requires at least one stage");
    }
    List<Stage<?, ?>> copy = new ArrayList<>(stages.size());
    Class<?> expected = RawText.class;
    for (int i = 0; i < stages.size(); i++) {
      Stage<?, ?> stage = stages.get(i);
      if (stage == null) {
        throw new PipelineConfigurationException("stage at position " + i + " is null");
      }
      if (!stage.inputType().isAssignableFrom(expected)) {
        throw new PipelineConfigurationException(
            "stage " + stage.name() + " at position " + i + " accepts " + stage.inputType().getSimpleName()
                + " but receives " + expected.getSimpleName());
      }
      expected = stage.outputType();
      copy.add(stage);
    }
    if (!ProcessedResult.class.isAssignableFrom(expected)) {
      throw new PipelineConfigurationException(
          "last stage must produce ProcessedResult but produces " + expected.getSimpleName());
    }
    return List.copyOf(copy);
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
