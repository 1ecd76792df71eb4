package ca.gc.cra.textpipe.application.pipeline;

import ca.gc.cra.textpipe.application.error.StageException;
import ca.gc.cra.textpipe.application.port.ClockPort;
import ca.gc.cra.textpipe.application.port.MetricsPort;
import ca.gc.cra.textpipe.domain.text.RawText;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resubmits the same {@link RawText} after retryable stage failures.
 * <p><strong>Why:</strong> Storage contention and connection loss are transient; the pipeline itself never retries,
 * so callers opt in here.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return immediately on success or on a failure whose {@code retryable()} is {@code false}.</li>
 *   <li>Pause with exponential backoff between attempts and stop before passing the caller deadline.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> WARN per retry; metric {@code pipeline.retry.attempt}.</p>
 *
 * @since 0.1.0
 */
public final class RetryingSubmitter {
  private static final Logger log = LoggerFactory.getLogger(RetryingSubmitter.class);

  /** Pauses the calling thread; replaced in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
  }

  private final TextPipeline pipeline;
  private final RetryPolicy policy;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Sleeper sleeper;

  public RetryingSubmitter(TextPipeline pipeline, RetryPolicy policy, MetricsPort metrics) {
    this(pipeline, policy, metrics, ClockPort.SYSTEM, Sleeper.THREAD);
  }

  public RetryingSubmitter(
      TextPipeline pipeline, RetryPolicy policy, MetricsPort metrics, ClockPort clock, Sleeper sleeper) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Submits without a deadline.
   *
   * @param raw input record
   * @return outcome of the last attempt
   * @throws InterruptedException if interrupted while backing off
   */
  public SubmissionOutcome submit(RawText raw) throws InterruptedException {
    return submit(raw, null);
  }

  /**
   * Submits, retrying transient failures according to the policy.
   *
   * @param raw input record; resubmitted unchanged, trace id included
   * @param deadline optional deadline shared by all attempts; {@code null} for none
   * @return outcome of the last attempt
   * @throws InterruptedException if interrupted while backing off
   */
  public SubmissionOutcome submit(RawText raw, Instant deadline) throws InterruptedException {
    Objects.requireNonNull(raw, "raw");
    int attempt = 1;
    while (true) {
      SubmissionOutcome outcome = pipeline.submit(raw, deadline);
      if (!(outcome instanceof SubmissionOutcome.Failed failed)) {
        return outcome;
      }
      StageException error = failed.error();
      if (!error.retryable() || attempt >= policy.maxAttempts()) {
        return outcome;
      }
      Duration pause = policy.backoffAfter(attempt);
      if (deadline != null && !clock.now().plus(pause).isBefore(deadline)) {
        log.warn("Not retrying {}: deadline {} reached", raw.traceId(), deadline);
        return outcome;
      }
      attempt++;
      metrics.increment("pipeline.retry.attempt");
      log.warn("Retrying {} (attempt {}/{}) after {} ms: {}",
          raw.traceId(), attempt, policy.maxAttempts(), pause.toMillis(), error.getMessage());
      sleeper.sleep(pause);
    }
  }

  /**
   * Returns the pipeline this submitter drives.
   *
   * @return pipeline
   */
  public TextPipeline pipeline() {
    return pipeline;
  }
}
