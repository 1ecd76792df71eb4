package ca.gc.cra.textpipe.application.pipeline;

import ca.gc.cra.textpipe.domain.text.RawText;
import ca.gc.cra.textpipe.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs many independent submissions in parallel and summarizes their outcomes.
 * <p><strong>Why:</strong> Bulk imports should use several store connections at once; every submission still gets
 * its own storage transaction, so one failure never affects another.</p>
 * <p><strong>Role:</strong> Application service behind the {@code batch} CLI command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own a worker pool for the duration of one run and shut it down afterwards.</li>
 *   <li>Preserve input order in the returned {@link BatchSummary}.</li>
 *   <li>Propagate unexpected runtime failures instead of counting them as stage failures.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #run(List)} call creates its own pool.</p>
 * <p><strong>Observability:</strong> INFO lines at start and end of a run.</p>
 *
 * @since 0.1.0
 */
public final class BatchProcessingUseCase {
  private static final Logger log = LoggerFactory.getLogger(BatchProcessingUseCase.class);

  private final RetryingSubmitter submitter;
  private final int workers;

  /**
   * Creates the use case.
   *
   * @param submitter submitter shared by all workers
   * @param workers worker thread count; must be positive
   */
  public BatchProcessingUseCase(RetryingSubmitter submitter, int workers) {
    this.submitter = Objects.requireNonNull(submitter, "submitter");
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.workers = workers;
  }

  /**
   * Processes all inputs.
   *
   * @param inputs submissions to run
   * @return summary with outcomes in input order
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public BatchSummary run(List<RawText> inputs) throws InterruptedException {
    Objects.requireNonNull(inputs, "inputs");
    if (inputs.isEmpty()) {
      return BatchSummary.of(List.of());
    }
    int poolSize = Math.min(workers, inputs.size());
    ExecutorService executor = ExecutorFactories.newWorkerPool(
        poolSize,
        "textpipe-batch",
        (thread, ex) -> log.error("Batch worker {} failed", thread.getName(), ex));
    log.info("Batch of {} submissions started with {} workers", inputs.size(), poolSize);
    try {
      List<Callable<SubmissionOutcome>> tasks = new ArrayList<>(inputs.size());
      for (RawText raw : inputs) {
        tasks.add(() -> submitter.submit(raw));
      }
      List<Future<SubmissionOutcome>> futures = executor.invokeAll(tasks);
      BatchSummary summary = BatchSummary.of(collect(futures));
      log.info("Batch finished: {} completed, {} failed {}",
          summary.completed(), summary.failed(), summary.failuresByStage());
      return summary;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Batch interrupted; requesting shutdown");
      executor.shutdownNow();
      throw ex;
    } finally {
      executor.shutdown();
    }
  }

  private static List<SubmissionOutcome> collect(List<Future<SubmissionOutcome>> futures)
      throws InterruptedException {
    List<SubmissionOutcome> outcomes = new ArrayList<>(futures.size());
    for (Future<SubmissionOutcome> future : futures) {
      try {
        outcomes.add(future.get());
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException runtime) {
          throw runtime;
        }
        if (cause instanceof InterruptedException interrupted) {
          throw interrupted;
        }
        throw new IllegalStateException("batch submission failed", cause);
      }
    }
    return outcomes;
  }
}
