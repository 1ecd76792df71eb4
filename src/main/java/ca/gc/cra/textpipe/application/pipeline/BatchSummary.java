package ca.gc.cra.textpipe.application.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate result of a batch run.
 *
 * @param total number of submissions
 * @param completed submissions that stored a record
 * @param failed submissions stopped by a stage failure
 * @param failuresByStage failure counts keyed by stage name
 * @param storageIds storage ids of completed submissions, in input order
 * @param outcomes per-submission outcomes, in input order
 * @since 0.1.0
 */
public record BatchSummary(
    int total,
    int completed,
    int failed,
    Map<String, Integer> failuresByStage,
    List<String> storageIds,
    List<SubmissionOutcome> outcomes) {

  public BatchSummary {
    failuresByStage = Map.copyOf(failuresByStage);
    storageIds = List.copyOf(storageIds);
    outcomes = List.copyOf(outcomes);
    if (completed + failed != total) {
      throw new IllegalArgumentException("completed + failed must equal total");
    }
  }

  /**
   * Builds a summary from ordered outcomes.
   *
   * @param outcomes outcomes in input order
   * @return summary
   */
  public static BatchSummary of(List<SubmissionOutcome> outcomes) {
    int completed = 0;
    Map<String, Integer> byStage = new LinkedHashMap<>();
    List<String> ids = new ArrayList<>();
    for (SubmissionOutcome outcome : outcomes) {
      if (outcome instanceof SubmissionOutcome.Completed done) {
        completed++;
        ids.add(done.result().storageId());
      } else if (outcome instanceof SubmissionOutcome.Failed failure) {
        byStage.merge(failure.error().stageName(), 1, Integer::sum);
      }
    }
    return new BatchSummary(outcomes.size(), completed, outcomes.size() - completed, byStage, ids, outcomes);
  }

  /**
   * Returns whether every submission completed.
   *
   * @return {@code true} when nothing failed
   */
  public boolean allCompleted() {
    return failed == 0;
  }
}
