package ca.gc.cra.textpipe.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.textpipe.application.port.ClockPort;
import ca.gc.cra.textpipe.domain.text.RawText;
import ca.gc.cra.textpipe.infrastructure.persistence.memory.InMemoryStoreConnector;
import ca.gc.cra.textpipe.testutil.RecordingMetricsPort;
import ca.gc.cra.textpipe.testutil.TextFixtures;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BatchProcessingUseCaseTest {
  private final InMemoryStoreConnector store = new InMemoryStoreConnector();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void batchSummarizesSuccessesAndFailuresInInputOrder() throws Exception {
    List<RawText> inputs = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      inputs.add(RawText.of("item " + i + " was good", "batch").withTraceId("trace-" + i));
    }
    inputs.add(RawText.of("<b unterminated", "batch").withTraceId("trace-bad"));
    inputs.add(RawText.of("again good", "batch").withTraceId("trace-0-dup"));

    BatchSummary summary = useCase(4).run(inputs);

    assertEquals(10, summary.total());
    assertEquals(9, summary.completed());
    assertEquals(1, summary.failed());
    assertEquals(Map.of("TextCleaner", 1), summary.failuresByStage());
    assertEquals(9, store.size());
    assertEquals(9, summary.storageIds().size());
    for (int i = 0; i < inputs.size(); i++) {
      assertEquals(inputs.get(i).traceId(), summary.outcomes().get(i).traceId());
    }
    assertFalse(summary.allCompleted());
    assertEquals(10, metrics.count("pipeline.submission.started"));
  }

  @Test
  void duplicateTraceIdsYieldOneStorageFailure() throws Exception {
    List<RawText> inputs = List.of(
        RawText.of("good", "batch").withTraceId("same"),
        RawText.of("bad", "batch").withTraceId("same"),
        RawText.of("great", "batch").withTraceId("other"));

    BatchSummary summary = useCase(3).run(inputs);

    assertEquals(2, summary.completed());
    assertEquals(Map.of("DatabaseStorer", 1), summary.failuresByStage());
    assertEquals(2, store.size());
  }

  @Test
  void emptyBatchIsTriviallyComplete() throws Exception {
    BatchSummary summary = useCase(2).run(List.of());

    assertEquals(0, summary.total());
    assertTrue(summary.allCompleted());
  }

  @Test
  void workerCountMustBePositive() {
    RetryingSubmitter submitter = new RetryingSubmitter(
        TextFixtures.pipeline(store, metrics, ClockPort.SYSTEM), RetryPolicy.none(), metrics);

    assertThrows(IllegalArgumentException.class, () -> new BatchProcessingUseCase(submitter, 0));
  }

  private BatchProcessingUseCase useCase(int workers) {
    RetryingSubmitter submitter = new RetryingSubmitter(
        TextFixtures.pipeline(store, metrics, ClockPort.SYSTEM), RetryPolicy.none(), metrics);
    return new BatchProcessingUseCase(submitter, workers);
  }
}
