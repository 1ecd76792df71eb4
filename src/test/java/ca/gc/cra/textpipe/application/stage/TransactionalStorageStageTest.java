package ca.gc.cra.textpipe.application.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.textpipe.application.error.StorageException;
import ca.gc.cra.textpipe.application.error.StorageFailureKind;
import ca.gc.cra.textpipe.application.port.StageContext;
import ca.gc.cra.textpipe.application.port.StoreConnector;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.application.port.StoreTransaction;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import ca.gc.cra.textpipe.infrastructure.persistence.memory.InMemoryStoreConnector;
import ca.gc.cra.textpipe.testutil.ManualClock;
import ca.gc.cra.textpipe.testutil.TextFixtures;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TransactionalStorageStageTest {
  private final ManualClock clock = new ManualClock(TextFixtures.EPOCH);
  private final InMemoryStoreConnector store = new InMemoryStoreConnector(clock);
  private final TransactionalStorageStage stage = new TransactionalStorageStage(store, Duration.ofSeconds(5));

  @Test
  void committedRecordIsVisibleAndReturned() throws Exception {
    ProcessedResult result = stage.process(TextFixtures.analyzed("trace-1", "good day"), context("trace-1", null));

    assertEquals(1, store.commitCount());
    assertEquals(0, store.rollbackCount());
    assertEquals(Optional.of(result.storageId()), store.findById(result.storageId()).map(ProcessedResult::storageId));
    assertEquals("good day", result.content());
    assertEquals(TextFixtures.EPOCH, result.storedAt());
  }

  @Test
  void transientWriteFailureRollsBack() {
    store.setWriteInterceptor((record, timeout) -> {
      throw new StoreException(StorageFailureKind.TRANSIENT, "database is locked");
    });

    StorageException ex = assertThrows(StorageException.class,
        () -> stage.process(TextFixtures.analyzed("trace-2", "good"), context("trace-2", null)));

    assertEquals(StorageFailureKind.TRANSIENT, ex.kind());
    assertTrue(ex.retryable());
    assertEquals("unit-test", ex.source());
    assertTrue(ex.getMessage().contains("transient failure storing record from 'unit-test': database is locked"));
    assertEquals(0, store.size());
    assertEquals(1, store.rollbackCount());
  }

  @Test
  void permanentCommitFailureLeavesNothingBehind() {
    store.failNextCommits(StorageFailureKind.PERMANENT, 1);

    StorageException ex = assertThrows(StorageException.class,
        () -> stage.process(TextFixtures.analyzed("trace-3", "good"), context("trace-3", null)));

    assertEquals(StorageFailureKind.PERMANENT, ex.kind());
    assertFalse(ex.retryable());
    assertEquals(0, store.size());
    assertEquals(0, store.commitCount());
    assertEquals(1, store.rollbackCount());
  }

  @Test
  void duplicateTraceIdIsPermanent() throws Exception {
    stage.process(TextFixtures.analyzed("trace-dup", "first"), context("trace-dup", null));

    StorageException ex = assertThrows(StorageException.class,
        () -> stage.process(TextFixtures.analyzed("trace-dup", "second"), context("trace-dup", null)));

    assertEquals(StorageFailureKind.PERMANENT, ex.kind());
    assertEquals(1, store.size());
  }

  @Test
  void expiredDeadlineFailsBeforeWriting() {
    List<Duration> seen = new ArrayList<>();
    store.setWriteInterceptor((record, timeout) -> seen.add(timeout));

    StorageException ex = assertThrows(StorageException.class,
        () -> stage.process(TextFixtures.analyzed("trace-4", "good"), context("trace-4", clock.now())));

    assertEquals(StorageFailureKind.TRANSIENT, ex.kind());
    assertEquals("deadline expired before write", ex.reason());
    assertTrue(seen.isEmpty());
    assertEquals(0, store.size());
  }

  @Test
  void deadlinePassingDuringWriteAbortsCommit() {
    Instant deadline = clock.now().plusMillis(500);
    store.setWriteInterceptor((record, timeout) -> clock.advance(Duration.ofSeconds(1)));

    StorageException ex = assertThrows(StorageException.class,
        () -> stage.process(TextFixtures.analyzed("trace-5", "good"), context("trace-5", deadline)));

    assertEquals("deadline expired before commit", ex.reason());
    assertEquals(0, store.size());
    assertEquals(0, store.commitCount());
  }

  @Test
  void writeIsBoundedByEarlierOfTimeoutAndDeadline() throws Exception {
    List<Duration> seen = new ArrayList<>();
    store.setWriteInterceptor((record, timeout) -> seen.add(timeout));

    stage.process(TextFixtures.analyzed("trace-6", "good"), context("trace-6", null));
    stage.process(TextFixtures.analyzed("trace-7", "good"), context("trace-7", clock.now().plusSeconds(2)));
    stage.process(TextFixtures.analyzed("trace-8", "good"), context("trace-8", clock.now().plusSeconds(60)));

    assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(2), Duration.ofSeconds(5)), seen);
  }

  @Test
  void uncheckedWriteFailureBecomesPermanentStorageError() {
    IllegalStateException boom = new IllegalStateException("driver bug");
    store.setWriteInterceptor((record, timeout) -> {
      throw boom;
    });

    StorageException ex = assertThrows(StorageException.class,
        () -> stage.process(TextFixtures.analyzed("trace-9", "good"), context("trace-9", null)));

    assertEquals(StorageFailureKind.PERMANENT, ex.kind());
    assertFalse(ex.retryable());
    assertSame(boom, ex.getCause());
    assertEquals("unit-test", ex.source());
    assertEquals("driver bug", ex.reason());
    assertEquals("trace-9", ex.traceId());
    assertEquals(1, store.rollbackCount());
    assertEquals(0, store.size());
  }

  @Test
  void uncheckedBeginFailureBecomesPermanentStorageError() {
    UnsupportedOperationException boom = new UnsupportedOperationException();
    StoreConnector broken = new StoreConnector() {
      @Override
      public StoreTransaction begin() {
        throw boom;
      }

      @Override
      public Optional<ProcessedResult> findById(String storageId) {
        return Optional.empty();
      }

      @Override
      public List<ProcessedResult> findBySource(String source) {
        return List.of();
      }
    };
    TransactionalStorageStage brokenStage = new TransactionalStorageStage(broken, Duration.ofSeconds(5));

    StorageException ex = assertThrows(StorageException.class,
        () -> brokenStage.process(TextFixtures.analyzed("trace-10", "good"), context("trace-10", null)));

    assertEquals(StorageFailureKind.PERMANENT, ex.kind());
    assertSame(boom, ex.getCause());
    assertEquals("unable to open transaction: UnsupportedOperationException", ex.reason());
  }

  @Test
  void returnedTimestampMatchesStoredRecord() throws Exception {
    store.setWriteInterceptor((record, timeout) -> clock.advance(Duration.ofMillis(250)));

    ProcessedResult result = stage.process(TextFixtures.analyzed("trace-11", "good"), context("trace-11", null));
    clock.advance(Duration.ofSeconds(3));

    ProcessedResult stored = store.findById(result.storageId()).orElseThrow();
    assertEquals(stored.storedAt(), result.storedAt());
    assertEquals(TextFixtures.EPOCH.plusMillis(250), result.storedAt());
  }

  @Test
  void nonPositiveTimeoutIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new TransactionalStorageStage(store, Duration.ZERO));
  }

  private StageContext context(String traceId, Instant deadline) {
    return new StageContext(traceId, Optional.ofNullable(deadline), clock);
  }
}
