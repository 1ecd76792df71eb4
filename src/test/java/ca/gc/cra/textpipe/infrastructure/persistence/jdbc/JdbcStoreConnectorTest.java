package ca.gc.cra.textpipe.infrastructure.persistence.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.textpipe.application.error.StorageException;
import ca.gc.cra.textpipe.application.error.StorageFailureKind;
import ca.gc.cra.textpipe.application.pipeline.TextPipeline;
import ca.gc.cra.textpipe.application.port.MetricsPort;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.application.port.StoreTransaction;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import ca.gc.cra.textpipe.domain.text.RawText;
import ca.gc.cra.textpipe.domain.text.Sentiment;
import ca.gc.cra.textpipe.testutil.ManualClock;
import ca.gc.cra.textpipe.testutil.TextFixtures;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbcStoreConnectorTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  @TempDir Path tempDir;

  private ManualClock clock;
  private JdbcStoreConnector connector;

  @BeforeEach
  void setUp() throws Exception {
    clock = new ManualClock(TextFixtures.EPOCH);
    connector = new JdbcStoreConnector("jdbc:sqlite:" + tempDir.resolve("textpipe.db"), TIMEOUT, clock);
    connector.migrate();
  }

  @Test
  void migrationIsRepeatable() throws Exception {
    connector.migrate();

    assertEquals(List.of(), connector.findBySource("anything"));
  }

  @Test
  void committedRecordRoundTripsAllColumns() throws Exception {
    String id;
    try (StoreTransaction tx = connector.begin()) {
      id = tx.write(TextFixtures.analyzed("trace-1", "good day"), TIMEOUT).storageId();
      tx.commit();
    }

    ProcessedResult stored = connector.findById(id).orElseThrow();
    assertEquals("good day", stored.content());
    assertEquals("<p>good day</p>", stored.originalContent());
    assertEquals("unit-test", stored.source());
    assertEquals("trace-1", stored.traceId());
    assertEquals(Sentiment.POSITIVE, stored.sentiment());
    assertEquals(0.5, stored.sentimentScore(), 1e-9);
    assertEquals(0.4, stored.confidence(), 1e-9);
    assertEquals(Map.of("channel", "email"), stored.metadata());
    assertEquals(TextFixtures.EPOCH, stored.storedAt());
  }

  @Test
  void rolledBackWriteIsNotVisible() throws Exception {
    String id;
    try (StoreTransaction tx = connector.begin()) {
      id = tx.write(TextFixtures.analyzed("trace-2", "good"), TIMEOUT).storageId();
      tx.rollback();
    }

    assertEquals(Optional.empty(), connector.findById(id));
  }

  @Test
  void closingWithoutCommitDiscardsWrite() throws Exception {
    String id;
    try (StoreTransaction tx = connector.begin()) {
      id = tx.write(TextFixtures.analyzed("trace-3", "good"), TIMEOUT).storageId();
    }

    assertEquals(Optional.empty(), connector.findById(id));
  }

  @Test
  void duplicateTraceIdIsPermanentFailure() throws Exception {
    try (StoreTransaction tx = connector.begin()) {
      tx.write(TextFixtures.analyzed("trace-dup", "first"), TIMEOUT);
      tx.commit();
    }

    StoreException ex;
    try (StoreTransaction tx = connector.begin()) {
      ex = assertThrows(StoreException.class, () -> tx.write(TextFixtures.analyzed("trace-dup", "again"), TIMEOUT));
    }

    assertEquals(StorageFailureKind.PERMANENT, ex.kind());
    assertEquals(1, connector.findBySource("unit-test").size());
  }

  @Test
  void findBySourceReturnsOldestFirst() throws Exception {
    for (int i = 0; i < 3; i++) {
      try (StoreTransaction tx = connector.begin()) {
        tx.write(TextFixtures.analyzed("trace-order-" + i, "item " + i), TIMEOUT);
        tx.commit();
      }
      clock.advance(Duration.ofSeconds(1));
    }

    List<ProcessedResult> results = connector.findBySource("unit-test");

    assertEquals(List.of("item 0", "item 1", "item 2"), results.stream().map(ProcessedResult::content).toList());
    assertEquals(Instant.parse("2024-05-01T12:00:02Z"), results.get(2).storedAt());
  }

  @Test
  void pipelineStoresIntoSqlite() throws Exception {
    TextPipeline pipeline = TextFixtures.pipeline(connector, MetricsPort.NO_OP, clock);

    ProcessedResult result = pipeline.process(
        new RawText("<p>I hate   waiting</p>", "kiosk", TextFixtures.EPOCH, "trace-db", Map.of("k", "v")));

    ProcessedResult stored = connector.findById(result.storageId()).orElseThrow();
    assertEquals("I hate waiting", stored.content());
    assertEquals(Sentiment.NEGATIVE, stored.sentiment());
    assertEquals(Map.of("k", "v"), stored.metadata());
    assertEquals(result.storedAt(), stored.storedAt());
  }

  @Test
  void expiredDeadlineLeavesDatabaseUntouched() throws Exception {
    TextPipeline pipeline = TextFixtures.pipeline(connector, MetricsPort.NO_OP, clock);

    StorageException ex = assertThrows(StorageException.class,
        () -> pipeline.process(RawText.of("good", "kiosk"), clock.now()));

    assertTrue(ex.retryable());
    assertEquals(List.of(), connector.findBySource("kiosk"));
  }

  @Test
  void sqliteFactoryUsesAbsolutePath() throws Exception {
    JdbcStoreConnector fromPath = JdbcStoreConnector.sqlite(tempDir.resolve("other.db"), TIMEOUT);
    fromPath.migrate();

    assertEquals(List.of(), fromPath.findBySource("none"));
  }
}
