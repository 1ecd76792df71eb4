package ca.gc.cra.textpipe.infrastructure.persistence.memory;

import ca.gc.cra.textpipe.application.error.StorageFailureKind;
import ca.gc.cra.textpipe.application.port.ClockPort;
import ca.gc.cra.textpipe.application.port.StoreConnector;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.application.port.StoreReceipt;
import ca.gc.cra.textpipe.application.port.StoreTransaction;
import ca.gc.cra.textpipe.domain.text.AnalyzedText;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Transactional {@link StoreConnector} kept in process memory.
 * <p><strong>Why:</strong> Lets the pipeline run without a database ({@code store=MEMORY}) and gives tests a store
 * whose failures can be scripted.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stage writes per transaction and publish them atomically on commit.</li>
 *   <li>Enforce one committed record per trace id, like the JDBC schema.</li>
 *   <li>Run an optional {@link WriteInterceptor} before each write and fail scripted commits.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Commits and lookups synchronize on the store; transactions are confined to one
 * caller.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryStoreConnector implements StoreConnector {
  private static final Logger log = LoggerFactory.getLogger(InMemoryStoreConnector.class);

  /** Hook invoked before each write; may throw to simulate store failures or advance a test clock. */
  @FunctionalInterface
  public interface WriteInterceptor {
    void beforeWrite(AnalyzedText record, Duration timeout) throws StoreException;

    WriteInterceptor NONE = (record, timeout) -> {};
  }

  private final ClockPort clock;
  private final Map<String, ProcessedResult> committed = new LinkedHashMap<>();
  private final Map<String, String> storageIdByTrace = new LinkedHashMap<>();
  private final AtomicInteger commits = new AtomicInteger();
  private final AtomicInteger rollbacks = new AtomicInteger();
  private final AtomicInteger commitFailuresRemaining = new AtomicInteger();
  private volatile StorageFailureKind commitFailureKind = StorageFailureKind.TRANSIENT;
  private volatile WriteInterceptor interceptor = WriteInterceptor.NONE;

  public InMemoryStoreConnector() {
    this(ClockPort.SYSTEM);
  }

  public InMemoryStoreConnector(ClockPort clock) {
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Installs a hook run before every write.
   *
   * @param interceptor hook; {@code null} removes it
   */
  public void setWriteInterceptor(WriteInterceptor interceptor) {
    this.interceptor = Objects.requireNonNullElse(interceptor, WriteInterceptor.NONE);
  }

  /**
   * Makes the next {@code count} commits fail with the given kind.
   *
   * @param kind failure classification to report
   * @param count number of commits to fail
   */
  public void failNextCommits(StorageFailureKind kind, int count) {
    this.commitFailureKind = Objects.requireNonNull(kind, "kind");
    this.commitFailuresRemaining.set(count);
  }

  @Override
  public StoreTransaction begin() {
    return new MemoryTransaction();
  }

  @Override
  public synchronized Optional<ProcessedResult> findById(String storageId) {
    return Optional.ofNullable(committed.get(storageId));
  }

  @Override
  public synchronized List<ProcessedResult> findBySource(String source) {
    List<ProcessedResult> matches = new ArrayList<>();
    for (ProcessedResult result : committed.values()) {
      if (result.source().equals(source)) {
        matches.add(result);
      }
    }
    return matches;
  }

  /** @return number of committed records */
  public synchronized int size() {
    return committed.size();
  }

  /** @return number of successful commits */
  public int commitCount() {
    return commits.get();
  }

  /** @return number of transactions rolled back, explicitly or on close */
  public int rollbackCount() {
    return rollbacks.get();
  }

  private synchronized void publish(Map<String, ProcessedResult> staged) throws StoreException {
    if (commitFailuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new StoreException(commitFailureKind, "injected commit failure");
    }
    for (ProcessedResult result : staged.values()) {
      if (storageIdByTrace.containsKey(result.traceId())) {
        throw new StoreException(StorageFailureKind.PERMANENT,
            "duplicate trace id " + result.traceId() + " violates uniqueness");
      }
    }
    for (ProcessedResult result : staged.values()) {
      committed.put(result.storageId(), result);
      storageIdByTrace.put(result.traceId(), result.storageId());
    }
    commits.incrementAndGet();
  }

  private synchronized boolean traceCommitted(String traceId) {
    return storageIdByTrace.containsKey(traceId);
  }

  private final class MemoryTransaction implements StoreTransaction {
    private final Map<String, ProcessedResult> staged = new LinkedHashMap<>();
    private boolean done;

    @Override
    public StoreReceipt write(AnalyzedText record, Duration timeout) throws StoreException {
      ensureOpen();
      interceptor.beforeWrite(record, timeout);
      if (traceCommitted(record.traceId()) || containsTrace(record.traceId())) {
        throw new StoreException(StorageFailureKind.PERMANENT,
            "duplicate trace id " + record.traceId() + " violates uniqueness");
      }
      String storageId = UUID.randomUUID().toString();
      ProcessedResult result = ProcessedResult.from(record, storageId, clock.now());
      staged.put(storageId, result);
      return new StoreReceipt(storageId, result.storedAt());
    }

    @Override
    public void commit() throws StoreException {
      ensureOpen();
      publish(staged);
      done = true;
      log.debug("Committed {} staged records", staged.size());
    }

    @Override
    public void rollback() {
      if (!done) {
        staged.clear();
        done = true;
        rollbacks.incrementAndGet();
      }
    }

    @Override
    public void close() {
      rollback();
    }

    private boolean containsTrace(String traceId) {
      for (ProcessedResult result : staged.values()) {
        if (result.traceId().equals(traceId)) {
          return true;
        }
      }
      return false;
    }

    private void ensureOpen() throws StoreException {
      if (done) {
        throw new StoreException(StorageFailureKind.PERMANENT, "transaction already finished");
      }
    }
  }
}
