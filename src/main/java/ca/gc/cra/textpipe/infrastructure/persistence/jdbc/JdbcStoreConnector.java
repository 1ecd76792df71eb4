package ca.gc.cra.textpipe.infrastructure.persistence.jdbc;

import ca.gc.cra.textpipe.application.error.StorageFailureKind;
import ca.gc.cra.textpipe.application.port.ClockPort;
import ca.gc.cra.textpipe.application.port.StoreConnector;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.application.port.StoreReceipt;
import ca.gc.cra.textpipe.application.port.StoreTransaction;
import ca.gc.cra.textpipe.domain.text.AnalyzedText;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import ca.gc.cra.textpipe.domain.text.Sentiment;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link StoreConnector} backed by a JDBC database (SQLite by default).
 * <p><strong>Why:</strong> Delegates durability and isolation to a real transactional engine.</p>
 * <p><strong>Role:</strong> Infrastructure adapter for the storage stage.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the {@code processed_results} schema via {@link #migrate()}.</li>
 *   <li>Open one connection per transaction with auto-commit disabled.</li>
 *   <li>Classify driver failures with {@link SqlFailureClassifier} before raising {@link StoreException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent transactions; SQLite serializes writers and the
 * {@code busy_timeout} pragma makes contending writers wait instead of failing at once.</p>
 * <p><strong>Performance:</strong> Opening a SQLite connection is cheap; no pool is kept.</p>
 * <p><strong>Observability:</strong> INFO on migration, DEBUG on classified driver failures.</p>
 *
 * @since 0.1.0
 */
public final class JdbcStoreConnector implements StoreConnector {
  private static final Logger log = LoggerFactory.getLogger(JdbcStoreConnector.class);

  static final String SCHEMA_RESOURCE = "/db/schema.sql";

  private static final String INSERT_SQL = "INSERT INTO processed_results "
      + "(storage_id, trace_id, source, original_content, cleaned_content, sentiment, sentiment_score, "
      + "confidence, metadata, stored_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
  private static final String SELECT_COLUMNS = "SELECT storage_id, trace_id, source, original_content, "
      + "cleaned_content, sentiment, sentiment_score, confidence, metadata, stored_at FROM processed_results ";

  private final String jdbcUrl;
  private final Duration busyTimeout;
  private final ClockPort clock;

  /**
   * Creates a connector for an arbitrary JDBC URL.
   *
   * @param jdbcUrl JDBC URL, e.g. {@code jdbc:sqlite:/var/lib/textpipe/textpipe.db}
   * @param busyTimeout how long a writer waits for a competing writer's lock
   * @param clock time source for the {@code stored_at} column
   */
  public JdbcStoreConnector(String jdbcUrl, Duration busyTimeout, ClockPort clock) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    this.busyTimeout = Objects.requireNonNull(busyTimeout, "busyTimeout");
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Creates a connector for a SQLite database file.
   *
   * @param file database file; created on first connection
   * @param busyTimeout lock wait for contending writers
   * @return connector; call {@link #migrate()} before use
   */
  public static JdbcStoreConnector sqlite(Path file, Duration busyTimeout) {
    return new JdbcStoreConnector("jdbc:sqlite:" + file.toAbsolutePath(), busyTimeout, ClockPort.SYSTEM);
  }

  /**
   * Creates the schema if it does not exist yet.
   *
   * @throws StoreException if the schema script cannot be read or executed
   */
  public void migrate() throws StoreException {
    String script = readSchema();
    try (Connection connection = open(); Statement statement = connection.createStatement()) {
      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          statement.executeUpdate(sql);
        }
      }
      connection.commit();
      log.info("Schema ready at {}", jdbcUrl);
    } catch (SQLException ex) {
      throw translate("schema migration failed", ex);
    }
  }

  @Override
  public StoreTransaction begin() throws StoreException {
    try {
      return new JdbcTransaction(open());
    } catch (SQLException ex) {
      throw translate("unable to open connection", ex);
    }
  }

  @Override
  public Optional<ProcessedResult> findById(String storageId) throws StoreException {
    List<ProcessedResult> rows = query(SELECT_COLUMNS + "WHERE storage_id = ?", storageId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<ProcessedResult> findBySource(String source) throws StoreException {
    return query(SELECT_COLUMNS + "WHERE source = ? ORDER BY stored_at, rowid", source);
  }

  private List<ProcessedResult> query(String sql, String parameter) throws StoreException {
    try (Connection connection = open(); PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, parameter);
      List<ProcessedResult> rows = new ArrayList<>();
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          rows.add(mapRow(rs));
        }
      }
      connection.commit();
      return rows;
    } catch (SQLException ex) {
      throw translate("query failed", ex);
    }
  }

  private static ProcessedResult mapRow(ResultSet rs) throws SQLException, StoreException {
    String metadata = rs.getString("metadata");
    try {
      return new ProcessedResult(
          rs.getString("cleaned_content"),
          rs.getString("original_content"),
          rs.getString("source"),
          rs.getString("trace_id"),
          Sentiment.valueOf(rs.getString("sentiment")),
          rs.getDouble("sentiment_score"),
          rs.getDouble("confidence"),
          MetadataCodec.decode(metadata),
          rs.getString("storage_id"),
          Instant.parse(rs.getString("stored_at")));
    } catch (JsonProcessingException ex) {
      throw new StoreException(StorageFailureKind.PERMANENT, "stored metadata is not valid JSON", ex);
    }
  }

  private Connection open() throws SQLException {
    Connection connection = DriverManager.getConnection(jdbcUrl);
    try (Statement statement = connection.createStatement()) {
      statement.execute("PRAGMA busy_timeout = " + busyTimeout.toMillis());
      connection.setAutoCommit(false);
      return connection;
    } catch (SQLException ex) {
      closeAfterFailure(connection, ex);
      throw ex;
    }
  }

  private String readSchema() throws StoreException {
    try (InputStream in = JdbcStoreConnector.class.getResourceAsStream(SCHEMA_RESOURCE)) {
      if (in == null) {
        throw new StoreException(StorageFailureKind.PERMANENT, "schema resource not found: " + SCHEMA_RESOURCE);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new StoreException(StorageFailureKind.PERMANENT, "unable to read schema resource", ex);
    }
  }

  private static StoreException translate(String context, SQLException ex) {
    StorageFailureKind kind = SqlFailureClassifier.classify(ex);
    log.debug("{}: SQLState={} code={} classified {}", context, ex.getSQLState(), ex.getErrorCode(), kind);
    return new StoreException(kind, context + ": " + ex.getMessage(), ex);
  }

  private static void closeAfterFailure(Connection connection, Exception failure) {
    try {
      connection.close();
    } catch (SQLException closeEx) {
      failure.addSuppressed(closeEx);
    }
  }

  private final class JdbcTransaction implements StoreTransaction {
    private final Connection connection;
    private boolean committed;
    private boolean closed;

    JdbcTransaction(Connection connection) {
      this.connection = connection;
    }

    @Override
    public StoreReceipt write(AnalyzedText record, Duration timeout) throws StoreException {
      String metadata;
      try {
        metadata = MetadataCodec.encode(record.metadata());
      } catch (JsonProcessingException ex) {
        throw new StoreException(StorageFailureKind.PERMANENT, "metadata cannot be encoded as JSON", ex);
      }
      String storageId = UUID.randomUUID().toString();
      Instant storedAt = clock.now();
      try (PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
        statement.setQueryTimeout(toQueryTimeoutSeconds(timeout));
        statement.setString(1, storageId);
        statement.setString(2, record.traceId());
        statement.setString(3, record.source());
        statement.setString(4, record.originalContent());
        statement.setString(5, record.content());
        statement.setString(6, record.sentiment().name());
        statement.setDouble(7, record.sentimentScore());
        statement.setDouble(8, record.confidence());
        statement.setString(9, metadata);
        statement.setString(10, storedAt.toString());
        statement.executeUpdate();
        return new StoreReceipt(storageId, storedAt);
      } catch (SQLException ex) {
        throw translate("insert failed", ex);
      }
    }

    @Override
    public void commit() throws StoreException {
      try {
        connection.commit();
        committed = true;
      } catch (SQLException ex) {
        throw translate("commit failed", ex);
      }
    }

    @Override
    public void rollback() throws StoreException {
      try {
        connection.rollback();
      } catch (SQLException ex) {
        throw translate("rollback failed", ex);
      }
    }

    @Override
    public void close() throws StoreException {
      if (closed) {
        return;
      }
      closed = true;
      try {
        if (!committed) {
          connection.rollback();
        }
      } catch (SQLException ex) {
        StoreException failure = translate("rollback on close failed", ex);
        closeAfterFailure(connection, failure);
        throw failure;
      }
      try {
        connection.close();
      } catch (SQLException ex) {
        throw translate("close failed", ex);
      }
    }

    private int toQueryTimeoutSeconds(Duration timeout) {
      long millis = Math.max(1L, timeout.toMillis());
      return (int) Math.min(Integer.MAX_VALUE, (millis + 999) / 1000);
    }
  }
}
