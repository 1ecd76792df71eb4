package ca.gc.cra.textpipe.infrastructure.persistence.jdbc;

import ca.gc.cra.textpipe.application.error.StorageFailureKind;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;

/**
 * Maps JDBC failures onto {@link StorageFailureKind}.
 *
 * <p>Transient: SQLState classes {@code 08} (connection) and {@code 40} (transaction rollback), the JDBC transient
 * and recoverable exception families, and SQLite {@code BUSY}/{@code LOCKED}. Everything else, constraint
 * violations in particular, is permanent.</p>
 *
 * @since 0.1.0
 */
public final class SqlFailureClassifier {
  static final int SQLITE_BUSY = 5;
  static final int SQLITE_LOCKED = 6;
  static final int SQLITE_CONSTRAINT = 19;

  private SqlFailureClassifier() {}

  /**
   * Classifies a JDBC failure.
   *
   * @param ex failure raised by the driver
   * @return transient or permanent
   */
  public static StorageFailureKind classify(SQLException ex) {
    if (ex instanceof SQLIntegrityConstraintViolationException) {
      return StorageFailureKind.PERMANENT;
    }
    if (ex instanceof SQLTransientException
        || ex instanceof SQLRecoverableException
        || ex instanceof SQLTimeoutException) {
      return StorageFailureKind.TRANSIENT;
    }
    String state = ex.getSQLState();
    if (state != null && state.length() >= 2) {
      String stateClass = state.substring(0, 2);
      if (stateClass.equals("23")) {
        return StorageFailureKind.PERMANENT;
      }
      if (stateClass.equals("08") || stateClass.equals("40")) {
        return StorageFailureKind.TRANSIENT;
      }
    }
    // SQLite reports extended result codes; the low byte is the primary code.
    int primary = ex.getErrorCode() & 0xff;
    if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
      return StorageFailureKind.TRANSIENT;
    }
    return StorageFailureKind.PERMANENT;
  }
}
