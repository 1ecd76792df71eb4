package ca.gc.cra.textpipe.config;

import java.util.Locale;

/**
 * Store backends the pipeline can persist to.
 *
 * @since 0.1.0
 */
public enum StoreMode {
  /** SQLite database file reached through JDBC. */
  SQLITE,
  /** In-process store; records are lost when the JVM exits. */
  MEMORY;

  /**
   * Parses a store mode, case-insensitively.
   *
   * @param raw textual value; blank selects {@code fallback}
   * @param fallback value used when {@code raw} is blank
   * @return parsed mode
   * @throws IllegalArgumentException if {@code raw} names no mode
   */
  public static StoreMode from(String raw, StoreMode fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("store must be SQLITE or MEMORY (was " + raw + ")", ex);
    }
  }
}
