package ca.gc.cra.textpipe.config;

import ca.gc.cra.textpipe.validation.Numbers;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed, validated settings used to assemble a pipeline.
 * <p><strong>Why:</strong> Keeps string parsing at the edge so the composition root only sees valid values.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param store store backend
 * @param database SQLite file; required when {@code store} is {@link StoreMode#SQLITE}
 * @param storageTimeout bound for one storage write and commit
 * @param lexicon optional lexicon file; empty selects the bundled lexicon
 * @param retryMaxAttempts total attempts per submission
 * @param retryBackoff pause before the first retry
 * @param workers batch worker threads
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint; empty selects the exporter default
 * @since 0.1.0
 */
public record PipelineConfig(
    StoreMode store,
    Optional<Path> database,
    Duration storageTimeout,
    Optional<Path> lexicon,
    int retryMaxAttempts,
    Duration retryBackoff,
    int workers,
    String metricsExporter,
    Optional<String> otelEndpoint) {

  static final long MAX_STORAGE_TIMEOUT_MILLIS = 600_000L;
  static final int MAX_RETRY_ATTEMPTS = 10;
  static final long MAX_RETRY_BACKOFF_MILLIS = 60_000L;
  static final int MAX_WORKERS = 64;

  public PipelineConfig {
    Objects.requireNonNull(store, "store");
    database = database == null ? Optional.empty() : database.map(p -> p.toAbsolutePath().normalize());
    lexicon = lexicon == null ? Optional.empty() : lexicon.map(p -> p.toAbsolutePath().normalize());
    otelEndpoint = otelEndpoint == null ? Optional.empty() : otelEndpoint;
    Objects.requireNonNull(storageTimeout, "storageTimeout");
    Objects.requireNonNull(retryBackoff, "retryBackoff");
    Numbers.requireRange("storageTimeoutMillis", storageTimeout.toMillis(), 1, MAX_STORAGE_TIMEOUT_MILLIS);
    Numbers.requireRange("retryMaxAttempts", retryMaxAttempts, 1, MAX_RETRY_ATTEMPTS);
    Numbers.requireRange("retryBackoffMillis", retryBackoff.toMillis(), 0, MAX_RETRY_BACKOFF_MILLIS);
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    metricsExporter = metricsExporter == null ? "none" : metricsExporter.trim().toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("none") && !metricsExporter.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + metricsExporter + ")");
    }
    if (store == StoreMode.SQLITE && database.isEmpty()) {
      throw new IllegalArgumentException("db is required when store=SQLITE");
    }
  }

  /**
   * Returns the built-in defaults: SQLite at {@code ~/.textpipe/textpipe.db}, 5 s storage timeout, 3 attempts
   * with 200 ms initial backoff, 4 workers, no metrics export.
   *
   * @return default configuration
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(
        StoreMode.SQLITE,
        Optional.of(DefaultsForMode.defaultDatabase()),
        Duration.ofMillis(5_000),
        Optional.empty(),
        3,
        Duration.ofMillis(200),
        4,
        "none",
        Optional.empty());
  }

  /**
   * Builds configuration from a merged flat map.
   *
   * @param options effective key/value map (see {@link ConfigMerger})
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PipelineConfig defaults = defaults();
    StoreMode store = StoreMode.from(options.get("store"), defaults.store());
    Optional<Path> database = optionalPath("db", options.get("db"));
    if (store == StoreMode.SQLITE && database.isEmpty()) {
      database = defaults.database();
    }
    return new PipelineConfig(
        store,
        database,
        Duration.ofMillis(parseLong(options, "storageTimeoutMillis", defaults.storageTimeout().toMillis(),
            1, MAX_STORAGE_TIMEOUT_MILLIS)),
        optionalPath("lexicon", options.get("lexicon")),
        (int) parseLong(options, "retryMaxAttempts", defaults.retryMaxAttempts(), 1, MAX_RETRY_ATTEMPTS),
        Duration.ofMillis(parseLong(options, "retryBackoffMillis", defaults.retryBackoff().toMillis(),
            0, MAX_RETRY_BACKOFF_MILLIS)),
        (int) parseLong(options, "workers", defaults.workers(), 1, MAX_WORKERS),
        optionalString(options.get("metricsExporter")).orElse(defaults.metricsExporter()),
        optionalString(options.get("otelEndpoint")));
  }

  private static long parseLong(Map<String, String> options, String key, long fallback, long min, long max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseRange(key, raw, min, max);
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static Optional<Path> optionalPath(String name, String value) {
    return optionalString(value).map(raw -> parsePath(name, raw));
  }

  private static Path parsePath(String name, String raw) {
    String expanded = raw.startsWith("~/") || raw.equals("~")
        ? System.getProperty("user.home", ".") + raw.substring(1)
        : raw;
    try {
      return Path.of(expanded);
    } catch (RuntimeException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }
}
