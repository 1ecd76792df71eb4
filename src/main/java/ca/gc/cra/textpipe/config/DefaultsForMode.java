package ca.gc.cra.textpipe.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI overrides.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code process}, {@code batch}, {@code show})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "process" -> Map.of("source", "cli");
      case "batch" -> Map.of("workers", "4", "in", "");
      case "show" -> Map.<String, String>of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  /**
   * Returns the default SQLite database location, {@code ~/.textpipe/textpipe.db}.
   *
   * @return default database path
   */
  public static Path defaultDatabase() {
    return Path.of(System.getProperty("user.home", "."), ".textpipe", "textpipe.db");
  }

  private static Map<String, String> buildCommonDefaults() {
    PipelineConfig defaults = PipelineConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("store", defaults.store().name());
    map.put("db", defaultDatabase().toString());
    map.put("storageTimeoutMillis", Long.toString(defaults.storageTimeout().toMillis()));
    map.put("lexicon", "");
    map.put("retryMaxAttempts", Integer.toString(defaults.retryMaxAttempts()));
    map.put("retryBackoffMillis", Long.toString(defaults.retryBackoff().toMillis()));
    map.put("metricsExporter", defaults.metricsExporter());
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}
