package ca.gc.cra.textpipe.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    cliCopy.forEach((key, value) -> {
      if (key == null || value == null) {
        return;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    });

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    StoreMode store = StoreMode.from(effective.get("store"), StoreMode.SQLITE);
    if (store == StoreMode.SQLITE && trim(effective.get("db")).isEmpty()) {
      throw new IllegalArgumentException("db is required when store=SQLITE");
    }
    if ("otlp".equalsIgnoreCase(trim(effective.get("metricsExporter")))
        && trim(effective.get("otelEndpoint")).startsWith("grpc://")) {
      throw new IllegalArgumentException("otelEndpoint must use http:// or https://");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
