package ca.gc.cra.textpipe.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads pipeline configuration from a YAML document with a {@code common} section and one section per CLI mode:
 *
 * <pre>
 * common:
 *   store: SQLITE
 *   db: /var/lib/textpipe/textpipe.db
 * batch:
 *   workers: 8
 * </pre>
 *
 * Mode values override common values. Nested mappings flatten to dotted keys; lists are rejected.
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final String COMMON = "common";
  private static final Set<String> SECTIONS = Set.of(COMMON, "process", "batch", "show");

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges {@code common} with the {@code mode} section.
   *
   * @param path YAML file
   * @param mode CLI mode (process, batch, show)
   * @return flat map of settings; empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or has the wrong shape
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String section = mode.trim().toLowerCase(Locale.ROOT);
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      String name = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(name)) {
        log.warn("Ignoring unknown section '{}' in {}", entry.getKey(), path);
      }
    }
    flattenSection(root, COMMON, flattened);
    flattenSection(root, section, flattened);
    return Optional.of(Map.copyOf(flattened));
  }

  private static void flattenSection(Map<String, Object> root, String name, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name) && entry.getValue() != null) {
        flatten(asMap(entry.getValue(), name), "", target);
      }
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String text) || text.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(text, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    });
  }
}
