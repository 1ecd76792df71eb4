package ca.gc.cra.textpipe.api;

import ca.gc.cra.textpipe.config.ConfigMerger;
import ca.gc.cra.textpipe.config.DefaultsForMode;
import ca.gc.cra.textpipe.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Shared helpers combining CLI arguments with YAML and default configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI map
   * @return config path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Resolves the effective configuration for a command: defaults, then the optional YAML file named by
   * {@code config=}, then the remaining CLI arguments.
   *
   * @param mode command name
   * @param cliArgs mutable CLI map; {@code config} is removed from it
   * @param warn sink for override warnings
   * @return effective flat configuration
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or invalid, or merged values conflict
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliArgs, Consumer<String> warn)
      throws IOException {
    String configPath = extractConfigPath(cliArgs);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cliArgs, DefaultsForMode.asFlatMap(mode), warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && !value.isBlank() && Boolean.parseBoolean(value.trim());
  }
}
