package ca.gc.cra.textpipe.api;

import ca.gc.cra.textpipe.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>Values of free-text keys ({@code content}) are kept exactly as given, including surrounding whitespace,
 * tabs, and newlines; all other values are trimmed and must be free of control characters.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final Set<String> FREE_TEXT_KEYS = Set.of("content");

  private CliArgsParser() {}

  /**
   * Converts arguments into a mutable map split on the first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException if an argument is not {@code key=value} or contains forbidden characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      int idx = raw.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw.trim() + "')");
      }
      String key = raw.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      String value = raw.substring(idx + 1);
      if (value.indexOf('\0') >= 0) {
        throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
      }
      if (FREE_TEXT_KEYS.contains(key)) {
        map.put(key, value);
        continue;
      }
      String trimmed = value.trim();
      if (!trimmed.isEmpty()) {
        // Blank values are allowed so a CLI argument can clear a YAML setting.
        trimmed = Strings.requireNonBlank(key, trimmed);
      }
      map.put(key, trimmed);
    }
    return map;
  }
}
