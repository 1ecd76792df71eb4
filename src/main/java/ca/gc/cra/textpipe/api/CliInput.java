package ca.gc.cra.textpipe.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed command line split into the {@code --help}/{@code --verbose} flags and {@code key=value} arguments.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments. Arguments are kept verbatim (no trimming) so free-text values such as
   * {@code content=...} reach the pipeline unchanged.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], false, false);
    }
    List<String> kv = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String lower = raw.trim().toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else {
        kv.add(raw);
      }
    }
    return new CliInput(kv.toArray(String[]::new), help, verbose);
  }

  /**
   * Returns a copy of the non-flag arguments.
   *
   * @return arguments intended for key=value parsing (or the command name)
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /** @return {@code true} if help output was requested */
  public boolean help() {
    return help;
  }

  /** @return {@code true} when {@code --verbose} (or an alias) was present */
  public boolean verbose() {
    return verbose;
  }
}
