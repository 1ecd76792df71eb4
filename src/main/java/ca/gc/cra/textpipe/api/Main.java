package ca.gc.cra.textpipe.api;

import ca.gc.cra.textpipe.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * textpipe CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: textpipe <process|batch|show> [key=value ...]";
  private static final String HELP_TEXT = """
      textpipe: clean, score, and store text

      Usage:
        textpipe <command> [options]

      Commands:
        process     Run one text through the pipeline (process --help for details)
        batch       Run an NDJSON file of texts in parallel
        show        Print stored records

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the command)
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      String arg = safeArgs[i];
      if (arg != null && !arg.isBlank() && !arg.trim().startsWith("-")
          && !"help".equalsIgnoreCase(arg.trim())) {
        commandIndex = i;
        break;
      }
    }
    CliInput flags = CliInput.parse(safeArgs);
    if (commandIndex < 0) {
      if (flags.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (flags.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    List<String> delegate = new ArrayList<>(List.of(safeArgs).subList(0, commandIndex));
    delegate.addAll(List.of(safeArgs).subList(commandIndex + 1, safeArgs.length));
    String[] delegateArgs = delegate.toArray(String[]::new);

    return switch (command) {
      case "process" -> ProcessCli.run(delegateArgs);
      case "batch" -> BatchCli.run(delegateArgs);
      case "show" -> ShowCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
