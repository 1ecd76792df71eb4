package ca.gc.cra.textpipe.api;

import ca.gc.cra.textpipe.application.port.StoreConnector;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.config.PipelineConfig;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import ca.gc.cra.textpipe.logging.Logs;
import ca.gc.cra.textpipe.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints stored records by storage id or by source label.
 *
 * @since 0.1.0
 */
public final class ShowCli {
  private static final Logger log = LoggerFactory.getLogger(ShowCli.class);
  private static final String SUMMARY_USAGE = "usage: show id=STORAGE_ID | source=LABEL [db=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      textpipe show: print stored records

      Usage:
        show id=STORAGE_ID        Print one record
        show source=LABEL         List records stored from a source, oldest first

      Options:
        store=SQLITE|MEMORY       Store backend (default SQLITE)
        db=PATH                   SQLite file (default ~/.textpipe/textpipe.db)
        config=PATH               YAML file with 'common' and 'show' sections
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit codes: 0 found, 2 bad arguments, 3 I/O, 4 configuration, 6 not found.
      """;

  private ShowCli() {}

  /**
   * Executes the command.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String id;
    String source;
    Map<String, String> effective;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      id = kv.remove("id");
      source = kv.remove("source");
      boolean hasId = id != null && !id.isBlank();
      boolean hasSource = source != null && !source.isBlank();
      if (hasId == hasSource) {
        throw new IllegalArgumentException("exactly one of id or source is required");
      }
      effective = ConfigCliUtils.effectiveConfig("show", kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }

    PipelineConfig config;
    try {
      config = PipelineConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid pipeline configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (CliSession session = CliSession.open(config)) {
      StoreConnector store = session.root().storeConnector();
      if (id != null && !id.isBlank()) {
        Optional<ProcessedResult> found = store.findById(id.trim());
        if (found.isEmpty()) {
          CliPrinter.println("Record " + id.trim() + " not found");
          return ExitCode.STAGE_FAILURE;
        }
        ProcessCli.printResult(found.get());
        CliPrinter.println(" Original   : " + Logs.preview(found.get().originalContent()));
        return ExitCode.SUCCESS;
      }
      List<ProcessedResult> results = store.findBySource(source.trim());
      if (results.isEmpty()) {
        CliPrinter.println("No records from source " + source.trim());
        return ExitCode.STAGE_FAILURE;
      }
      for (ProcessedResult result : results) {
        CliPrinter.println(result.storageId() + "  " + result.traceId() + "  " + result.sentiment()
            + "  " + CliSession.formatScore(result.sentimentScore()) + "  " + Logs.preview(result.content()));
      }
      return ExitCode.SUCCESS;
    } catch (StoreException ex) {
      log.error("Store lookup failed: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Store configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in show command", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
