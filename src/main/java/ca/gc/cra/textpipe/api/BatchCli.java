package ca.gc.cra.textpipe.api;

import ca.gc.cra.textpipe.application.error.AnalysisException;
import ca.gc.cra.textpipe.application.pipeline.BatchSummary;
import ca.gc.cra.textpipe.application.pipeline.SubmissionOutcome;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.config.PipelineConfig;
import ca.gc.cra.textpipe.domain.text.RawText;
import ca.gc.cra.textpipe.infrastructure.io.NdjsonRawTextReader;
import ca.gc.cra.textpipe.logging.LoggingConfigurator;
import ca.gc.cra.textpipe.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes an NDJSON file of submissions in parallel and prints a summary.
 *
 * @since 0.1.0
 */
public final class BatchCli {
  private static final Logger log = LoggerFactory.getLogger(BatchCli.class);
  private static final String SUMMARY_USAGE =
      "usage: batch in=FILE.ndjson [workers=N] [store=SQLITE|MEMORY] [db=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      textpipe batch: process many submissions from an NDJSON file

      Usage:
        batch in=FILE.ndjson [options]

      Input:
        in=PATH                   One JSON object per line:
                                  {"content":"...","source":"...","traceId":"...","metadata":{"k":"v"}}

      Options:
        workers=N                 Parallel workers (1..64, default 4)
        store=SQLITE|MEMORY       Store backend (default SQLITE)
        db=PATH                   SQLite file (default ~/.textpipe/textpipe.db)
        storageTimeoutMillis=N    Bound for one storage write (default 5000)
        lexicon=PATH              YAML lexicon with 'positive' and 'negative' lists
        retryMaxAttempts=N        Attempts for transient failures (default 3)
        retryBackoffMillis=N      First retry pause (default 200)
        metricsExporter=otlp|none Metrics export (default none)
        config=PATH               YAML file with 'common' and 'batch' sections
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit codes: 0 all stored, 2 bad arguments or input, 3 I/O, 4 configuration, 6 some submissions rejected.
      """;

  private BatchCli() {}

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

    Map<String, String> effective;
    Path inputFile;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      effective = ConfigCliUtils.effectiveConfig("batch", kv, log::warn);
      String in = effective.get("in");
      if (in == null || in.isBlank()) {
        throw new IllegalArgumentException("in is required");
      }
      inputFile = Paths.validateReadableFile("in", Path.of(in));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }
    if (ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }

    List<RawText> submissions;
    try {
      submissions = new NdjsonRawTextReader().read(inputFile);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid batch input {}: {}", inputFile, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read batch input {}", inputFile, ex);
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
      BatchSummary summary = session.root().batchUseCase().run(submissions);
      printSummary(inputFile, summary);
      return summary.allCompleted() ? ExitCode.SUCCESS : ExitCode.STAGE_FAILURE;
    } catch (AnalysisException ex) {
      log.error("Unable to load sentiment lexicon: {}", ex.getMessage(), ex);
      return ex.retryable() ? ExitCode.IO_ERROR : ExitCode.CONFIG_ERROR;
    } catch (StoreException ex) {
      log.error("Unable to open store: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Pipeline configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Batch interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in batch command", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printSummary(Path inputFile, BatchSummary summary) {
    CliPrinter.printLines(
        "Batch " + inputFile,
        " Submissions : " + summary.total(),
        " Stored      : " + summary.completed(),
        " Rejected    : " + summary.failed(),
        " By stage    : " + summary.failuresByStage());
    for (SubmissionOutcome outcome : summary.outcomes()) {
      if (outcome instanceof SubmissionOutcome.Failed failed) {
        CliPrinter.println(" REJECTED " + failed.traceId() + " in " + failed.error().stageName()
            + ": " + failed.error().getMessage());
      }
    }
  }
}
