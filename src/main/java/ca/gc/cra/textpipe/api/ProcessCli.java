package ca.gc.cra.textpipe.api;

import ca.gc.cra.textpipe.application.error.AnalysisException;
import ca.gc.cra.textpipe.application.error.StageException;
import ca.gc.cra.textpipe.application.pipeline.RetryingSubmitter;
import ca.gc.cra.textpipe.application.pipeline.SubmissionOutcome;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.config.PipelineConfig;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import ca.gc.cra.textpipe.domain.text.RawText;
import ca.gc.cra.textpipe.logging.Logs;
import ca.gc.cra.textpipe.logging.LoggingConfigurator;
import ca.gc.cra.textpipe.validation.Numbers;
import ca.gc.cra.textpipe.validation.Strings;
import java.io.IOException;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one text submission through the pipeline and prints the stored record.
 *
 * @since 0.1.0
 */
public final class ProcessCli {
  private static final Logger log = LoggerFactory.getLogger(ProcessCli.class);
  private static final String META_PREFIX = "meta.";
  private static final String SUMMARY_USAGE =
      "usage: process content=TEXT [source=LABEL] [traceId=ID] [meta.KEY=VALUE ...] [deadlineMillis=N] "
          + "[store=SQLITE|MEMORY] [db=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      textpipe process: clean, analyze, and store one text

      Usage:
        process content=TEXT [options]

      Submission:
        content=TEXT              Raw text; kept verbatim, markup and whitespace included
        source=LABEL              Origin label (default cli)
        traceId=ID                Correlation id (default: generated UUID)
        meta.KEY=VALUE            Metadata attribute stored with the record (repeatable)
        deadlineMillis=N          Give up storing after N ms (1..600000)

      Pipeline options:
        store=SQLITE|MEMORY       Store backend (default SQLITE)
        db=PATH                   SQLite file (default ~/.textpipe/textpipe.db)
        storageTimeoutMillis=N    Bound for one storage write (default 5000)
        lexicon=PATH              YAML lexicon with 'positive' and 'negative' lists
        retryMaxAttempts=N        Attempts for transient failures (default 3)
        retryBackoffMillis=N      First retry pause (default 200)
        metricsExporter=otlp|none Metrics export (default none)
        config=PATH               YAML file with 'common' and 'process' sections
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit codes: 0 stored, 2 bad arguments, 3 I/O, 4 configuration, 6 rejected by a stage.
      """;

  private ProcessCli() {}

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

    Map<String, String> kv;
    RawText raw;
    Instant deadline;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      String content = kv.remove("content");
      if (content == null) {
        throw new IllegalArgumentException("content is required");
      }
      String traceId = kv.remove("traceId");
      if (traceId != null && !traceId.isBlank()) {
        traceId = Strings.requireIdentifier("traceId", traceId);
      }
      String deadlineRaw = kv.remove("deadlineMillis");
      deadline = deadlineRaw == null
          ? null
          : Instant.now().plusMillis(Numbers.parseRange("deadlineMillis", deadlineRaw, 1, 600_000));
      Map<String, String> metadata = extractMetadata(kv);
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("process", kv, log::warn);
      if (ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      raw = new RawText(content, effective.get("source"), Instant.now(), traceId, metadata);
      kv = effective;
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
      config = PipelineConfig.fromMap(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid pipeline configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (CliSession session = CliSession.open(config)) {
      RetryingSubmitter submitter = session.root().submitter();
      SubmissionOutcome outcome = submitter.submit(raw, deadline);
      if (outcome instanceof SubmissionOutcome.Completed completed) {
        printResult(completed.result());
        return ExitCode.SUCCESS;
      }
      StageException error = ((SubmissionOutcome.Failed) outcome).error();
      CliPrinter.printLines(
          "Submission rejected",
          " Trace id  : " + error.traceId(),
          " Stage     : " + error.stageName(),
          " Retryable : " + error.retryable(),
          " Reason    : " + error.getMessage());
      return ExitCode.STAGE_FAILURE;
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
      log.error("Process command interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in process command", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Map<String, String> extractMetadata(Map<String, String> kv) {
    Map<String, String> metadata = new LinkedHashMap<>();
    Iterator<Map.Entry<String, String>> it = kv.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, String> entry = it.next();
      if (entry.getKey().startsWith(META_PREFIX)) {
        String key = entry.getKey().substring(META_PREFIX.length());
        if (key.isEmpty()) {
          throw new IllegalArgumentException("metadata key must not be empty");
        }
        metadata.put(key, entry.getValue());
        it.remove();
      }
    }
    return metadata;
  }

  static void printResult(ProcessedResult result) {
    CliPrinter.printLines(
        "Stored " + result.storageId(),
        " Trace id   : " + result.traceId(),
        " Source     : " + result.source(),
        " Sentiment  : " + result.sentiment()
            + " (score " + CliSession.formatScore(result.sentimentScore())
            + ", confidence " + CliSession.formatScore(result.confidence()) + ")",
        " Content    : " + Logs.preview(result.content()),
        " Metadata   : " + result.metadata(),
        " Stored at  : " + result.storedAt());
  }
}
