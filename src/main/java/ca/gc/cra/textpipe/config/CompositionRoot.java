package ca.gc.cra.textpipe.config;

import ca.gc.cra.textpipe.application.error.AnalysisException;
import ca.gc.cra.textpipe.application.pipeline.BatchProcessingUseCase;
import ca.gc.cra.textpipe.application.pipeline.RetryPolicy;
import ca.gc.cra.textpipe.application.pipeline.RetryingSubmitter;
import ca.gc.cra.textpipe.application.pipeline.TextPipeline;
import ca.gc.cra.textpipe.application.port.ClockPort;
import ca.gc.cra.textpipe.application.port.MetricsPort;
import ca.gc.cra.textpipe.application.port.StoreConnector;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.application.stage.LexiconLoader;
import ca.gc.cra.textpipe.application.stage.LexiconSentimentStage;
import ca.gc.cra.textpipe.application.stage.TextCleaningStage;
import ca.gc.cra.textpipe.application.stage.TransactionalStorageStage;
import ca.gc.cra.textpipe.domain.sentiment.SentimentLexicon;
import ca.gc.cra.textpipe.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.textpipe.infrastructure.persistence.jdbc.JdbcStoreConnector;
import ca.gc.cra.textpipe.infrastructure.persistence.memory.InMemoryStoreConnector;
import ca.gc.cra.textpipe.validation.Paths;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires stages, store connector, metrics, and orchestrator from a {@link PipelineConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the CLI and tests assemble identical pipelines.</p>
 * <p><strong>Role:</strong> Composition root spanning the clean, analyze, and store stages.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open and migrate the configured store once, and close it on {@link #close()}.</li>
 *   <li>Load the lexicon (bundled or from file) before the pipeline is built.</li>
 *   <li>Expose the pipeline, the retrying submitter, and the batch use case.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Lazy initialization is synchronized; built components are thread-safe.</p>
 * <p><strong>Observability:</strong> Logs the chosen store and lexicon at INFO.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private StoreConnector connector;
  private TextPipeline pipeline;

  /**
   * Creates a composition root with the system clock.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by all components
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics) {
    this(config, metrics, ClockPort.SYSTEM);
  }

  /**
   * Creates a composition root.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by all components
   * @param clock time source for stages and storage
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Creates the metrics adapter selected by {@code metricsExporter}.
   *
   * @param config validated configuration
   * @return OpenTelemetry adapter, or {@link MetricsPort#NO_OP} when export is disabled
   */
  public static MetricsPort metricsFor(PipelineConfig config) {
    if (config.metricsExporter().equals("none")) {
      return MetricsPort.NO_OP;
    }
    return new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otelEndpoint().orElse(""));
  }

  /**
   * Returns the store connector, opening and migrating it on first use.
   *
   * @return connector owned by this root
   * @throws StoreException if the store cannot be opened or migrated
   */
  public synchronized StoreConnector storeConnector() throws StoreException {
    if (connector == null) {
      connector = openStore();
    }
    return connector;
  }

  /**
   * Returns the pipeline, building it on first use.
   *
   * @return clean, analyze, store pipeline
   * @throws StoreException if the store cannot be opened
   * @throws AnalysisException if the lexicon cannot be loaded
   */
  public synchronized TextPipeline pipeline() throws StoreException, AnalysisException {
    if (pipeline == null) {
      SentimentLexicon lexicon = loadLexicon();
      pipeline = new TextPipeline(
          List.of(
              new TextCleaningStage(),
              new LexiconSentimentStage(lexicon),
              new TransactionalStorageStage(storeConnector(), config.storageTimeout())),
          metrics,
          clock);
    }
    return pipeline;
  }

  /**
   * Returns a submitter applying the configured retry policy.
   *
   * @return retrying submitter over {@link #pipeline()}
   * @throws StoreException if the store cannot be opened
   * @throws AnalysisException if the lexicon cannot be loaded
   */
  public RetryingSubmitter submitter() throws StoreException, AnalysisException {
    RetryPolicy policy = RetryPolicy.exponential(config.retryMaxAttempts(), config.retryBackoff());
    return new RetryingSubmitter(pipeline(), policy, metrics, clock, RetryingSubmitter.Sleeper.THREAD);
  }

  /**
   * Returns the batch use case sized by {@code workers}.
   *
   * @return batch use case
   * @throws StoreException if the store cannot be opened
   * @throws AnalysisException if the lexicon cannot be loaded
   */
  public BatchProcessingUseCase batchUseCase() throws StoreException, AnalysisException {
    return new BatchProcessingUseCase(submitter(), config.workers());
  }

  /**
   * Closes the store connector if it was opened.
   *
   * @throws StoreException if the connector fails to close
   */
  @Override
  public synchronized void close() throws StoreException {
    if (connector != null) {
      StoreConnector current = connector;
      connector = null;
      pipeline = null;
      current.close();
    }
  }

  private StoreConnector openStore() throws StoreException {
    return switch (config.store()) {
      case MEMORY -> {
        log.info("Using in-memory store; records are discarded on exit");
        yield new InMemoryStoreConnector(clock);
      }
      case SQLITE -> {
        Path file = Paths.validateDatabaseFile(config.database().orElseThrow());
        JdbcStoreConnector jdbc = new JdbcStoreConnector("jdbc:sqlite:" + file, config.storageTimeout(), clock);
        jdbc.migrate();
        log.info("Using SQLite store at {}", file);
        yield jdbc;
      }
    };
  }

  private SentimentLexicon loadLexicon() throws AnalysisException {
    if (config.lexicon().isPresent()) {
      Path file = config.lexicon().get();
      log.info("Loading lexicon from {}", file);
      return LexiconLoader.load(file);
    }
    return LexiconLoader.loadDefault();
  }
}
