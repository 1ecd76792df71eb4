package ca.gc.cra.textpipe.api;

import ca.gc.cra.textpipe.application.port.MetricsPort;
import ca.gc.cra.textpipe.application.port.StoreException;
import ca.gc.cra.textpipe.config.CompositionRoot;
import ca.gc.cra.textpipe.config.PipelineConfig;
import ca.gc.cra.textpipe.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resources a single command invocation owns: the composition root (and its store) plus the metrics adapter.
 */
final class CliSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CliSession.class);

  private final MetricsPort metrics;
  private final CompositionRoot root;

  private CliSession(MetricsPort metrics, CompositionRoot root) {
    this.metrics = metrics;
    this.root = root;
  }

  static CliSession open(PipelineConfig config) {
    MetricsPort metrics = CompositionRoot.metricsFor(config);
    return new CliSession(metrics, new CompositionRoot(config, metrics));
  }

  CompositionRoot root() {
    return root;
  }

  static String formatScore(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }

  @Override
  public void close() {
    try {
      root.close();
    } catch (StoreException ex) {
      log.warn("Failed to close store cleanly: {}", ex.getMessage(), ex);
    }
    if (metrics instanceof OpenTelemetryMetricsAdapter adapter) {
      adapter.close();
    }
  }
}
