package ca.gc.cra.textpipe.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("pipeline.submission.completed");
    adapter.increment("pipeline.submission.completed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "pipeline.submission.completed");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("pipeline.submission.completed",
        point.getAttributes().get(AttributeKey.stringKey("textpipe.metric.key")));
    assertEquals("textpipe", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsStageLatencyHistogram() {
    adapter.observe("pipeline.stage.TextCleaner.latencyNanos", 1_500);
    adapter.observe("pipeline.stage.TextCleaner.latencyNanos", 2_500);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "pipeline.stage.textcleaner.latencynanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum(), 1e-9);
  }

  @Test
  void namesAreSanitized() {
    assertEquals("pipeline.stage.databasestorer.failed",
        OpenTelemetryMetricsAdapter.sanitizeName("pipeline.stage.DatabaseStorer.failed"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitizeName("a b"));
    assertEquals("textpipe.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void noneExporterIsNoop() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter("none", "");
    noop.increment("ignored");
    assertFalse(noop.isExporting());
    noop.close();
    assertTrue(adapter.isExporting());
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new OpenTelemetryMetricsAdapter("prometheus", ""));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
