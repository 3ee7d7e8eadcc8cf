package io.netguard.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

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
    adapter.increment("pipeline.blocked");
    adapter.increment("pipeline.blocked");
    adapter.forceFlush();

    MetricData counter = metric(reader.collectAllMetrics(), "pipeline.blocked");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("pipeline.blocked", point.getAttributes().get(AttributeKey.stringKey("netguard.metric.key")));
    assertEquals("netguard", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("classifier.latencyMs", 12);
    adapter.observe("classifier.latencyMs", 30);

    MetricData histogram = metric(reader.collectAllMetrics(), "classifier.latencyms");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(42.0, point.getSum(), 1e-9);
    assertEquals("classifier.latencyMs", point.getAttributes().get(AttributeKey.stringKey("netguard.metric.key")));
  }

  @Test
  void sanitizeProducesValidInstrumentNames() {
    assertEquals("sampler.pass", OpenTelemetryMetricsAdapter.sanitize("sampler.pass"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitize("9lives"));
    assertEquals("enforce_hosts_file", OpenTelemetryMetricsAdapter.sanitize("Enforce hosts/file"));
    assertEquals("netguard.metric", OpenTelemetryMetricsAdapter.sanitize(" "));
  }

  private static MetricData metric(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
