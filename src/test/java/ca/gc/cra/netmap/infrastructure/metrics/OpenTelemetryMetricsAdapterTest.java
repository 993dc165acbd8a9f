package ca.gc.cra.netmap.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY = AttributeKey.stringKey("netmap.metric.key");

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
  void countersSumIncrementsAndAdds() {
    adapter.increment("ingest.records.accepted");
    adapter.add("ingest.records.accepted", 4);
    adapter.add("ingest.records.accepted", 0);
    adapter.forceFlush();

    MetricData counter = metric("ingest.records.accepted").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(5L, point.getValue());
    assertEquals("ingest.records.accepted", point.getAttributes().get(KEY));
    assertEquals("netmap", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observationsBecomeHistograms() {
    adapter.observe("ingest.batch.latencyNanos", 12);
    adapter.observe("ingest.batch.latencyNanos", 30);
    adapter.forceFlush();

    MetricData histogram = metric("ingest.batch.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(42.0, point.getSum());
    assertEquals("ingest.batch.latencyNanos", point.getAttributes().get(KEY));
  }

  @Test
  void sanitizesInstrumentNames() {
    assertEquals("fusion.links_stale", OpenTelemetryMetricsAdapter.sanitizeName("fusion.links stale"));
    assertEquals("m1st", OpenTelemetryMetricsAdapter.sanitizeName("1st"));
    assertEquals("netmap.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void disabledSettingsYieldNoOp() {
    assertInstanceOf(NoOpMetricsAdapter.class, OpenTelemetryMetricsAdapter.create(TelemetrySettings.disabled()));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    assertEquals("prod", OpenTelemetryBootstrap.parseResourceAttributes("env=prod, broken, =x")
        .get(AttributeKey.stringKey("env")));
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes("").isEmpty());
  }

  private Optional<MetricData> metric(String name) {
    return reader.collectAllMetrics().stream().filter(m -> m.getName().equals(name)).findFirst();
  }
}
