package ca.gc.cra.dem.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("dem.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void countersCarryTheKeyAndServiceResource() {
    adapter.increment("grid.chunks.failed");
    adapter.increment("grid.chunks.failed");
    adapter.forceFlush();

    MetricData counter = metric("grid.chunks.failed");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("grid.chunks.failed", point.getAttributes().get(METRIC_KEY));
    assertEquals("dem-grid", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void nanosecondObservationsUseTheNanosecondUnit() {
    adapter.observe("uncertainty.phase.trials.nanos", 1_500L);
    adapter.observe("uncertainty.phase.trials.nanos", 2_500L);
    adapter.observe("grid.points.binned", 42L);
    adapter.forceFlush();

    MetricData phase = metric("uncertainty.phase.trials.nanos");
    assertEquals("ns", phase.getUnit());
    HistogramPointData point = phase.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000d, point.getSum(), 1e-9);
    assertEquals("1", metric("grid.points.binned").getUnit());
  }

  @Test
  void instrumentNamesAreSanitized() {
    assertEquals("catalog.records.malformed", OpenTelemetryMetricsAdapter.instrumentName("catalog.records.malformed"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.instrumentName("9Lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.instrumentName(" a b "));
    assertEquals("dem.metric", OpenTelemetryMetricsAdapter.instrumentName("  "));
  }

  @Test
  void resourceAttributesParseLeniently() {
    Attributes parsed = OpenTelemetryBootstrap.parseResourceAttributes("env=test, =skip, region = east ,broken");

    assertEquals(2, parsed.size());
    assertEquals("test", parsed.get(AttributeKey.stringKey("env")));
    assertEquals("east", parsed.get(AttributeKey.stringKey("region")));
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(null).isEmpty());
  }

  @Test
  void noopBootstrapIgnoresRecordings() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop());

    noop.increment("grid.chunks.failed");
    noop.observe("grid.points.binned", 1);
    noop.close();

    assertTrue(noop.isNoop());
  }

  private MetricData metric(String name) {
    return reader.collectAllMetrics().stream()
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " was not exported"));
  }
}
