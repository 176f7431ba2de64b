package ca.gc.cra.netprov.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("netprov.metric.key");

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
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("deploy.status.committed");
    adapter.increment("deploy.status.committed");
    adapter.increment("deploy.status.committed");
    adapter.forceFlush();

    MetricData counter = metric(reader.collectAllMetrics(), "deploy.status.committed");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("deploy.status.committed", point.getAttributes().get(METRIC_KEY));

    assertEquals("netprov", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramInMilliseconds() {
    adapter.observe("deploy.latencyMillis", 120L);
    adapter.observe("deploy.latencyMillis", 380L);
    adapter.forceFlush();

    MetricData histogram = metric(reader.collectAllMetrics(), "deploy.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(500.0, point.getSum());
    assertEquals("deploy.latencyMillis", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeNameKeepsDotsAndReplacesOthers() {
    assertEquals("credentials.source.from_secret_store",
        OpenTelemetryMetricsAdapter.sanitizeName("credentials.source.FROM_SECRET_STORE"));
    assertEquals("m1.bad_name", OpenTelemetryMetricsAdapter.sanitizeName("1.bad name"));
    assertEquals("netprov.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static MetricData metric(Collection<MetricData> metrics, String name) {
    Optional<MetricData> found = metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    assertTrue(found.isPresent(), "Expected metric " + name + " to be exported");
    return found.orElseThrow();
  }
}
