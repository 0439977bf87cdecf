package io.github.themoah.ybstats.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.themoah.ybstats.model.EndpointKind;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CollectionMetrics - outcome counters and pass totals.
 */
public class CollectionMetricsTest {

  private MeterRegistry registry;
  private CollectionMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = MicrometerConfig.createRegistry();
    metrics = new CollectionMetrics(registry);
  }

  @Test
  void fetchCount_perKindAndOutcome() {
    metrics.recordFetch(EndpointKind.METRICS, FetchOutcome.SUCCESS);
    metrics.recordFetch(EndpointKind.METRICS, FetchOutcome.SUCCESS);
    metrics.recordFetch(EndpointKind.METRICS, FetchOutcome.TIMEOUT);
    metrics.recordFetch(EndpointKind.GFLAGS, FetchOutcome.MALFORMED);

    assertEquals(2, metrics.fetchCount(EndpointKind.METRICS, FetchOutcome.SUCCESS));
    assertEquals(1, metrics.failureCount(EndpointKind.METRICS));
    assertEquals(1, metrics.failureCount(EndpointKind.GFLAGS));
    assertEquals(0, metrics.fetchCount(EndpointKind.VERSIONS, FetchOutcome.SUCCESS));
  }

  @Test
  void recordPass_countsRecords() {
    metrics.recordPass(EndpointKind.VERSIONS, Duration.ofMillis(40), 3);
    metrics.recordPass(EndpointKind.VERSIONS, Duration.ofMillis(10), 2);

    assertEquals(2, registry.find(CollectionMetrics.PASS_METRIC).tags("kind", "versions").timer().count());
    assertEquals(5.0, registry.find(CollectionMetrics.RECORDS_METRIC).tags("kind", "versions").counter().count());
  }

  @Test
  void tagValue_isLowercase() {
    assertEquals("http_error", FetchOutcome.HTTP_ERROR.toTagValue());
  }

  @Test
  void logSummary_withoutPasses_doesNothing() {
    metrics.logSummary();

    assertEquals(0, registry.getMeters().size());
  }
}
