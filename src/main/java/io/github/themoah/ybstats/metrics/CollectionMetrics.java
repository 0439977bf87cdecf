package io.github.themoah.ybstats.metrics;

import io.github.themoah.ybstats.model.EndpointKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records fetch outcomes and pass durations in a Micrometer registry.
 */
public class CollectionMetrics {

  private static final Logger log = LoggerFactory.getLogger(CollectionMetrics.class);

  static final String FETCH_METRIC = "ybstats.fetch";
  static final String PASS_METRIC = "ybstats.pass";
  static final String RECORDS_METRIC = "ybstats.records";

  private final MeterRegistry registry;

  public CollectionMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  public void recordFetch(EndpointKind kind, FetchOutcome outcome) {
    registry.counter(FETCH_METRIC, Tags.of("kind", kind.fileName(), "outcome", outcome.toTagValue()))
      .increment();
  }

  public void recordPass(EndpointKind kind, Duration duration, int recordCount) {
    Tags tags = Tags.of("kind", kind.fileName());
    registry.timer(PASS_METRIC, tags).record(duration);
    registry.counter(RECORDS_METRIC, tags).increment(recordCount);
  }

  /**
   * Number of fetches of a kind that ended with the given outcome.
   */
  public long fetchCount(EndpointKind kind, FetchOutcome outcome) {
    Counter counter = registry.find(FETCH_METRIC)
      .tags("kind", kind.fileName(), "outcome", outcome.toTagValue())
      .counter();
    return counter == null ? 0 : (long) counter.count();
  }

  /**
   * Number of fetches of a kind that did not succeed.
   */
  public long failureCount(EndpointKind kind) {
    long failures = 0;
    for (FetchOutcome outcome : FetchOutcome.values()) {
      if (outcome != FetchOutcome.SUCCESS) {
        failures += fetchCount(kind, outcome);
      }
    }
    return failures;
  }

  /**
   * Writes one summary line per collected kind to the log.
   */
  public void logSummary() {
    for (EndpointKind kind : EndpointKind.values()) {
      Timer timer = registry.find(PASS_METRIC).tags("kind", kind.fileName()).timer();
      if (timer == null) {
        continue;
      }
      log.debug("{}: {} pass(es) in {} ms, {} fetched, {} failed",
        kind.fileName(),
        timer.count(),
        (long) timer.totalTime(TimeUnit.MILLISECONDS),
        fetchCount(kind, FetchOutcome.SUCCESS),
        failureCount(kind));
    }
  }
}
