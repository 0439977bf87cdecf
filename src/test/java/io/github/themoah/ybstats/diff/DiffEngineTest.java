package io.github.themoah.ybstats.diff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.ybstats.model.ChangeType;
import io.github.themoah.ybstats.model.CollectionPass;
import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.MetricDelta;
import io.github.themoah.ybstats.model.RecordChange;
import io.github.themoah.ybstats.model.StoredRecord;
import io.github.themoah.ybstats.schema.KindSchemas;
import io.github.themoah.ybstats.schema.MetricColumns;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DiffEngine.
 */
public class DiffEngineTest {

  private static final OffsetDateTime T0 = OffsetDateTime.parse("2024-03-01T10:00:00Z");
  private static final OffsetDateTime T1 = T0.plusSeconds(60);

  private DiffEngine engine;

  @BeforeEach
  void setUp() {
    engine = new DiffEngine();
  }

  private static StoredRecord metric(String host, OffsetDateTime at, String type, String id, String name,
      double value, boolean gauge) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put(MetricColumns.METRIC_TYPE, type);
    fields.put(MetricColumns.METRIC_ID, id);
    fields.put(MetricColumns.NAMESPACE_NAME, "");
    fields.put(MetricColumns.TABLE_NAME, "table".equals(type) || "tablet".equals(type) ? "orders" : "");
    fields.put(MetricColumns.DESCRIPTION, "");
    fields.put(MetricColumns.METRIC_NAME, name);
    fields.put(MetricColumns.VALUE, Double.toString(value));
    fields.put(MetricColumns.GAUGE, Boolean.toString(gauge));
    return new StoredRecord(host, at, false, fields);
  }

  private static StoredRecord withValue(StoredRecord record, String value) {
    Map<String, String> fields = new LinkedHashMap<>(record.fields());
    fields.put(MetricColumns.VALUE, value);
    return new StoredRecord(record.hostnamePort(), record.timestamp(), false, fields);
  }

  private static StoredRecord counter(String host, OffsetDateTime at, String name, double value) {
    return metric(host, at, "server", "yb.tabletserver", name, value, false);
  }

  private static CollectionPass metrics(OffsetDateTime at, StoredRecord... records) {
    return new CollectionPass(EndpointKind.METRICS, at, List.of(records));
  }

  private static StoredRecord flag(String host, String name, String value) {
    return new StoredRecord(host, T0, false, Map.of("name", name, "value", value));
  }

  private static CollectionPass gflags(StoredRecord... records) {
    return new CollectionPass(EndpointKind.GFLAGS, T0, List.of(records));
  }

  private MetricKindDiff diffMetrics(CollectionPass begin, CollectionPass end, DiffOptions options) {
    return (MetricKindDiff) engine.diff(EndpointKind.METRICS, begin, end, options);
  }

  @Test
  void counter_rateOverElapsedTime() {
    MetricKindDiff diff = diffMetrics(
      metrics(T0, counter("h1:9000", T0, "rows_inserted", 0)),
      metrics(T1, counter("h1:9000", T1, "rows_inserted", 120)),
      DiffOptions.defaults());

    MetricDelta delta = diff.deltas().get(0);
    assertEquals(120, delta.delta());
    assertEquals(2.0, delta.rate().getAsDouble(), 1e-9);
    assertFalse(delta.gauge());
  }

  @Test
  void counter_reset_usesEndValue() {
    MetricKindDiff diff = diffMetrics(
      metrics(T0, counter("h1:9000", T0, "rows_inserted", 100)),
      metrics(T1, counter("h1:9000", T1, "rows_inserted", 10)),
      DiffOptions.defaults());

    assertEquals(10, diff.deltas().get(0).delta());
    assertEquals(100, diff.deltas().get(0).beginValue());
  }

  @Test
  void gauge_keepsNegativeDelta() {
    MetricKindDiff diff = diffMetrics(
      metrics(T0, metric("h1:9000", T0, "server", "yb.tabletserver", "threads_running", 50, true)),
      metrics(T1, metric("h1:9000", T1, "server", "yb.tabletserver", "threads_running", 20, true)),
      DiffOptions.defaults());

    MetricDelta delta = diff.deltas().get(0);
    assertEquals(-30, delta.delta());
    assertEquals(20, delta.endValue());
    assertTrue(delta.gauge());
  }

  @Test
  void newMetric_startsFromZero() {
    MetricKindDiff diff = diffMetrics(
      metrics(T0),
      metrics(T1, counter("h1:9000", T1, "rpc_calls", 30)),
      DiffOptions.defaults());

    MetricDelta delta = diff.deltas().get(0);
    assertEquals(0, delta.beginValue());
    assertEquals(30, delta.delta());
    assertEquals(0.5, delta.rate().getAsDouble(), 1e-9);
  }

  @Test
  void metricOnlyAtBegin_isSkipped() {
    MetricKindDiff diff = diffMetrics(
      metrics(T0, counter("h1:9000", T0, "rpc_calls", 30)),
      metrics(T1),
      DiffOptions.defaults());

    assertTrue(diff.deltas().isEmpty());
  }

  @Test
  void unchanged_droppedUnlessRequested() {
    CollectionPass begin = metrics(T0, counter("h1:9000", T0, "a", 5), counter("h1:9000", T0, "b", 5));
    CollectionPass end = metrics(T1, counter("h1:9000", T1, "a", 5), counter("h1:9000", T1, "b", 6));

    assertEquals(1, diffMetrics(begin, end, DiffOptions.defaults()).deltas().size());
    assertEquals(2, diffMetrics(begin, end, new DiffOptions(false, true)).deltas().size());
  }

  @Test
  void selfDiff_hasZeroDeltasAndNoRate() {
    CollectionPass pass = metrics(T0, counter("h1:9000", T0, "a", 5), counter("h2:9000", T0, "a", 7));

    MetricKindDiff diff = diffMetrics(pass, pass, new DiffOptions(false, true));

    assertEquals(2, diff.deltas().size());
    for (MetricDelta delta : diff.deltas()) {
      assertEquals(0, delta.delta());
      assertTrue(delta.rate().isEmpty());
    }
    assertTrue(diffMetrics(pass, pass, DiffOptions.defaults()).isEmpty());
  }

  @Test
  void swappedGauge_negatesDelta() {
    CollectionPass first = metrics(T0, metric("h1:9000", T0, "server", "s", "memory", 10, true));
    CollectionPass second = metrics(T1, metric("h1:9000", T1, "server", "s", "memory", 4, true));

    assertEquals(-6, diffMetrics(first, second, DiffOptions.defaults()).deltas().get(0).delta());
    MetricDelta swapped = diffMetrics(second, first, DiffOptions.defaults()).deltas().get(0);
    assertEquals(6, swapped.delta());
    assertTrue(swapped.rate().isEmpty());
  }

  @Test
  void syntheticRecords_reportHostUnavailable() {
    List<String> columns = KindSchemas.forKind(EndpointKind.METRICS).columns();
    CollectionPass begin = metrics(T0, counter("h1:9000", T0, "a", 1), counter("h2:9000", T0, "a", 1));
    CollectionPass end = metrics(T1, counter("h1:9000", T1, "a", 3), StoredRecord.synthetic("h2:9000", T1, columns));

    MetricKindDiff diff = diffMetrics(begin, end, DiffOptions.defaults());

    assertEquals(1, diff.deltas().size());
    assertEquals("h1:9000", diff.deltas().get(0).hostnamePort());
    assertTrue(diff.unavailableAtBegin().isEmpty());
    assertEquals(Set.of("h2:9000"), diff.unavailableAtEnd());
  }

  @Test
  void tabletMetrics_summedWithoutDetails() {
    CollectionPass begin = metrics(T0,
      metric("h1:9000", T0, "tablet", "t1", "rows_inserted", 10, false),
      metric("h1:9000", T0, "tablet", "t2", "rows_inserted", 20, false));
    CollectionPass end = metrics(T1,
      metric("h1:9000", T1, "tablet", "t1", "rows_inserted", 15, false),
      metric("h1:9000", T1, "tablet", "t2", "rows_inserted", 40, false));

    MetricKindDiff summed = diffMetrics(begin, end, DiffOptions.defaults());
    MetricKindDiff detailed = diffMetrics(begin, end, new DiffOptions(true, false));

    assertEquals(1, summed.deltas().size());
    assertEquals("-", summed.deltas().get(0).metricId());
    assertEquals(25, summed.deltas().get(0).delta());
    assertEquals(2, detailed.deltas().size());
    assertEquals("t1", detailed.deltas().get(0).metricId());
    assertEquals("orders", detailed.deltas().get(0).tableName());
    assertEquals(20, detailed.deltas().get(1).delta());
  }

  @Test
  void deltas_sortedByHostTypeIdName() {
    MetricKindDiff diff = diffMetrics(
      metrics(T0),
      metrics(T1, counter("h2:9000", T1, "a", 1), counter("h1:9000", T1, "b", 1), counter("h1:9000", T1, "a", 1)),
      DiffOptions.defaults());

    assertEquals(List.of("h1:9000/a", "h1:9000/b", "h2:9000/a"), diff.deltas().stream()
      .map(delta -> delta.hostnamePort() + "/" + delta.metricName())
      .collect(Collectors.toList()));
  }

  @Test
  void diff_kindMismatch_fails() {
    assertThrows(IllegalArgumentException.class,
      () -> engine.diff(EndpointKind.METRICS, gflags(), gflags(), DiffOptions.defaults()));
  }

  @Test
  void structured_addedRemovedChanged() {
    CollectionPass begin = gflags(
      flag("h1:7000", "log_dir", "/var/log"),
      flag("h1:7000", "max_clock_skew_usec", "500000"),
      flag("h1:7000", "old_flag", "1"));
    CollectionPass end = gflags(
      flag("h1:7000", "log_dir", "/var/log"),
      flag("h1:7000", "max_clock_skew_usec", "250000"),
      flag("h1:7000", "new_flag", "x"));

    StructuredKindDiff diff = (StructuredKindDiff) engine.diff(EndpointKind.GFLAGS, begin, end, DiffOptions.defaults());

    assertEquals(3, diff.changes().size());
    RecordChange changed = diff.changes().get(0);
    assertEquals(ChangeType.CHANGED, changed.type());
    assertEquals(List.of("max_clock_skew_usec"), changed.key());
    assertEquals(1, changed.changes().size());
    assertEquals("value", changed.changes().get(0).column());
    assertEquals("500000", changed.changes().get(0).beginValue());
    assertEquals("250000", changed.changes().get(0).endValue());
    assertEquals(ChangeType.ADDED, diff.changes().get(1).type());
    assertEquals(List.of("new_flag"), diff.changes().get(1).key());
    assertEquals(ChangeType.REMOVED, diff.changes().get(2).type());
    assertEquals("1", diff.changes().get(2).current().field("value"));
  }

  @Test
  void structured_sameKeyOnOtherHost_isDistinct() {
    StructuredKindDiff diff = (StructuredKindDiff) engine.diff(EndpointKind.GFLAGS,
      gflags(flag("h1:7000", "log_dir", "/a")),
      gflags(flag("h1:7000", "log_dir", "/a"), flag("h2:7000", "log_dir", "/a")),
      DiffOptions.defaults());

    assertEquals(1, diff.changes().size());
    assertEquals(ChangeType.ADDED, diff.changes().get(0).type());
    assertEquals("h2:7000", diff.changes().get(0).hostnamePort());
  }

  @Test
  void structured_selfDiffIsEmpty() {
    CollectionPass pass = gflags(flag("h1:7000", "a", "1"), flag("h1:7000", "b", "2"));

    assertTrue(engine.diff(EndpointKind.GFLAGS, pass, pass, DiffOptions.defaults()).isEmpty());
  }

  @Test
  void structured_swapExchangesAddedAndRemoved() {
    CollectionPass first = gflags(flag("h1:7000", "a", "1"));
    CollectionPass second = gflags(flag("h1:7000", "b", "1"));

    StructuredKindDiff forward = (StructuredKindDiff) engine.diff(EndpointKind.GFLAGS, first, second,
      DiffOptions.defaults());
    StructuredKindDiff backward = (StructuredKindDiff) engine.diff(EndpointKind.GFLAGS, second, first,
      DiffOptions.defaults());

    assertEquals(ChangeType.REMOVED, forward.changes().get(0).type());
    assertEquals(List.of("a"), forward.changes().get(0).key());
    assertEquals(ChangeType.ADDED, backward.changes().get(0).type());
    assertEquals(List.of("a"), backward.changes().get(0).key());
  }

  @Test
  void structured_syntheticHostIsUnavailable() {
    CollectionPass begin = gflags(StoredRecord.synthetic("h1:7000", T0, List.of("name", "value")));
    CollectionPass end = gflags(flag("h1:7000", "a", "1"));

    StructuredKindDiff diff = (StructuredKindDiff) engine.diff(EndpointKind.GFLAGS, begin, end, DiffOptions.defaults());

    assertEquals(Set.of("h1:7000"), diff.unavailableAtBegin());
    assertTrue(diff.unavailableAtEnd().isEmpty());
    assertTrue(diff.changes().isEmpty());
  }

  @Test
  void structured_hostUnavailableAtEnd_reportsNoRemovals() {
    CollectionPass begin = gflags(flag("h1:7000", "a", "1"), flag("h2:7000", "a", "1"));
    CollectionPass end = gflags(StoredRecord.synthetic("h1:7000", T0, List.of("name", "value")),
      flag("h2:7000", "a", "2"));

    StructuredKindDiff diff = (StructuredKindDiff) engine.diff(EndpointKind.GFLAGS, begin, end, DiffOptions.defaults());

    assertEquals(Set.of("h1:7000"), diff.unavailableAtEnd());
    assertEquals(1, diff.changes().size());
    assertEquals("h2:7000", diff.changes().get(0).hostnamePort());
    assertEquals(ChangeType.CHANGED, diff.changes().get(0).type());
  }

  @Test
  void hostUnavailableAtBegin_producesNoDeltas() {
    List<String> columns = KindSchemas.forKind(EndpointKind.METRICS).columns();
    CollectionPass begin = metrics(T0, StoredRecord.synthetic("h1:9000", T0, columns), counter("h2:9000", T0, "a", 1));
    CollectionPass end = metrics(T1, counter("h1:9000", T1, "rows_inserted", 9_000_000), counter("h2:9000", T1, "a", 4));

    MetricKindDiff diff = diffMetrics(begin, end, DiffOptions.defaults());

    assertEquals(Set.of("h1:9000"), diff.unavailableAtBegin());
    assertEquals(1, diff.deltas().size());
    assertEquals("h2:9000", diff.deltas().get(0).hostnamePort());
    assertEquals(3, diff.deltas().get(0).delta());
  }

  @Test
  void nonFiniteValues_areSkipped() {
    StoredRecord infinite = withValue(metric("h1:9000", T1, "server", "yb.tabletserver", "latency_max", 0, true),
      "Infinity");
    StoredRecord notANumber = withValue(metric("h1:9000", T1, "server", "yb.tabletserver", "latency_mean", 0, true),
      "NaN");

    MetricKindDiff diff = diffMetrics(
      metrics(T0),
      metrics(T1, infinite, notANumber, counter("h1:9000", T1, "rows_inserted", 5)),
      new DiffOptions(false, true));

    assertEquals(1, diff.deltas().size());
    assertEquals("rows_inserted", diff.deltas().get(0).metricName());
    assertEquals(5, diff.deltas().get(0).delta());
  }
}
