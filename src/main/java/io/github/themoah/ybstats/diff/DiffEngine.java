package io.github.themoah.ybstats.diff;

import io.github.themoah.ybstats.model.ChangeType;
import io.github.themoah.ybstats.model.CollectionPass;
import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.FieldChange;
import io.github.themoah.ybstats.model.MetricDelta;
import io.github.themoah.ybstats.model.RecordChange;
import io.github.themoah.ybstats.model.StoredRecord;
import io.github.themoah.ybstats.schema.KindSchemas;
import io.github.themoah.ybstats.schema.RecordSchema;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares two captures of one endpoint kind.
 *
 * <p>Metric kinds produce a delta per counter or gauge, with a per second rate when time
 * passed between the captures. A counter that went down was reset, so its delta is the end
 * value. Structured kinds produce added, removed and changed rows matched on host and the
 * kind's key columns. Synthetic records never take part in a comparison; their hosts are
 * reported as unavailable for the side they came from, and nothing else of such a host is
 * compared on either side.
 */
public class DiffEngine {

  private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

  private static final Comparator<MetricDelta> DELTA_ORDER = Comparator
    .comparing(MetricDelta::hostnamePort)
    .thenComparing(MetricDelta::metricType)
    .thenComparing(MetricDelta::metricId)
    .thenComparing(MetricDelta::metricName);

  private static final Comparator<RecordChange> CHANGE_ORDER = Comparator
    .comparing(RecordChange::hostnamePort)
    .thenComparing(change -> String.join("\u0000", change.key()));

  /**
   * Diffs two passes of the same kind.
   *
   * @param kind the endpoint kind of both passes
   * @param begin the earlier capture
   * @param end the later capture
   * @param options aggregation and filtering switches
   * @return a {@link MetricKindDiff} or a {@link StructuredKindDiff}, depending on the kind's shape
   */
  public KindDiff diff(EndpointKind kind, CollectionPass begin, CollectionPass end, DiffOptions options) {
    Objects.requireNonNull(begin, "begin cannot be null");
    Objects.requireNonNull(end, "end cannot be null");
    if (begin.kind() != kind || end.kind() != kind) {
      throw new IllegalArgumentException("Cannot diff " + begin.kind() + " against " + end.kind() + " as " + kind);
    }

    return switch (kind.shape()) {
      case METRIC -> diffMetrics(kind, begin, end, options);
      case STRUCTURED -> diffStructured(kind, begin, end);
    };
  }

  MetricKindDiff diffMetrics(EndpointKind kind, CollectionPass begin, CollectionPass end, DiffOptions options) {
    Set<String> unavailableBegin = unavailableHosts(begin);
    Set<String> unavailableEnd = unavailableHosts(end);
    Map<List<String>, MetricRow> beginRows = index(MetricRows.of(begin.records(), options.details()));
    List<MetricDelta> deltas = new ArrayList<>();

    for (MetricRow endRow : MetricRows.of(end.records(), options.details())) {
      if (unavailableBegin.contains(endRow.hostnamePort()) || unavailableEnd.contains(endRow.hostnamePort())) {
        continue;
      }
      MetricRow beginRow = beginRows.get(endRow.key());
      double beginValue = beginRow == null ? 0 : beginRow.value();
      OffsetDateTime beginTime = beginRow == null ? begin.timestamp() : beginRow.timestamp();
      boolean gauge = endRow.gauge() || (beginRow != null && beginRow.gauge());

      double delta = endRow.value() - beginValue;
      if (delta < 0 && !gauge) {
        log.trace("Counter reset for {} on {}", endRow.metricName(), endRow.hostnamePort());
        delta = endRow.value();
      }
      if (delta == 0 && !options.includeUnchanged()) {
        continue;
      }

      deltas.add(new MetricDelta(
        endRow.hostnamePort(),
        endRow.metricType(),
        endRow.metricId(),
        endRow.tableName(),
        endRow.description(),
        endRow.metricName(),
        beginValue,
        endRow.value(),
        delta,
        rate(delta, beginTime, endRow.timestamp()),
        gauge));
    }

    deltas.sort(DELTA_ORDER);
    log.debug("{}: {} metric deltas", kind.fileName(), deltas.size());
    return new MetricKindDiff(kind, deltas, unavailableBegin, unavailableEnd);
  }

  StructuredKindDiff diffStructured(EndpointKind kind, CollectionPass begin, CollectionPass end) {
    RecordSchema schema = KindSchemas.forKind(kind);
    Set<String> unavailable = new TreeSet<>(unavailableHosts(begin));
    unavailable.addAll(unavailableHosts(end));
    Map<List<String>, StoredRecord> beginRecords = indexRecords(schema, begin, unavailable);
    Map<List<String>, StoredRecord> endRecords = indexRecords(schema, end, unavailable);
    List<RecordChange> changes = new ArrayList<>();

    for (Map.Entry<List<String>, StoredRecord> entry : endRecords.entrySet()) {
      StoredRecord endRecord = entry.getValue();
      StoredRecord beginRecord = beginRecords.get(entry.getKey());
      List<String> key = schema.keyOf(endRecord.fields());

      if (beginRecord == null) {
        changes.add(new RecordChange(ChangeType.ADDED, endRecord.hostnamePort(), key, null, endRecord, List.of()));
        continue;
      }
      List<FieldChange> fieldChanges = compareFields(schema, beginRecord, endRecord);
      if (!fieldChanges.isEmpty()) {
        changes.add(new RecordChange(ChangeType.CHANGED, endRecord.hostnamePort(), key,
          beginRecord, endRecord, fieldChanges));
      }
    }

    for (Map.Entry<List<String>, StoredRecord> entry : beginRecords.entrySet()) {
      if (!endRecords.containsKey(entry.getKey())) {
        StoredRecord beginRecord = entry.getValue();
        changes.add(new RecordChange(ChangeType.REMOVED, beginRecord.hostnamePort(),
          schema.keyOf(beginRecord.fields()), beginRecord, null, List.of()));
      }
    }

    changes.sort(CHANGE_ORDER);
    log.debug("{}: {} changed records", kind.fileName(), changes.size());
    return new StructuredKindDiff(kind, changes, unavailableHosts(begin), unavailableHosts(end));
  }

  static OptionalDouble rate(double delta, OffsetDateTime begin, OffsetDateTime end) {
    long elapsedMillis = Duration.between(begin, end).toMillis();
    if (elapsedMillis <= 0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(delta / (elapsedMillis / 1000.0));
  }

  private static Map<List<String>, MetricRow> index(List<MetricRow> rows) {
    Map<List<String>, MetricRow> indexed = new LinkedHashMap<>();
    for (MetricRow row : rows) {
      indexed.put(row.key(), row);
    }
    return indexed;
  }

  private static Map<List<String>, StoredRecord> indexRecords(RecordSchema schema, CollectionPass pass,
                                                              Set<String> skippedHosts) {
    Map<List<String>, StoredRecord> indexed = new LinkedHashMap<>();
    for (StoredRecord record : pass.records()) {
      if (record.synthetic() || skippedHosts.contains(record.hostnamePort())) {
        continue;
      }
      List<String> identity = new ArrayList<>();
      identity.add(record.hostnamePort());
      identity.addAll(schema.keyOf(record.fields()));
      indexed.put(identity, record);
    }
    return indexed;
  }

  private static List<FieldChange> compareFields(RecordSchema schema, StoredRecord begin, StoredRecord end) {
    List<FieldChange> changes = new ArrayList<>();
    for (String column : schema.columns()) {
      String beginValue = begin.field(column);
      String endValue = end.field(column);
      if (!beginValue.equals(endValue)) {
        changes.add(new FieldChange(column, beginValue, endValue));
      }
    }
    return changes;
  }

  /**
   * Hosts that delivered only synthetic records in a pass.
   */
  static Set<String> unavailableHosts(CollectionPass pass) {
    Set<String> synthetic = new TreeSet<>();
    Set<String> delivered = new LinkedHashSet<>();
    for (StoredRecord record : pass.records()) {
      if (record.synthetic()) {
        synthetic.add(record.hostnamePort());
      } else {
        delivered.add(record.hostnamePort());
      }
    }
    synthetic.removeAll(delivered);
    return synthetic;
  }
}
