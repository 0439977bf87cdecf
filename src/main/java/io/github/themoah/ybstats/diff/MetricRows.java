package io.github.themoah.ybstats.diff;

import io.github.themoah.ybstats.model.StoredRecord;
import io.github.themoah.ybstats.schema.MetricColumns;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns metric-shaped stored records into numeric rows, optionally summing per-entity
 * metrics (tables and tablets) into one row per host, type and name.
 */
public final class MetricRows {

  private static final Logger log = LoggerFactory.getLogger(MetricRows.class);

  static final Set<String> AGGREGATABLE_TYPES = Set.of("table", "tablet");
  static final String AGGREGATED_ID = "-";

  private MetricRows() {}

  /**
   * Converts records to rows keyed by host, type, id and name. Synthetic records and
   * records without a finite numeric value are skipped.
   *
   * @param records metric-shaped records of one pass
   * @param details keep table and tablet rows per entity when true
   * @return rows in first-seen order
   */
  public static List<MetricRow> of(List<StoredRecord> records, boolean details) {
    Map<List<String>, MetricRow> rows = new LinkedHashMap<>();

    for (StoredRecord record : records) {
      if (record.synthetic()) {
        continue;
      }
      double value;
      try {
        value = Double.parseDouble(record.field(MetricColumns.VALUE));
      } catch (NumberFormatException e) {
        log.trace("Skipping non numeric {} on {}", record.field(MetricColumns.METRIC_NAME), record.hostnamePort());
        continue;
      }
      if (!Double.isFinite(value)) {
        log.trace("Skipping non finite {} on {}", record.field(MetricColumns.METRIC_NAME), record.hostnamePort());
        continue;
      }

      String type = record.field(MetricColumns.METRIC_TYPE);
      boolean aggregate = !details && AGGREGATABLE_TYPES.contains(type);
      MetricRow row = new MetricRow(
        record.hostnamePort(),
        type,
        aggregate ? AGGREGATED_ID : record.field(MetricColumns.METRIC_ID),
        aggregate ? "" : record.field(MetricColumns.TABLE_NAME),
        record.field(MetricColumns.DESCRIPTION),
        record.field(MetricColumns.METRIC_NAME),
        value,
        Boolean.parseBoolean(record.field(MetricColumns.GAUGE)),
        record.timestamp());

      rows.merge(row.key(), row, MetricRows::sum);
    }
    return new ArrayList<>(rows.values());
  }

  private static MetricRow sum(MetricRow left, MetricRow right) {
    return new MetricRow(
      left.hostnamePort(),
      left.metricType(),
      left.metricId(),
      left.tableName(),
      left.description(),
      left.metricName(),
      left.value() + right.value(),
      left.gauge() || right.gauge(),
      left.timestamp());
  }
}
