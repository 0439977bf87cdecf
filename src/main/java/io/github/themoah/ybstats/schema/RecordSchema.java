package io.github.themoah.ybstats.schema;

import io.github.themoah.ybstats.model.StoredRecord;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Row layout of one endpoint kind together with the adapter that produces its rows.
 *
 * @param columns kind specific columns in file order, without the envelope columns
 * @param keyColumns columns that identify a row within one host, empty for one row per host
 * @param nameColumn column the statistic name filter applies to, or null
 * @param tableColumn column the table name filter applies to, or null
 * @param flattener turns an HTTP body into rows
 */
public record RecordSchema(
  List<String> columns,
  List<String> keyColumns,
  String nameColumn,
  String tableColumn,
  RecordFlattener flattener
) {

  public RecordSchema {
    columns = List.copyOf(columns);
    keyColumns = List.copyOf(keyColumns);
    Objects.requireNonNull(flattener, "flattener cannot be null");
    if (!columns.containsAll(keyColumns)) {
      throw new IllegalArgumentException("Key columns " + keyColumns + " not in " + columns);
    }
  }

  /**
   * Flattens a body and wraps the rows as stored records of one host.
   * Columns the adapter did not fill are blank. A repeated natural key gets
   * a {@code #n} suffix on its last key column so keys stay unique per host.
   *
   * @throws MalformedPayloadException if the body cannot be interpreted
   */
  public List<StoredRecord> toRecords(String hostnamePort, OffsetDateTime timestamp, String body) {
    List<Map<String, String>> rows = flattener.flatten(body);
    List<StoredRecord> records = new ArrayList<>(rows.size());
    Map<List<String>, Integer> seen = new HashMap<>();

    for (Map<String, String> row : rows) {
      Map<String, String> ordered = new LinkedHashMap<>();
      for (String column : columns) {
        String value = row.get(column);
        ordered.put(column, value == null ? "" : value);
      }

      int occurrence = seen.merge(keyOf(ordered), 1, Integer::sum);
      if (occurrence > 1) {
        String last = keyColumns.isEmpty() ? columns.get(0) : keyColumns.get(keyColumns.size() - 1);
        ordered.put(last, ordered.get(last) + "#" + occurrence);
      }
      records.add(new StoredRecord(hostnamePort, timestamp, false, ordered));
    }
    return records;
  }

  /**
   * Natural key of a row within its host.
   */
  public List<String> keyOf(Map<String, String> fields) {
    List<String> key = new ArrayList<>(keyColumns.size());
    for (String column : keyColumns) {
      String value = fields.get(column);
      key.add(value == null ? "" : value);
    }
    return key;
  }
}
