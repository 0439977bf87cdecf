package io.github.themoah.ybstats.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A flattened row captured from one host, the unit of persistence.
 *
 * @param hostnamePort the host:port the row was fetched from
 * @param timestamp capture time shared by the whole collection pass
 * @param synthetic true when the host returned no usable data and the row is a placeholder
 * @param fields kind specific columns in schema order
 */
public record StoredRecord(
  String hostnamePort,
  OffsetDateTime timestamp,
  boolean synthetic,
  Map<String, String> fields
) {

  public StoredRecord {
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * Creates the placeholder row for a host that could not deliver data.
   */
  public static StoredRecord synthetic(String hostnamePort, OffsetDateTime timestamp, List<String> columns) {
    Map<String, String> blank = new LinkedHashMap<>();
    for (String column : columns) {
      blank.put(column, "");
    }
    return new StoredRecord(hostnamePort, timestamp, true, blank);
  }

  /**
   * Returns the value of a column, or an empty string when absent.
   */
  public String field(String column) {
    String value = fields.get(column);
    return value == null ? "" : value;
  }
}
