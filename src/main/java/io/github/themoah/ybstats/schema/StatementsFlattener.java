package io.github.themoah.ybstats.schema;

import static io.github.themoah.ybstats.schema.MetricColumns.DESCRIPTION;
import static io.github.themoah.ybstats.schema.MetricColumns.GAUGE;
import static io.github.themoah.ybstats.schema.MetricColumns.METRIC_ID;
import static io.github.themoah.ybstats.schema.MetricColumns.METRIC_NAME;
import static io.github.themoah.ybstats.schema.MetricColumns.METRIC_TYPE;
import static io.github.themoah.ybstats.schema.MetricColumns.NAMESPACE_NAME;
import static io.github.themoah.ybstats.schema.MetricColumns.TABLE_NAME;
import static io.github.themoah.ybstats.schema.MetricColumns.VALUE;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for the YSQL {@code /statements} JSON. Each statement contributes one counter
 * row for calls, total time and rows, identified by its query id (or text when the
 * server does not report ids).
 */
public class StatementsFlattener implements RecordFlattener {

  private static final List<String> COUNTERS = List.of("calls", "total_time", "rows");

  @Override
  public List<Map<String, String>> flatten(String body) {
    Object document = JsonValues.parse(body);
    if (!(document instanceof JsonObject root) || !(root.getValue("statements") instanceof JsonArray statements)) {
      throw new MalformedPayloadException("Expected an object with a statements array");
    }

    List<Map<String, String>> rows = new ArrayList<>();
    for (Object item : statements) {
      if (!(item instanceof JsonObject statement)) {
        continue;
      }
      String query = statement.getString("query", "");
      String id = statement.containsKey("query_id") ? JsonValues.text(statement.getValue("query_id")) : query;

      for (String counter : COUNTERS) {
        if (!statement.containsKey(counter)) {
          continue;
        }
        Map<String, String> row = new LinkedHashMap<>();
        row.put(METRIC_TYPE, "statement");
        row.put(METRIC_ID, id);
        row.put(NAMESPACE_NAME, statement.getString("dbname", ""));
        row.put(TABLE_NAME, "");
        row.put(DESCRIPTION, query);
        row.put(METRIC_NAME, counter);
        row.put(VALUE, JsonValues.text(statement.getValue(counter)));
        row.put(GAUGE, "false");
        rows.add(row);
      }
    }
    return rows;
  }
}
