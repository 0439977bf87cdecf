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
 * Adapter for the server {@code /metrics} JSON: an array of entities (server, table,
 * tablet, cluster), each with a list of value metrics and histograms.
 *
 * <p>Histograms ({@code total_count}/{@code total_sum}) and YSQL statement metrics
 * ({@code count}/{@code sum}/{@code rows}) become one counter row per component,
 * named {@code <metric>.count}, {@code <metric>.sum} and {@code <metric>.rows}.
 */
public class MetricsJsonFlattener implements RecordFlattener {

  @Override
  public List<Map<String, String>> flatten(String body) {
    Object document = JsonValues.parse(body);
    if (!(document instanceof JsonArray entities)) {
      throw new MalformedPayloadException("Expected an array of metric entities");
    }

    List<Map<String, String>> rows = new ArrayList<>();
    for (Object item : entities) {
      if (!(item instanceof JsonObject entity)) {
        continue;
      }
      JsonObject attributes = entity.getJsonObject("attributes", new JsonObject());
      JsonArray metrics = entity.getJsonArray("metrics", new JsonArray());

      for (Object metricItem : metrics) {
        if (!(metricItem instanceof JsonObject metric)) {
          continue;
        }
        String name = metric.getString("name", "");
        if (metric.containsKey("value")) {
          rows.add(row(entity, attributes, name, JsonValues.text(metric.getValue("value")),
            GaugeClassifier.isGauge(name)));
        } else if (metric.containsKey("total_count")) {
          rows.add(row(entity, attributes, name + ".count", JsonValues.text(metric.getValue("total_count")), false));
          rows.add(row(entity, attributes, name + ".sum", JsonValues.text(metric.getValue("total_sum")), false));
        } else if (metric.containsKey("count")) {
          rows.add(row(entity, attributes, name + ".count", JsonValues.text(metric.getValue("count")), false));
          rows.add(row(entity, attributes, name + ".sum", JsonValues.text(metric.getValue("sum")), false));
          if (metric.containsKey("rows")) {
            rows.add(row(entity, attributes, name + ".rows", JsonValues.text(metric.getValue("rows")), false));
          }
        }
      }
    }
    return rows;
  }

  private Map<String, String> row(JsonObject entity, JsonObject attributes, String name, String value, boolean gauge) {
    Map<String, String> row = new LinkedHashMap<>();
    row.put(METRIC_TYPE, entity.getString("type", ""));
    row.put(METRIC_ID, entity.getString("id", ""));
    row.put(NAMESPACE_NAME, attributes.getString("namespace_name", ""));
    row.put(TABLE_NAME, attributes.getString("table_name", ""));
    row.put(DESCRIPTION, "");
    row.put(METRIC_NAME, name);
    row.put(VALUE, value);
    row.put(GAUGE, String.valueOf(gauge));
    return row;
  }
}
