package io.github.themoah.ybstats.schema;

import static io.github.themoah.ybstats.schema.MetricColumns.DESCRIPTION;
import static io.github.themoah.ybstats.schema.MetricColumns.GAUGE;
import static io.github.themoah.ybstats.schema.MetricColumns.METRIC_ID;
import static io.github.themoah.ybstats.schema.MetricColumns.METRIC_NAME;
import static io.github.themoah.ybstats.schema.MetricColumns.METRIC_TYPE;
import static io.github.themoah.ybstats.schema.MetricColumns.NAMESPACE_NAME;
import static io.github.themoah.ybstats.schema.MetricColumns.TABLE_NAME;
import static io.github.themoah.ybstats.schema.MetricColumns.VALUE;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapter for the Prometheus text exposition format served by node_exporter.
 * The label set becomes the metric id; the {@code # TYPE} line decides gauge or counter.
 */
public class PrometheusTextFlattener implements RecordFlattener {

  private static final Pattern TYPE_LINE = Pattern.compile("^#\\s*TYPE\\s+(\\S+)\\s+(\\S+)");
  private static final Pattern SAMPLE_LINE =
    Pattern.compile("^([a-zA-Z_:][a-zA-Z0-9_:]*)(?:\\{(.*)})?\\s+(\\S+)(?:\\s+-?\\d+)?\\s*$");

  @Override
  public List<Map<String, String>> flatten(String body) {
    if (body == null || body.isBlank()) {
      throw new MalformedPayloadException("Empty exposition body");
    }

    Map<String, String> types = new HashMap<>();
    List<Map<String, String>> rows = new ArrayList<>();

    for (String line : body.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (trimmed.startsWith("#")) {
        Matcher type = TYPE_LINE.matcher(trimmed);
        if (type.find()) {
          types.put(type.group(1), type.group(2));
        }
        continue;
      }
      Matcher sample = SAMPLE_LINE.matcher(trimmed);
      if (!sample.matches()) {
        continue;
      }
      String name = sample.group(1);
      String labels = sample.group(2) == null ? "" : sample.group(2);
      String metricType = typeOf(name, types);

      Map<String, String> row = new LinkedHashMap<>();
      row.put(METRIC_TYPE, metricType);
      row.put(METRIC_ID, labels);
      row.put(NAMESPACE_NAME, "");
      row.put(TABLE_NAME, "");
      row.put(DESCRIPTION, "");
      row.put(METRIC_NAME, name);
      row.put(VALUE, sample.group(3));
      row.put(GAUGE, String.valueOf(isGauge(name, metricType)));
      rows.add(row);
    }

    if (rows.isEmpty()) {
      throw new MalformedPayloadException("No samples found in exposition body");
    }
    return rows;
  }

  private static String typeOf(String name, Map<String, String> types) {
    String type = types.get(name);
    if (type != null) {
      return type;
    }
    for (String suffix : List.of("_count", "_sum", "_bucket")) {
      if (name.endsWith(suffix)) {
        String base = types.get(name.substring(0, name.length() - suffix.length()));
        if (base != null) {
          return base;
        }
      }
    }
    return "untyped";
  }

  private static boolean isGauge(String name, String metricType) {
    return switch (metricType) {
      case "counter" -> false;
      case "summary", "histogram" -> !(name.endsWith("_count") || name.endsWith("_sum") || name.endsWith("_bucket"));
      default -> true;
    };
  }
}
