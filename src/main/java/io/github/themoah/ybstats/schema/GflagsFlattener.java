package io.github.themoah.ybstats.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for {@code /varz?raw}: one {@code --name=value} line per flag.
 */
public class GflagsFlattener implements RecordFlattener {

  @Override
  public List<Map<String, String>> flatten(String body) {
    List<Map<String, String>> rows = new ArrayList<>();
    if (body != null) {
      for (String line : body.split("\n")) {
        String trimmed = line.trim();
        if (!trimmed.startsWith("--")) {
          continue;
        }
        int separator = trimmed.indexOf('=');
        Map<String, String> row = new LinkedHashMap<>();
        if (separator < 0) {
          row.put("name", trimmed.substring(2));
          row.put("value", "");
        } else {
          row.put("name", trimmed.substring(2, separator));
          row.put("value", trimmed.substring(separator + 1));
        }
        rows.add(row);
      }
    }
    if (rows.isEmpty()) {
      throw new MalformedPayloadException("No --name=value lines found");
    }
    return rows;
  }
}
