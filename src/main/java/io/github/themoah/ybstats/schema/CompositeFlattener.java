package io.github.themoah.ybstats.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses a JSON body once and concatenates the rows of several row sources,
 * for pages that carry more than one list (keyspaces, tables and tablets).
 */
public class CompositeFlattener implements RecordFlattener {

  private final List<JsonRowsFlattener> parts;

  public CompositeFlattener(List<JsonRowsFlattener> parts) {
    this.parts = List.copyOf(parts);
  }

  @Override
  public List<Map<String, String>> flatten(String body) {
    Object document = JsonValues.parse(body);
    List<Map<String, String>> rows = new ArrayList<>();
    for (JsonRowsFlattener part : parts) {
      rows.addAll(part.flattenJson(document));
    }
    return rows;
  }
}
