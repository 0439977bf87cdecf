package io.github.themoah.ybstats.schema;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data-driven JSON adapter: locates the rows with a JSON pointer and maps each column
 * to a pointer relative to the row.
 */
public class JsonRowsFlattener implements RecordFlattener {

  /**
   * Where the rows live relative to the located element.
   */
  public enum Layout {
    /** The element itself is the only row. */
    SINGLE,
    /** The element is an array, one row per item. */
    ARRAY,
    /** The element is an object of objects, one row per inner entry. */
    NESTED_ENTRIES
  }

  private final Layout layout;
  private final String rowsPointer;
  private final String outerKeyColumn;
  private final String keyColumn;
  private final boolean optional;
  private final Map<String, String> columnPointers;
  private final Map<String, String> constants;

  private JsonRowsFlattener(Builder builder) {
    this.layout = builder.layout;
    this.rowsPointer = builder.rowsPointer;
    this.outerKeyColumn = builder.outerKeyColumn;
    this.keyColumn = builder.keyColumn;
    this.optional = builder.optional;
    this.columnPointers = new LinkedHashMap<>(builder.columnPointers);
    this.constants = new LinkedHashMap<>(builder.constants);
  }

  public static Builder single() {
    return new Builder(Layout.SINGLE, "");
  }

  public static Builder array(String rowsPointer) {
    return new Builder(Layout.ARRAY, rowsPointer);
  }

  public static Builder nestedEntries(String rowsPointer, String outerKeyColumn, String keyColumn) {
    Builder builder = new Builder(Layout.NESTED_ENTRIES, rowsPointer);
    builder.outerKeyColumn = outerKeyColumn;
    builder.keyColumn = keyColumn;
    return builder;
  }

  @Override
  public List<Map<String, String>> flatten(String body) {
    return flattenJson(JsonValues.parse(body));
  }

  /**
   * Flattens an already parsed document.
   */
  public List<Map<String, String>> flattenJson(Object document) {
    Object located = JsonValues.query(document, rowsPointer);
    if (located == null) {
      if (optional) {
        return List.of();
      }
      throw new MalformedPayloadException("No element at '" + rowsPointer + "'");
    }

    List<Map<String, String>> rows = new ArrayList<>();
    switch (layout) {
      case SINGLE -> rows.add(row(located, Map.of()));
      case ARRAY -> {
        for (Object item : requireArray(located)) {
          rows.add(row(item, Map.of()));
        }
      }
      case NESTED_ENTRIES -> {
        for (Map.Entry<String, Object> outer : requireObject(located)) {
          for (Map.Entry<String, Object> inner : requireObject(outer.getValue())) {
            rows.add(row(inner.getValue(), Map.of(outerKeyColumn, outer.getKey(), keyColumn, inner.getKey())));
          }
        }
      }
      default -> throw new IllegalStateException("Unhandled layout " + layout);
    }
    return rows;
  }

  private Map<String, String> row(Object element, Map<String, String> keys) {
    Map<String, String> row = new LinkedHashMap<>(constants);
    row.putAll(keys);
    for (Map.Entry<String, String> column : columnPointers.entrySet()) {
      Object value = element instanceof JsonObject || element instanceof JsonArray
        ? JsonValues.query(element, column.getValue())
        : null;
      row.put(column.getKey(), JsonValues.text(value));
    }
    return row;
  }

  private JsonArray requireArray(Object element) {
    if (element instanceof JsonArray array) {
      return array;
    }
    throw new MalformedPayloadException("Expected an array at '" + rowsPointer + "'");
  }

  private JsonObject requireObject(Object element) {
    if (element instanceof JsonObject object) {
      return object;
    }
    throw new MalformedPayloadException("Expected an object at '" + rowsPointer + "'");
  }

  public static class Builder {

    private final Layout layout;
    private final String rowsPointer;
    private String outerKeyColumn;
    private String keyColumn;
    private boolean optional;
    private final Map<String, String> columnPointers = new LinkedHashMap<>();
    private final Map<String, String> constants = new LinkedHashMap<>();

    private Builder(Layout layout, String rowsPointer) {
      this.layout = layout;
      this.rowsPointer = rowsPointer;
    }

    /**
     * Maps a column to a JSON pointer relative to the row element.
     */
    public Builder column(String column, String pointer) {
      columnPointers.put(column, pointer);
      return this;
    }

    /**
     * Maps a column to the row member of the same name.
     */
    public Builder column(String column) {
      return column(column, "/" + column);
    }

    public Builder constant(String column, String value) {
      constants.put(column, value);
      return this;
    }

    /**
     * Yields no rows instead of failing when the rows pointer does not resolve.
     */
    public Builder optional() {
      this.optional = true;
      return this;
    }

    public JsonRowsFlattener build() {
      return new JsonRowsFlattener(this);
    }
  }
}
