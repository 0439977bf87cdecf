package io.github.themoah.ybstats.schema;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.core.json.pointer.JsonPointer;

/**
 * Helpers for reading upstream JSON bodies.
 */
final class JsonValues {

  private JsonValues() {}

  /**
   * Parses a body that must be a JSON object or array.
   *
   * @throws MalformedPayloadException if the body is not JSON
   */
  static Object parse(String body) {
    String trimmed = body == null ? "" : body.trim();
    try {
      if (trimmed.startsWith("{")) {
        return new JsonObject(trimmed);
      }
      if (trimmed.startsWith("[")) {
        return new JsonArray(trimmed);
      }
    } catch (DecodeException e) {
      throw new MalformedPayloadException("Invalid JSON: " + e.getMessage(), e);
    }
    throw new MalformedPayloadException("Expected a JSON object or array, got "
      + (trimmed.isEmpty() ? "an empty body" : "'" + abbreviate(trimmed) + "'"));
  }

  /**
   * Resolves a JSON pointer; an empty pointer is the element itself.
   *
   * @return the value, or null when the pointer does not resolve
   */
  static Object query(Object json, String pointer) {
    if (pointer == null || pointer.isEmpty()) {
      return json;
    }
    return JsonPointer.from(pointer).queryJson(json);
  }

  /**
   * Renders a JSON value as a column value: containers are encoded, null is blank.
   */
  static String text(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof JsonObject object) {
      return object.encode();
    }
    if (value instanceof JsonArray array) {
      return array.encode();
    }
    return value.toString();
  }

  private static String abbreviate(String text) {
    return text.length() <= 40 ? text : text.substring(0, 40) + "...";
  }
}
