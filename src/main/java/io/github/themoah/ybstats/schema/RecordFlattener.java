package io.github.themoah.ybstats.schema;

import java.util.List;
import java.util.Map;

/**
 * Turns the HTTP body of one endpoint into column/value rows.
 */
@FunctionalInterface
public interface RecordFlattener {

  /**
   * Flattens a body into rows.
   *
   * @param body the raw HTTP body
   * @return rows keyed by column name, possibly empty
   * @throws MalformedPayloadException if the body cannot be interpreted
   */
  List<Map<String, String>> flatten(String body);
}
