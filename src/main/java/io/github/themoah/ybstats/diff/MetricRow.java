package io.github.themoah.ybstats.diff;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Numeric view of one metric-shaped stored record, or of a sum of them.
 *
 * @param hostnamePort source host
 * @param metricType entity type, e.g. server, table or tablet
 * @param metricId entity id, {@code -} once aggregated
 * @param tableName table of the entity, empty once aggregated
 * @param description free text from the endpoint
 * @param metricName name of the counter or gauge
 * @param value numeric value
 * @param gauge true when the value may legitimately go down
 * @param timestamp capture time
 */
public record MetricRow(
  String hostnamePort,
  String metricType,
  String metricId,
  String tableName,
  String description,
  String metricName,
  double value,
  boolean gauge,
  OffsetDateTime timestamp
) {

  /**
   * Identity of the row within a pass.
   */
  public List<String> key() {
    return List.of(hostnamePort, metricType, metricId, metricName);
  }
}
