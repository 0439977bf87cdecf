package io.github.themoah.ybstats.model;

import java.util.OptionalDouble;

/**
 * Difference of one counter or gauge between two captures.
 */
public record MetricDelta(
  String hostnamePort,
  String metricType,
  String metricId,
  String tableName,
  String description,
  String metricName,
  double beginValue,
  double endValue,
  double delta,
  OptionalDouble rate,  // per second, empty when no time elapsed
  boolean gauge
) {}
