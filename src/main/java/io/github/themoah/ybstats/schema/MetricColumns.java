package io.github.themoah.ybstats.schema;

import java.util.List;

/**
 * Column layout shared by every kind with the metric record shape.
 */
public final class MetricColumns {

  public static final String METRIC_TYPE = "metric_type";
  public static final String METRIC_ID = "metric_id";
  public static final String NAMESPACE_NAME = "namespace_name";
  public static final String TABLE_NAME = "table_name";
  public static final String DESCRIPTION = "description";
  public static final String METRIC_NAME = "metric_name";
  public static final String VALUE = "value";
  public static final String GAUGE = "gauge";

  public static final List<String> ALL = List.of(
    METRIC_TYPE, METRIC_ID, NAMESPACE_NAME, TABLE_NAME, DESCRIPTION, METRIC_NAME, VALUE, GAUGE
  );

  public static final List<String> KEY = List.of(METRIC_TYPE, METRIC_ID, METRIC_NAME);

  private MetricColumns() {}
}
