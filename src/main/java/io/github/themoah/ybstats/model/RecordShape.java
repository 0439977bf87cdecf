package io.github.themoah.ybstats.model;

/**
 * How records of an endpoint kind are compared over time.
 */
public enum RecordShape {
  /** Numeric counters and gauges, compared as delta and rate. */
  METRIC,
  /** Rows identified by a natural key, compared as added, removed or changed. */
  STRUCTURED
}
