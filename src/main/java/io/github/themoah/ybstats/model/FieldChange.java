package io.github.themoah.ybstats.model;

/**
 * A column whose value differs between begin and end.
 */
public record FieldChange(
  String column,
  String beginValue,
  String endValue
) {}
