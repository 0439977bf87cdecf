package io.github.themoah.ybstats.model;

import java.time.OffsetDateTime;

/**
 * One entry of the snapshot catalog.
 *
 * @param number snapshot number, never reused
 * @param timestamp when the snapshot was started
 * @param comment free text, empty when none was given
 */
public record CatalogEntry(
  int number,
  OffsetDateTime timestamp,
  String comment
) {}
