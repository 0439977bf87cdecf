package io.github.themoah.ybstats.model;

import java.util.List;

/**
 * Difference of one keyed row between two captures.
 *
 * @param type added, removed or changed
 * @param hostnamePort host the row belongs to
 * @param key values of the kind's key columns
 * @param begin row at begin, null when added
 * @param end row at end, null when removed
 * @param changes differing columns, empty unless changed
 */
public record RecordChange(
  ChangeType type,
  String hostnamePort,
  List<String> key,
  StoredRecord begin,
  StoredRecord end,
  List<FieldChange> changes
) {

  /**
   * Returns whichever side of the change is present, preferring the end.
   */
  public StoredRecord current() {
    return end != null ? end : begin;
  }
}
