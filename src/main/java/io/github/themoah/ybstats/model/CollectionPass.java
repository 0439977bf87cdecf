package io.github.themoah.ybstats.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * All records of one endpoint kind gathered in a single pass over the work list.
 *
 * @param kind the endpoint kind
 * @param timestamp time the pass started, shared by every record
 * @param records unordered records, at most one per host and natural key
 */
public record CollectionPass(
  EndpointKind kind,
  OffsetDateTime timestamp,
  List<StoredRecord> records
) {
  public CollectionPass {
    records = List.copyOf(records);
  }
}
