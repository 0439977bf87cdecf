package io.github.themoah.ybstats.diff;

import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.RecordChange;
import java.util.List;
import java.util.Set;

/**
 * Added, removed and changed rows of a structured kind, ordered by host and key.
 */
public record StructuredKindDiff(
  EndpointKind kind,
  List<RecordChange> changes,
  Set<String> unavailableAtBegin,
  Set<String> unavailableAtEnd
) implements KindDiff {

  public StructuredKindDiff {
    changes = List.copyOf(changes);
    unavailableAtBegin = Set.copyOf(unavailableAtBegin);
    unavailableAtEnd = Set.copyOf(unavailableAtEnd);
  }

  @Override
  public boolean isEmpty() {
    return changes.isEmpty();
  }
}
