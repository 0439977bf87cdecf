package io.github.themoah.ybstats.diff;

import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.MetricDelta;
import java.util.List;
import java.util.Set;

/**
 * Deltas and rates of a metric kind, ordered by host, type, id and name.
 */
public record MetricKindDiff(
  EndpointKind kind,
  List<MetricDelta> deltas,
  Set<String> unavailableAtBegin,
  Set<String> unavailableAtEnd
) implements KindDiff {

  public MetricKindDiff {
    deltas = List.copyOf(deltas);
    unavailableAtBegin = Set.copyOf(unavailableAtBegin);
    unavailableAtEnd = Set.copyOf(unavailableAtEnd);
  }

  @Override
  public boolean isEmpty() {
    return deltas.isEmpty();
  }
}
