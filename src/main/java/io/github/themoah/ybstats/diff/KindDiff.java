package io.github.themoah.ybstats.diff;

import io.github.themoah.ybstats.model.EndpointKind;
import java.util.Set;

/**
 * Result of diffing one endpoint kind between two captures.
 */
public interface KindDiff {

  EndpointKind kind();

  /**
   * Hosts that only delivered a synthetic record at begin.
   */
  Set<String> unavailableAtBegin();

  /**
   * Hosts that only delivered a synthetic record at end.
   */
  Set<String> unavailableAtEnd();

  boolean isEmpty();
}
