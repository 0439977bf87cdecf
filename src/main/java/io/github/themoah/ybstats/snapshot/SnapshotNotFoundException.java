package io.github.themoah.ybstats.snapshot;

import io.github.themoah.ybstats.StatsException;

/**
 * Thrown when a snapshot number or one of its kind files does not exist.
 */
public class SnapshotNotFoundException extends StatsException {

  public SnapshotNotFoundException(String message) {
    super(message);
  }
}
