package io.github.themoah.ybstats.snapshot;

import io.github.themoah.ybstats.StatsException;

/**
 * Thrown when a snapshot file or the catalog cannot be read back into its schema.
 */
public class SnapshotCorruptException extends StatsException {

  public SnapshotCorruptException(String message) {
    super(message);
  }

  public SnapshotCorruptException(String message, Throwable cause) {
    super(message, cause);
  }
}
