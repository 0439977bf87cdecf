package io.github.themoah.ybstats.snapshot;

import io.github.themoah.ybstats.StatsException;

/**
 * Thrown when a snapshot directory, kind file or catalog entry cannot be written.
 */
public class SnapshotWriteException extends StatsException {

  public SnapshotWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
