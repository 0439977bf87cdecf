package io.github.themoah.ybstats.diff;

import io.github.themoah.ybstats.StatsException;

/**
 * Thrown when a diff is requested with a begin snapshot that does not precede the end snapshot.
 */
public class InvalidDiffRequestException extends StatsException {

  public InvalidDiffRequestException(String message) {
    super(message);
  }
}
