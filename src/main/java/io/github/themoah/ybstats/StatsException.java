package io.github.themoah.ybstats;

/**
 * Base class of the fatal errors that end an invocation with a non-zero exit code.
 */
public class StatsException extends RuntimeException {

  public StatsException(String message) {
    super(message);
  }

  public StatsException(String message, Throwable cause) {
    super(message, cause);
  }
}
