package io.github.themoah.ybstats.metrics;

/**
 * Result of fetching one endpoint from one host.
 */
public enum FetchOutcome {
  SUCCESS,
  UNREACHABLE,
  TIMEOUT,
  HTTP_ERROR,
  MALFORMED;

  /**
   * Returns a lowercase representation suitable for metric tags.
   */
  public String toTagValue() {
    return name().toLowerCase();
  }
}
