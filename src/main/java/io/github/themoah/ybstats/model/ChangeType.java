package io.github.themoah.ybstats.model;

/**
 * Outcome of comparing a keyed row between two captures.
 */
public enum ChangeType {
  ADDED("+"),
  REMOVED("-"),
  CHANGED("*");

  private final String marker;

  ChangeType(String marker) {
    this.marker = marker;
  }

  public String marker() {
    return marker;
  }
}
