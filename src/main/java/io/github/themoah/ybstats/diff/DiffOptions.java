package io.github.themoah.ybstats.diff;

/**
 * Switches that change what the diff engine produces.
 *
 * @param details keep table and tablet metrics per entity instead of summing them
 * @param includeUnchanged keep metric rows whose delta is zero
 */
public record DiffOptions(
  boolean details,
  boolean includeUnchanged
) {

  public static DiffOptions defaults() {
    return new DiffOptions(false, false);
  }
}
