package io.github.themoah.ybstats.config;

import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Output settings for diff and point-in-time reports.
 *
 * @param statNameMatch regex on statistic or row names
 * @param tableNameMatch regex on table names (metric kinds only with details)
 * @param gaugesEnable show gauges next to counters in metric diffs
 * @param detailsEnable report each table and tablet instead of per-server sums
 * @param includeUnchanged keep metric rows whose delta is zero
 * @param sqlLength maximum width of long text columns such as SQL statements
 * @param logSeverity glog severity letters of log lines to show, for example {@code "WEF"}
 */
public record ReportOptions(
  String statNameMatch,
  String tableNameMatch,
  boolean gaugesEnable,
  boolean detailsEnable,
  boolean includeUnchanged,
  int sqlLength,
  String logSeverity
) {

  private static final Logger log = LoggerFactory.getLogger(ReportOptions.class);

  private static final String DEFAULT_MATCH = ".*";
  private static final int DEFAULT_SQL_LENGTH = 80;
  private static final String DEFAULT_LOG_SEVERITY = "WEF";

  public static ReportOptions defaults() {
    return new ReportOptions(DEFAULT_MATCH, DEFAULT_MATCH, false, false, false, DEFAULT_SQL_LENGTH,
      DEFAULT_LOG_SEVERITY);
  }

  /**
   * Loads options from the process environment.
   */
  public static ReportOptions fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Loads options from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>YBSTATS_STAT_NAME_MATCH - regex on statistic names (default: .*)</li>
   *   <li>YBSTATS_TABLE_NAME_MATCH - regex on table names (default: .*)</li>
   *   <li>YBSTATS_GAUGES_ENABLE - show gauges in metric diffs (default: false)</li>
   *   <li>YBSTATS_DETAILS_ENABLE - per table and tablet detail (default: false)</li>
   *   <li>YBSTATS_INCLUDE_UNCHANGED - keep zero-delta rows (default: false)</li>
   *   <li>YBSTATS_SQL_LENGTH - width of SQL text (default: 80)</li>
   *   <li>YBSTATS_LOG_SEVERITY - severities of log lines to show, any of IWEF (default: WEF)</li>
   * </ul>
   */
  public static ReportOptions fromEnvironment(Map<String, String> env) {
    String statNameMatch = parseString(env, "YBSTATS_STAT_NAME_MATCH", DEFAULT_MATCH);
    String tableNameMatch = parseString(env, "YBSTATS_TABLE_NAME_MATCH", DEFAULT_MATCH);
    boolean gaugesEnable = parseBoolean(env, "YBSTATS_GAUGES_ENABLE", false);
    boolean detailsEnable = parseBoolean(env, "YBSTATS_DETAILS_ENABLE", false);
    boolean includeUnchanged = parseBoolean(env, "YBSTATS_INCLUDE_UNCHANGED", false);
    int sqlLength = parseInt(env, "YBSTATS_SQL_LENGTH", DEFAULT_SQL_LENGTH);
    String logSeverity = parseString(env, "YBSTATS_LOG_SEVERITY", DEFAULT_LOG_SEVERITY)
      .trim().toUpperCase(Locale.ROOT);

    if (sqlLength < 1) {
      log.warn("YBSTATS_SQL_LENGTH must be >= 1, using default: {}", DEFAULT_SQL_LENGTH);
      sqlLength = DEFAULT_SQL_LENGTH;
    }
    if (!logSeverity.matches("[IWEF]+")) {
      log.warn("YBSTATS_LOG_SEVERITY must only hold the letters I, W, E and F, using default: {}",
        DEFAULT_LOG_SEVERITY);
      logSeverity = DEFAULT_LOG_SEVERITY;
    }

    ReportOptions options = new ReportOptions(statNameMatch, tableNameMatch, gaugesEnable,
      detailsEnable, includeUnchanged, sqlLength, logSeverity);
    log.debug("Report options: {}", options);
    return options;
  }

  private static String parseString(Map<String, String> env, String envVar, String defaultValue) {
    String value = env.get(envVar);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static boolean parseBoolean(Map<String, String> env, String envVar, boolean defaultValue) {
    String value = env.get(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }

  private static int parseInt(Map<String, String> env, String envVar, int defaultValue) {
    String value = env.get(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
