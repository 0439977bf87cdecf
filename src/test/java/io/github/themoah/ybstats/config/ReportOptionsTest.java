package io.github.themoah.ybstats.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ReportOptions.
 */
public class ReportOptionsTest {

  @Test
  void fromEnvironment_empty_matchesDefaults() {
    assertEquals(ReportOptions.defaults(), ReportOptions.fromEnvironment(Map.of()));
  }

  @Test
  void fromEnvironment_readsEveryOption() {
    ReportOptions options = ReportOptions.fromEnvironment(Map.of(
      "YBSTATS_STAT_NAME_MATCH", "rows_.*",
      "YBSTATS_TABLE_NAME_MATCH", "orders",
      "YBSTATS_GAUGES_ENABLE", "true",
      "YBSTATS_DETAILS_ENABLE", "true",
      "YBSTATS_INCLUDE_UNCHANGED", "true",
      "YBSTATS_SQL_LENGTH", "120",
      "YBSTATS_LOG_SEVERITY", "iwef"));

    assertEquals("rows_.*", options.statNameMatch());
    assertEquals("orders", options.tableNameMatch());
    assertTrue(options.gaugesEnable());
    assertTrue(options.detailsEnable());
    assertTrue(options.includeUnchanged());
    assertEquals(120, options.sqlLength());
    assertEquals("IWEF", options.logSeverity());
  }

  @Test
  void fromEnvironment_invalidSqlLength_usesDefault() {
    ReportOptions options = ReportOptions.fromEnvironment(Map.of("YBSTATS_SQL_LENGTH", "-3"));

    assertEquals(ReportOptions.defaults().sqlLength(), options.sqlLength());
    assertFalse(options.gaugesEnable());
  }

  @Test
  void fromEnvironment_invalidLogSeverity_usesDefault() {
    ReportOptions options = ReportOptions.fromEnvironment(Map.of("YBSTATS_LOG_SEVERITY", "WX"));

    assertEquals("WEF", options.logSeverity());
    assertEquals(ReportOptions.defaults().logSeverity(), options.logSeverity());
  }
}
