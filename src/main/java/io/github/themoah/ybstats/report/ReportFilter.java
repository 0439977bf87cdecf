package io.github.themoah.ybstats.report;

import io.github.themoah.ybstats.StatsException;
import io.github.themoah.ybstats.config.ReportOptions;
import io.github.themoah.ybstats.schema.RecordSchema;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Narrows what a report shows. Filters never change what is fetched or stored.
 * Patterns use find semantics, so {@code "tablet"} matches any name containing it.
 * Rows with a severity column are kept only when their severity letter is configured.
 */
public final class ReportFilter {

  static final String SEVERITY_COLUMN = "severity";

  private final Pattern statName;
  private final Pattern tableName;
  private final Pattern hostname;
  private final int sqlLength;
  private final String logSeverity;

  private ReportFilter(Pattern statName, Pattern tableName, Pattern hostname, int sqlLength, String logSeverity) {
    this.statName = statName;
    this.tableName = tableName;
    this.hostname = hostname;
    this.sqlLength = sqlLength;
    this.logSeverity = logSeverity;
  }

  /**
   * Builds the filter of a report.
   *
   * @param options statistic and table patterns, text width and log severities
   * @param hostnameMatch pattern on host:port, null or empty to keep every host
   * @throws StatsException if a pattern does not compile
   */
  public static ReportFilter of(ReportOptions options, String hostnameMatch) {
    return new ReportFilter(
      compile("stat name", options.statNameMatch()),
      compile("table name", options.tableNameMatch()),
      hostnameMatch == null || hostnameMatch.isEmpty() ? null : compile("hostname", hostnameMatch),
      options.sqlLength(),
      options.logSeverity());
  }

  public boolean acceptsHost(String hostnamePort) {
    return hostname == null || hostname.matcher(hostnamePort).find();
  }

  /**
   * Filter of metric rows. The table pattern only applies with per-table detail, because
   * aggregated rows have no table.
   */
  public boolean acceptsMetric(String hostnamePort, String metricName, String table, boolean details) {
    return acceptsHost(hostnamePort)
      && statName.matcher(metricName).find()
      && (!details || tableName.matcher(table).find());
  }

  /**
   * Filter of structured rows, using the schema's name, table and severity columns when it
   * has them.
   */
  public boolean acceptsRecord(RecordSchema schema, String hostnamePort, Map<String, String> fields) {
    if (!acceptsHost(hostnamePort)) {
      return false;
    }
    if (schema.columns().contains(SEVERITY_COLUMN) && !acceptsSeverity(valueOf(fields, SEVERITY_COLUMN))) {
      return false;
    }
    if (schema.nameColumn() != null && !statName.matcher(valueOf(fields, schema.nameColumn())).find()) {
      return false;
    }
    return schema.tableColumn() == null || tableName.matcher(valueOf(fields, schema.tableColumn())).find();
  }

  public boolean acceptsSeverity(String severity) {
    return severity.length() == 1 && logSeverity.contains(severity);
  }

  /**
   * Cuts long text to the configured width.
   */
  public String truncate(String text) {
    String singleLine = text.replace('\n', ' ').replace('\r', ' ');
    return singleLine.length() <= sqlLength ? singleLine : singleLine.substring(0, sqlLength);
  }

  private static String valueOf(Map<String, String> fields, String column) {
    String value = fields.get(column);
    return value == null ? "" : value;
  }

  private static Pattern compile(String what, String regex) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new StatsException("Invalid " + what + " pattern: " + regex, e);
    }
  }
}
