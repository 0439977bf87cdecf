package io.github.themoah.ybstats.report;

import io.github.themoah.ybstats.config.ReportOptions;
import io.github.themoah.ybstats.diff.KindDiff;
import io.github.themoah.ybstats.diff.MetricKindDiff;
import io.github.themoah.ybstats.diff.MetricRow;
import io.github.themoah.ybstats.diff.MetricRows;
import io.github.themoah.ybstats.diff.StructuredKindDiff;
import io.github.themoah.ybstats.model.CatalogEntry;
import io.github.themoah.ybstats.model.ChangeType;
import io.github.themoah.ybstats.model.CollectionPass;
import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.FieldChange;
import io.github.themoah.ybstats.model.MetricDelta;
import io.github.themoah.ybstats.model.RecordChange;
import io.github.themoah.ybstats.model.StoredRecord;
import io.github.themoah.ybstats.schema.KindSchemas;
import io.github.themoah.ybstats.schema.RecordSchema;
import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes diffs, point-in-time captures and the catalog as aligned text tables.
 * Output goes to the given stream only; logging stays on standard error.
 */
public class ReportRenderer {

  private static final Pattern RTT = Pattern.compile("\\s*([0-9]+(?:\\.[0-9]+)?)\\s*(us|ms|s)?\\s*");
  private static final DateTimeFormatter CATALOG_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss xxx");

  private final PrintStream out;
  private final ReportOptions options;
  private final ReportFilter filter;

  public ReportRenderer(PrintStream out, ReportOptions options, ReportFilter filter) {
    this.out = out;
    this.options = options;
    this.filter = filter;
  }

  /**
   * Renders one kind's diff. Nothing is printed when no row passes the filters and no
   * host was unavailable.
   *
   * @return number of table rows printed
   */
  public int render(KindDiff diff) {
    int printed;
    if (diff instanceof MetricKindDiff metricDiff) {
      printed = renderMetricDiff(metricDiff);
    } else if (diff instanceof StructuredKindDiff structuredDiff) {
      printed = renderStructuredDiff(structuredDiff);
    } else {
      throw new IllegalArgumentException("Unsupported diff type " + diff.getClass().getName());
    }
    renderUnavailable("begin", diff.unavailableAtBegin());
    renderUnavailable("end", diff.unavailableAtEnd());
    return printed;
  }

  private int renderMetricDiff(MetricKindDiff diff) {
    boolean details = options.detailsEnable();
    TableFormatter table = new TableFormatter(metricHeader(details, "value", "per_second"))
      .alignRight("value", "per_second");

    for (MetricDelta delta : diff.deltas()) {
      if (delta.gauge() && !options.gaugesEnable()) {
        continue;
      }
      if (!filter.acceptsMetric(delta.hostnamePort(), delta.metricName(), delta.tableName(), details)) {
        continue;
      }
      List<String> row = metricIdentity(details, delta.hostnamePort(), delta.metricType(), delta.metricId(),
        delta.tableName(), delta.metricName());
      if (delta.gauge()) {
        row.add(formatNumber(delta.endValue()));
        row.add(formatSigned(delta.delta()));
      } else {
        row.add(formatNumber(delta.delta()));
        row.add(delta.rate().isPresent() ? String.format(Locale.ROOT, "%.3f /s", delta.rate().getAsDouble()) : "");
      }
      table.addRow(row);
    }
    return printTable(diff.kind(), table);
  }

  private int renderStructuredDiff(StructuredKindDiff diff) {
    RecordSchema schema = KindSchemas.forKind(diff.kind());
    List<String> header = new ArrayList<>();
    header.add("change");
    header.add("hostname_port");
    header.addAll(schema.columns());
    TableFormatter table = new TableFormatter(header);

    for (RecordChange change : diff.changes()) {
      StoredRecord current = change.current();
      if (!filter.acceptsRecord(schema, change.hostnamePort(), current.fields())) {
        continue;
      }
      if (change.type() == ChangeType.CHANGED) {
        for (FieldChange field : change.changes()) {
          List<String> row = new ArrayList<>();
          row.add(change.type().marker());
          row.add(change.hostnamePort());
          for (String column : schema.columns()) {
            if (column.equals(field.column())) {
              row.add(filter.truncate(field.beginValue()) + " -> " + filter.truncate(field.endValue()));
            } else if (schema.keyColumns().contains(column)) {
              row.add(filter.truncate(current.field(column)));
            } else {
              row.add("");
            }
          }
          table.addRow(row);
        }
      } else {
        List<String> row = new ArrayList<>();
        row.add(change.type().marker());
        row.add(change.hostnamePort());
        schema.columns().forEach(column -> row.add(filter.truncate(current.field(column))));
        table.addRow(row);
      }
    }
    return printTable(diff.kind(), table);
  }

  /**
   * Renders the records of one kind at a single point in time. Metric kinds are summed
   * per server unless details are enabled. Hosts with only synthetic records are listed
   * as unavailable.
   *
   * @return number of table rows printed
   */
  public int renderCapture(CollectionPass pass) {
    Set<String> unavailable = new TreeSet<>();
    for (StoredRecord record : pass.records()) {
      if (record.synthetic() && filter.acceptsHost(record.hostnamePort())) {
        unavailable.add(record.hostnamePort());
      }
    }

    int printed = pass.kind().isMetric() ? renderMetricPass(pass) : renderStructuredPass(pass);
    renderUnavailable("capture", unavailable);
    return printed;
  }

  private int renderMetricPass(CollectionPass pass) {
    boolean details = options.detailsEnable();
    TableFormatter table = new TableFormatter(metricHeader(details, "value")).alignRight("value");

    for (MetricRow metric : MetricRows.of(pass.records(), details)) {
      if (!filter.acceptsMetric(metric.hostnamePort(), metric.metricName(), metric.tableName(), details)) {
        continue;
      }
      List<String> row = metricIdentity(details, metric.hostnamePort(), metric.metricType(), metric.metricId(),
        metric.tableName(), metric.metricName());
      row.add(formatNumber(metric.value()));
      table.addRow(row);
    }
    return printTable(pass.kind(), table);
  }

  private int renderStructuredPass(CollectionPass pass) {
    RecordSchema schema = KindSchemas.forKind(pass.kind());
    List<String> header = new ArrayList<>();
    header.add("hostname_port");
    header.addAll(schema.columns());
    TableFormatter table = new TableFormatter(header);

    for (StoredRecord record : pass.records()) {
      if (record.synthetic() || !filter.acceptsRecord(schema, record.hostnamePort(), record.fields())) {
        continue;
      }
      List<String> row = new ArrayList<>();
      row.add(record.hostnamePort());
      schema.columns().forEach(column -> row.add(filter.truncate(record.field(column))));
      table.addRow(row);
    }
    return printTable(pass.kind(), table);
  }

  /**
   * Renders the heartbeat round trip times the master leader reports for each tablet server,
   * slowest first. Servers whose round trip time cannot be read are listed last.
   *
   * @param clocks a capture of {@link EndpointKind#CLOCKS}
   * @return number of table rows printed
   */
  public int renderLatencies(CollectionPass clocks) {
    if (clocks.kind() != EndpointKind.CLOCKS) {
      throw new IllegalArgumentException("Latencies come from clocks, not " + clocks.kind());
    }
    RecordSchema schema = KindSchemas.forKind(EndpointKind.CLOCKS);
    Set<String> unavailable = new TreeSet<>();
    List<StoredRecord> servers = new ArrayList<>();
    for (StoredRecord record : clocks.records()) {
      if (record.synthetic()) {
        if (filter.acceptsHost(record.hostnamePort())) {
          unavailable.add(record.hostnamePort());
        }
      } else if (filter.acceptsRecord(schema, record.hostnamePort(), record.fields())) {
        servers.add(record);
      }
    }
    servers.sort(Comparator.comparingDouble(
      (StoredRecord record) -> parseRttMillis(record.field("heartbeat_rtt")).orElse(-1)).reversed());

    TableFormatter table = new TableFormatter(
      List.of("hostname_port", "server", "cloud", "region", "zone", "heartbeat_rtt_ms"))
      .alignRight("heartbeat_rtt_ms");
    DoubleSummaryStatistics stats = new DoubleSummaryStatistics();
    for (StoredRecord record : servers) {
      OptionalDouble rtt = parseRttMillis(record.field("heartbeat_rtt"));
      rtt.ifPresent(stats::accept);
      table.addRow(List.of(record.hostnamePort(), record.field("server"), record.field("cloud"),
        record.field("region"), record.field("zone"),
        rtt.isPresent() ? String.format(Locale.ROOT, "%.3f", rtt.getAsDouble()) : record.field("heartbeat_rtt")));
    }

    if (!table.isEmpty()) {
      out.println("latencies");
      table.print(out);
      if (stats.getCount() > 0) {
        out.println(String.format(Locale.ROOT, "heartbeat rtt ms min %.3f avg %.3f max %.3f over %d servers",
          stats.getMin(), stats.getAverage(), stats.getMax(), stats.getCount()));
      }
      out.println();
    }
    renderUnavailable("capture", unavailable);
    return table.size();
  }

  /**
   * Reads a round trip time such as {@code 0.45ms}, {@code 450us} or {@code 0.00045s} as
   * milliseconds. A bare number is taken as milliseconds.
   */
  static OptionalDouble parseRttMillis(String text) {
    Matcher matcher = RTT.matcher(text);
    if (!matcher.matches()) {
      return OptionalDouble.empty();
    }
    double value = Double.parseDouble(matcher.group(1));
    String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
    return switch (unit) {
      case "us" -> OptionalDouble.of(value / 1000);
      case "s" -> OptionalDouble.of(value * 1000);
      default -> OptionalDouble.of(value);
    };
  }

  /**
   * Prints the snapshot catalog.
   */
  public void renderCatalog(List<CatalogEntry> entries) {
    TableFormatter table = new TableFormatter(List.of("number", "timestamp", "comment")).alignRight("number");
    for (CatalogEntry entry : entries) {
      table.addRow(List.of(Integer.toString(entry.number()), CATALOG_TIME.format(entry.timestamp()), entry.comment()));
    }
    table.print(out);
  }

  private int printTable(EndpointKind kind, TableFormatter table) {
    if (table.isEmpty()) {
      return 0;
    }
    out.println(kind.fileName());
    table.print(out);
    out.println();
    return table.size();
  }

  private void renderUnavailable(String side, Set<String> hosts) {
    List<String> shown = new ArrayList<>();
    for (String host : new TreeSet<>(hosts)) {
      if (filter.acceptsHost(host)) {
        shown.add(host);
      }
    }
    if (!shown.isEmpty()) {
      out.println("unavailable at " + side + ": " + String.join(", ", shown));
    }
  }

  private static List<String> metricHeader(boolean details, String... values) {
    List<String> header = new ArrayList<>(List.of("hostname_port", "type"));
    if (details) {
      header.add("id");
      header.add("table");
    }
    header.add("name");
    header.addAll(List.of(values));
    return header;
  }

  private static List<String> metricIdentity(
      boolean details, String hostnamePort, String type, String id, String table, String name) {

    List<String> row = new ArrayList<>(List.of(hostnamePort, type));
    if (details) {
      row.add(id);
      row.add(table);
    }
    row.add(name);
    return row;
  }

  static String formatSigned(double value) {
    return (value >= 0 ? "+" : "") + formatNumber(value);
  }

  static String formatNumber(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return String.format(Locale.ROOT, "%.0f", value);
    }
    return String.format(Locale.ROOT, "%.3f", value);
  }
}
