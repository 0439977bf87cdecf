package io.github.themoah.ybstats.report;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed-width text table. Column widths are computed from the header and every row, so
 * the whole table is buffered until {@link #print(PrintStream)}.
 */
public class TableFormatter {

  private static final String SEPARATOR = "  ";

  private final List<String> header;
  private final Set<Integer> rightAligned = new HashSet<>();
  private final List<List<String>> rows = new ArrayList<>();

  public TableFormatter(List<String> header) {
    this.header = List.copyOf(header);
  }

  /**
   * Right-aligns the named columns, typically the numeric ones.
   */
  public TableFormatter alignRight(String... columns) {
    for (String column : columns) {
      int index = header.indexOf(column);
      if (index >= 0) {
        rightAligned.add(index);
      }
    }
    return this;
  }

  public TableFormatter addRow(List<String> row) {
    if (row.size() != header.size()) {
      throw new IllegalArgumentException("Row has " + row.size() + " cells, table has " + header.size() + " columns");
    }
    rows.add(List.copyOf(row));
    return this;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int size() {
    return rows.size();
  }

  /**
   * Writes header and rows. Trailing blanks are trimmed from every line.
   */
  public void print(PrintStream out) {
    int[] widths = new int[header.size()];
    measure(header, widths);
    rows.forEach(row -> measure(row, widths));

    out.println(line(header, widths));
    for (List<String> row : rows) {
      out.println(line(row, widths));
    }
  }

  private static void measure(List<String> row, int[] widths) {
    for (int i = 0; i < row.size(); i++) {
      widths[i] = Math.max(widths[i], row.get(i).length());
    }
  }

  private String line(List<String> row, int[] widths) {
    StringBuilder line = new StringBuilder();
    for (int i = 0; i < row.size(); i++) {
      if (i > 0) {
        line.append(SEPARATOR);
      }
      String cell = row.get(i);
      String padding = " ".repeat(widths[i] - cell.length());
      if (rightAligned.contains(i)) {
        line.append(padding).append(cell);
      } else {
        line.append(cell).append(padding);
      }
    }
    return stripTrailing(line);
  }

  private static String stripTrailing(StringBuilder line) {
    int end = line.length();
    while (end > 0 && line.charAt(end - 1) == ' ') {
      end--;
    }
    return line.substring(0, end);
  }
}
