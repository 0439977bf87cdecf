package io.github.themoah.ybstats.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapter for pages that only exist as HTML: reads the data rows of one table and
 * maps the cells to columns by position. Header rows ({@code <th>} cells) are skipped.
 */
public class HtmlTableFlattener implements RecordFlattener {

  private static final Pattern TABLE = Pattern.compile("(?is)<table[^>]*>(.*?)</table>");
  private static final Pattern ROW = Pattern.compile("(?is)<tr[^>]*>(.*?)</tr>");
  private static final Pattern CELL = Pattern.compile("(?is)<t([dh])[^>]*>(.*?)</t[dh]>");
  private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final List<String> columns;
  private final int tableIndex;

  public HtmlTableFlattener(List<String> columns) {
    this(columns, 0);
  }

  public HtmlTableFlattener(List<String> columns, int tableIndex) {
    this.columns = List.copyOf(columns);
    this.tableIndex = tableIndex;
  }

  @Override
  public List<Map<String, String>> flatten(String body) {
    String table = findTable(body == null ? "" : body);

    List<Map<String, String>> rows = new ArrayList<>();
    Matcher rowMatcher = ROW.matcher(table);
    while (rowMatcher.find()) {
      List<String> cells = new ArrayList<>();
      boolean header = false;
      Matcher cellMatcher = CELL.matcher(rowMatcher.group(1));
      while (cellMatcher.find()) {
        header |= cellMatcher.group(1).equalsIgnoreCase("h");
        cells.add(cellText(cellMatcher.group(2)));
      }
      if (header || cells.isEmpty()) {
        continue;
      }
      Map<String, String> row = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) {
        row.put(columns.get(i), i < cells.size() ? cells.get(i) : "");
      }
      rows.add(row);
    }
    return rows;
  }

  private String findTable(String body) {
    Matcher tableMatcher = TABLE.matcher(body);
    int index = 0;
    while (tableMatcher.find()) {
      if (index++ == tableIndex) {
        return tableMatcher.group(1);
      }
    }
    throw new MalformedPayloadException("Page has no table number " + tableIndex);
  }

  static String cellText(String html) {
    String text = unescape(TAG.matcher(html).replaceAll(" "));
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  /**
   * Strips markup from a page but keeps its line structure.
   */
  static String cellTextKeepingLines(String html) {
    return unescape(TAG.matcher(html).replaceAll(""));
  }

  private static String unescape(String text) {
    return text.replace("&nbsp;", " ")
      .replace("&lt;", "<")
      .replace("&gt;", ">")
      .replace("&quot;", "\"")
      .replace("&#39;", "'")
      .replace("&amp;", "&");
  }
}
