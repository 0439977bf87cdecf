package io.github.themoah.ybstats.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapter for the glog formatted lines of the {@code /logs} page. Lines that do not
 * start a new entry are appended to the message of the previous one.
 */
public class LogLinesFlattener implements RecordFlattener {

  private static final Pattern ENTRY =
    Pattern.compile("^([IWEF])(\\d{4} \\d{2}:\\d{2}:\\d{2}\\.\\d{6})\\s+(\\d+)\\s+([^\\]]+)]\\s?(.*)$");

  @Override
  public List<Map<String, String>> flatten(String body) {
    List<Map<String, String>> rows = new ArrayList<>();
    if (body == null) {
      return rows;
    }
    String text = body.contains("<") ? HtmlTableFlattener.cellTextKeepingLines(body) : body;

    Map<String, String> current = null;
    for (String line : text.split("\n")) {
      Matcher entry = ENTRY.matcher(line);
      if (entry.matches()) {
        current = new LinkedHashMap<>();
        current.put("severity", entry.group(1));
        current.put("log_time", entry.group(2));
        current.put("thread_id", entry.group(3));
        current.put("source", entry.group(4).trim());
        current.put("message", entry.group(5));
        rows.add(current);
      } else if (current != null && !line.isBlank()) {
        current.put("message", current.get("message") + "\n" + line);
      }
    }
    return rows;
  }
}
