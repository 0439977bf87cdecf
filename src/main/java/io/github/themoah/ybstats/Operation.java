package io.github.themoah.ybstats;

import io.github.themoah.ybstats.config.StatsConfig;
import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.RecordShape;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The operations the launcher can run.
 */
public enum Operation {
  SNAPSHOT("snapshot", null),
  LIST("list", null),
  PRINT("print", null),
  PRINT_LATENCIES("print-latencies", null, EndpointKind.CLOCKS),
  DIFF("diff", null),
  METRICS_DIFF("metrics-diff", RecordShape.METRIC),
  NONMETRICS_DIFF("nonmetrics-diff", RecordShape.STRUCTURED),
  ADHOC_DIFF("adhoc-diff", null),
  ADHOC_METRICS_DIFF("adhoc-metrics-diff", RecordShape.METRIC),
  ADHOC_NONMETRICS_DIFF("adhoc-nonmetrics-diff", RecordShape.STRUCTURED),
  ADHOC_NODE_EXPORTER_DIFF("adhoc-node-exporter-diff", RecordShape.METRIC, EndpointKind.NODE_EXPORTER);

  private final String command;
  private final RecordShape shape;
  private final EndpointKind onlyKind;

  Operation(String command, RecordShape shape) {
    this(command, shape, null);
  }

  Operation(String command, RecordShape shape, EndpointKind onlyKind) {
    this.command = command;
    this.shape = shape;
    this.onlyKind = onlyKind;
  }

  public String command() {
    return command;
  }

  public boolean isStoredDiff() {
    return this == DIFF || this == METRICS_DIFF || this == NONMETRICS_DIFF;
  }

  public boolean isAdhocDiff() {
    return this == ADHOC_DIFF || this == ADHOC_METRICS_DIFF || this == ADHOC_NONMETRICS_DIFF
      || this == ADHOC_NODE_EXPORTER_DIFF;
  }

  /**
   * Enabled kinds this operation covers, in declaration order.
   */
  public List<EndpointKind> kinds(StatsConfig config) {
    return Arrays.stream(EndpointKind.values())
      .filter(config::isEnabled)
      .filter(kind -> shape == null || kind.shape() == shape)
      .filter(kind -> onlyKind == null || kind == onlyKind)
      .collect(Collectors.toList());
  }

  /**
   * @throws StatsException if no operation has this name
   */
  public static Operation fromCommand(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (Operation operation : values()) {
      if (operation.command.equals(normalized)) {
        return operation;
      }
    }
    throw new StatsException("Unknown operation: " + name + ", expected one of "
      + Arrays.stream(values()).map(Operation::command).collect(Collectors.joining(", ")));
  }
}
