package io.github.themoah.ybstats;

import io.github.themoah.ybstats.model.EndpointKind;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

/**
 * A parsed invocation: the operation and its positional arguments.
 *
 * <pre>
 *   snapshot [comment...]
 *   list
 *   print &lt;kind&gt; [number]
 *   print-latencies [number]
 *   diff | metrics-diff | nonmetrics-diff &lt;begin&gt; &lt;end&gt;
 *   adhoc-diff | adhoc-metrics-diff | adhoc-nonmetrics-diff | adhoc-node-exporter-diff
 * </pre>
 */
public record Command(Operation operation, List<String> arguments) {

  public Command {
    arguments = List.copyOf(arguments);
  }

  /**
   * Parses and validates the launcher arguments. No arguments means an adhoc diff.
   *
   * @throws StatsException if the operation is unknown or its arguments do not fit
   */
  public static Command parse(String... args) {
    if (args.length == 0) {
      return new Command(Operation.ADHOC_DIFF, List.of());
    }
    Operation operation = Operation.fromCommand(args[0]);
    Command command = new Command(operation, Arrays.asList(args).subList(1, args.length));
    command.validate();
    return command;
  }

  /**
   * Free text of a snapshot, arguments joined by spaces.
   */
  public String comment() {
    return String.join(" ", arguments);
  }

  public EndpointKind kind() {
    try {
      return EndpointKind.fromName(arguments.get(0));
    } catch (IllegalArgumentException e) {
      throw new StatsException(e.getMessage(), e);
    }
  }

  /**
   * Snapshot to print, empty to print a live capture.
   */
  public OptionalInt snapshotNumber() {
    int index = operation == Operation.PRINT_LATENCIES ? 0 : 1;
    return arguments.size() > index ? OptionalInt.of(number(index)) : OptionalInt.empty();
  }

  public int beginNumber() {
    return number(0);
  }

  public int endNumber() {
    return number(1);
  }

  private void validate() {
    switch (operation) {
      case LIST -> expectArguments(0, 0);
      case PRINT -> {
        expectArguments(1, 2);
        kind();
        snapshotNumber();
      }
      case PRINT_LATENCIES -> {
        expectArguments(0, 1);
        snapshotNumber();
      }
      case DIFF, METRICS_DIFF, NONMETRICS_DIFF -> {
        expectArguments(2, 2);
        beginNumber();
        endNumber();
      }
      case ADHOC_DIFF, ADHOC_METRICS_DIFF, ADHOC_NONMETRICS_DIFF, ADHOC_NODE_EXPORTER_DIFF -> expectArguments(0, 0);
      default -> {
        // snapshot takes any comment
      }
    }
  }

  private void expectArguments(int min, int max) {
    if (arguments.size() < min || arguments.size() > max) {
      String expected = min == max ? Integer.toString(min) : min + " to " + max;
      throw new StatsException(operation.command() + " takes " + expected + " arguments, got " + arguments.size());
    }
  }

  private int number(int index) {
    String value = arguments.get(index);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new StatsException("Snapshot number must be an integer: " + value, e);
    }
  }
}
