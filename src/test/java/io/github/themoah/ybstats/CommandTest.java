package io.github.themoah.ybstats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.ybstats.config.StatsConfig;
import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.RecordShape;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Command and Operation.
 */
public class CommandTest {

  @Test
  void parse_noArguments_isAdhocDiff() {
    Command command = Command.parse();

    assertEquals(Operation.ADHOC_DIFF, command.operation());
    assertTrue(command.arguments().isEmpty());
  }

  @Test
  void parse_snapshotJoinsComment() {
    Command command = Command.parse("snapshot", "before", "upgrade");

    assertEquals(Operation.SNAPSHOT, command.operation());
    assertEquals("before upgrade", command.comment());
    assertEquals("", Command.parse("snapshot").comment());
  }

  @Test
  void parse_diffNumbers() {
    Command command = Command.parse("metrics_diff", "3", "7");

    assertEquals(Operation.METRICS_DIFF, command.operation());
    assertEquals(3, command.beginNumber());
    assertEquals(7, command.endNumber());
  }

  @Test
  void parse_print() {
    Command live = Command.parse("print", "tablet-servers");
    Command stored = Command.parse("print", "gflags", "2");

    assertEquals(EndpointKind.TABLET_SERVERS, live.kind());
    assertEquals(OptionalInt.empty(), live.snapshotNumber());
    assertEquals(EndpointKind.GFLAGS, stored.kind());
    assertEquals(OptionalInt.of(2), stored.snapshotNumber());
  }

  @Test
  void parse_invalid_fails() {
    assertThrows(StatsException.class, () -> Command.parse("explode"));
    assertThrows(StatsException.class, () -> Command.parse("diff", "1"));
    assertThrows(StatsException.class, () -> Command.parse("diff", "one", "2"));
    assertThrows(StatsException.class, () -> Command.parse("list", "extra"));
    assertThrows(StatsException.class, () -> Command.parse("print"));
    assertThrows(StatsException.class, () -> Command.parse("print", "no_such_kind"));
    assertThrows(StatsException.class, () -> Command.parse("adhoc-diff", "1"));
  }

  @Test
  void operationKinds_filterByShapeAndDisabled() {
    StatsConfig config = StatsConfig.builder().disableKind(EndpointKind.STATEMENTS).build();

    List<EndpointKind> metricKinds = Operation.METRICS_DIFF.kinds(config);
    List<EndpointKind> structuredKinds = Operation.ADHOC_NONMETRICS_DIFF.kinds(config);

    assertTrue(metricKinds.contains(EndpointKind.METRICS));
    assertFalse(metricKinds.contains(EndpointKind.STATEMENTS));
    assertTrue(metricKinds.stream().allMatch(kind -> kind.shape() == RecordShape.METRIC));
    assertTrue(structuredKinds.stream().allMatch(kind -> kind.shape() == RecordShape.STRUCTURED));
    assertEquals(EndpointKind.values().length - 1, Operation.DIFF.kinds(config).size());
  }

  @Test
  void operation_classification() {
    assertTrue(Operation.NONMETRICS_DIFF.isStoredDiff());
    assertFalse(Operation.NONMETRICS_DIFF.isAdhocDiff());
    assertTrue(Operation.ADHOC_METRICS_DIFF.isAdhocDiff());
    assertFalse(Operation.LIST.isStoredDiff());
  }

  @Test
  void parse_printLatencies() {
    Command live = Command.parse("print_latencies");
    Command stored = Command.parse("print-latencies", "4");

    assertEquals(Operation.PRINT_LATENCIES, live.operation());
    assertEquals(OptionalInt.empty(), live.snapshotNumber());
    assertEquals(OptionalInt.of(4), stored.snapshotNumber());
    assertThrows(StatsException.class, () -> Command.parse("print-latencies", "4", "5"));
    assertThrows(StatsException.class, () -> Command.parse("print-latencies", "latest"));
  }

  @Test
  void adhocNodeExporterDiff_coversOnlyNodeExporter() {
    Command command = Command.parse("adhoc-node-exporter-diff");
    StatsConfig disabled = StatsConfig.builder().disableKind(EndpointKind.NODE_EXPORTER).build();

    assertEquals(Operation.ADHOC_NODE_EXPORTER_DIFF, command.operation());
    assertTrue(command.operation().isAdhocDiff());
    assertEquals(List.of(EndpointKind.NODE_EXPORTER), command.operation().kinds(StatsConfig.builder().build()));
    assertTrue(command.operation().kinds(disabled).isEmpty());
    assertThrows(StatsException.class, () -> Command.parse("adhoc-node-exporter-diff", "1"));
  }
}
