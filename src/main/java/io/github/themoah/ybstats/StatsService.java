package io.github.themoah.ybstats;

import io.github.themoah.ybstats.collector.AdmissionGate;
import io.github.themoah.ybstats.collector.EndpointCollector;
import io.github.themoah.ybstats.collector.TargetResolution;
import io.github.themoah.ybstats.collector.TargetResolver;
import io.github.themoah.ybstats.config.ReportOptions;
import io.github.themoah.ybstats.config.StatsConfig;
import io.github.themoah.ybstats.diff.DiffEngine;
import io.github.themoah.ybstats.diff.DiffOptions;
import io.github.themoah.ybstats.diff.InvalidDiffRequestException;
import io.github.themoah.ybstats.diff.KindDiff;
import io.github.themoah.ybstats.metrics.CollectionMetrics;
import io.github.themoah.ybstats.model.CatalogEntry;
import io.github.themoah.ybstats.model.CollectionPass;
import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.report.ReportFilter;
import io.github.themoah.ybstats.report.ReportRenderer;
import io.github.themoah.ybstats.snapshot.SnapshotNotFoundException;
import io.github.themoah.ybstats.snapshot.SnapshotStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the operations: capture, list, print, latencies, stored diff and adhoc diff.
 * Network work stays on the event loop; snapshot store calls run through
 * {@code executeBlocking}. Every fatal condition fails the returned future.
 */
public class StatsService {

  private static final Logger log = LoggerFactory.getLogger(StatsService.class);

  private final Vertx vertx;
  private final StatsConfig config;
  private final EndpointCollector collector;
  private final SnapshotStore store;
  private final DiffEngine diffEngine;
  private final ReportRenderer renderer;
  private final DiffOptions diffOptions;
  private final AdhocTrigger trigger;
  private final PrintStream out;

  public StatsService(
      Vertx vertx,
      StatsConfig config,
      EndpointCollector collector,
      SnapshotStore store,
      DiffEngine diffEngine,
      ReportRenderer renderer,
      DiffOptions diffOptions,
      AdhocTrigger trigger,
      PrintStream out) {

    this.vertx = vertx;
    this.config = config;
    this.collector = collector;
    this.store = store;
    this.diffEngine = diffEngine;
    this.renderer = renderer;
    this.diffOptions = diffOptions;
    this.trigger = trigger;
    this.out = out;
  }

  /**
   * Wires a service from configuration.
   *
   * @throws StatsException if hosts, ports or patterns are invalid
   */
  public static StatsService create(
      Vertx vertx,
      StatsConfig config,
      ReportOptions reportOptions,
      CollectionMetrics metrics,
      AdhocTrigger trigger,
      PrintStream out) {

    TargetResolution targets = TargetResolver.resolve(config);
    if (!targets.overrides().isEmpty()) {
      log.debug("Options set away from their defaults: {}", targets.overrides());
    }
    ReportRenderer renderer = new ReportRenderer(out, reportOptions,
      ReportFilter.of(reportOptions, config.getHostnameMatch()));
    DiffOptions diffOptions = new DiffOptions(reportOptions.detailsEnable(), reportOptions.includeUnchanged());

    return new StatsService(
      vertx,
      config,
      new EndpointCollector(vertx, config, targets, metrics),
      new SnapshotStore(config.getSnapshotDirectory()),
      new DiffEngine(),
      renderer,
      diffOptions,
      trigger,
      out);
  }

  /**
   * Runs one parsed command.
   */
  public Future<Void> run(Command command) {
    Operation operation = command.operation();
    if (operation == Operation.SNAPSHOT) {
      return captureSnapshot(command.comment()).mapEmpty();
    }
    if (operation == Operation.LIST) {
      return list().mapEmpty();
    }
    if (operation == Operation.PRINT) {
      return print(command.kind(), command.snapshotNumber()).mapEmpty();
    }
    if (operation == Operation.PRINT_LATENCIES) {
      return printLatencies(command.snapshotNumber()).mapEmpty();
    }
    if (operation.isStoredDiff()) {
      return storedDiff(command.beginNumber(), command.endNumber(), operation.kinds(config)).mapEmpty();
    }
    if (operation.isAdhocDiff()) {
      List<EndpointKind> kinds = operation.kinds(config);
      if (kinds.isEmpty()) {
        log.warn("{} has no enabled endpoint kind to compare", operation.command());
      }
      return adhocDiff(kinds).mapEmpty();
    }
    return Future.failedFuture(new IllegalStateException("Unhandled operation " + operation));
  }

  /**
   * Captures every enabled kind into a new snapshot, one kind after the other.
   *
   * @return Future with the catalog entry of the new snapshot
   */
  public Future<CatalogEntry> captureSnapshot(String comment) {
    List<EndpointKind> kinds = Operation.SNAPSHOT.kinds(config);

    return vertx.executeBlocking(() -> store.beginSnapshot(comment))
      .compose(entry -> AdmissionGate.runBounded(kinds, 1, kind -> collector.collect(kind)
          .compose(pass -> vertx.executeBlocking(() -> {
            store.write(entry.number(), pass);
            return pass.records().size();
          })))
        .map(counts -> {
          log.info("Snapshot {} holds {} records of {} kinds", entry.number(),
            counts.stream().mapToInt(Integer::intValue).sum(), kinds.size());
          out.println("snapshot number " + entry.number());
          return entry;
        }));
  }

  /**
   * Prints the catalog.
   */
  public Future<List<CatalogEntry>> list() {
    return vertx.executeBlocking(store::listSnapshots)
      .onSuccess(renderer::renderCatalog);
  }

  /**
   * Prints one kind, from a snapshot when a number is given, otherwise from a live capture.
   *
   * @return Future with the number of printed rows
   */
  public Future<Integer> print(EndpointKind kind, OptionalInt number) {
    Future<CollectionPass> pass = number.isPresent()
      ? vertx.executeBlocking(() -> store.load(number.getAsInt(), kind))
      : collector.collect(kind);
    return pass.map(renderer::renderCapture);
  }

  /**
   * Prints the heartbeat round trip times of the tablet servers, from the clocks of a
   * snapshot when a number is given, otherwise from a live capture.
   *
   * @return Future with the number of printed rows
   */
  public Future<Integer> printLatencies(OptionalInt number) {
    Future<CollectionPass> clocks = number.isPresent()
      ? vertx.executeBlocking(() -> store.load(number.getAsInt(), EndpointKind.CLOCKS))
      : collector.collect(EndpointKind.CLOCKS);
    return clocks.map(renderer::renderLatencies);
  }

  /**
   * Diffs two stored snapshots. The numbers are validated before any snapshot file is
   * read, and every kind is loaded before anything is printed.
   *
   * @return Future with the number of printed rows
   */
  public Future<Integer> storedDiff(int begin, int end, List<EndpointKind> kinds) {
    if (begin >= end) {
      return Future.failedFuture(new InvalidDiffRequestException(
        "Begin snapshot " + begin + " must be lower than end snapshot " + end));
    }

    return vertx.executeBlocking(() -> {
      for (int number : new int[] {begin, end}) {
        if (!store.contains(number)) {
          throw new SnapshotNotFoundException("Snapshot " + number + " is not in the catalog of " + store.root());
        }
      }
      List<KindDiff> diffs = new ArrayList<>(kinds.size());
      for (EndpointKind kind : kinds) {
        diffs.add(diffEngine.diff(kind, store.load(begin, kind), store.load(end, kind), diffOptions));
      }
      return diffs;
    }).map(this::renderAll);
  }

  /**
   * Diffs two live captures. The end capture starts when the trigger fires.
   *
   * @return Future with the number of printed rows
   */
  public Future<Integer> adhocDiff(List<EndpointKind> kinds) {
    return AdmissionGate.runBounded(kinds, 1, kind -> collector.collect(kind))
      .compose(beginPasses -> trigger.awaitEndCapture()
        .compose(v -> AdmissionGate.runBounded(kinds, 1, kind -> collector.collect(kind)))
        .map(endPasses -> {
          List<KindDiff> diffs = new ArrayList<>(kinds.size());
          for (int i = 0; i < kinds.size(); i++) {
            diffs.add(diffEngine.diff(kinds.get(i), beginPasses.get(i), endPasses.get(i), diffOptions));
          }
          return renderAll(diffs);
        }));
  }

  /**
   * Releases network clients.
   */
  public Future<Void> close() {
    return collector.close();
  }

  private int renderAll(List<KindDiff> diffs) {
    int printed = 0;
    for (KindDiff diff : diffs) {
      printed += renderer.render(diff);
    }
    log.debug("Printed {} rows for {} kinds", printed, diffs.size());
    return printed;
  }
}
