package io.github.themoah.ybstats.collector;

import io.github.themoah.ybstats.config.StatsConfig;
import io.github.themoah.ybstats.metrics.CollectionMetrics;
import io.github.themoah.ybstats.metrics.FetchOutcome;
import io.github.themoah.ybstats.model.CollectionPass;
import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.HostPort;
import io.github.themoah.ybstats.model.StoredRecord;
import io.github.themoah.ybstats.schema.KindSchemas;
import io.github.themoah.ybstats.schema.MalformedPayloadException;
import io.github.themoah.ybstats.schema.RecordSchema;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetClientOptions;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches one endpoint kind from every host of the work list with bounded concurrency.
 * A host that cannot deliver data contributes a synthetic record instead of failing the pass.
 */
public class EndpointCollector {

  private static final Logger log = LoggerFactory.getLogger(EndpointCollector.class);

  private final TargetResolution targets;
  private final CollectionMetrics metrics;
  private final WebClient webClient;
  private final NetClient probeClient;
  private final long requestTimeoutMs;
  private final boolean silent;

  /**
   * Creates a collector.
   *
   * @param vertx the Vert.x instance
   * @param config collection settings (timeouts, TLS, silence)
   * @param targets resolved hosts and ports
   * @param metrics fetch outcome instrumentation
   */
  public EndpointCollector(Vertx vertx, StatsConfig config, TargetResolution targets, CollectionMetrics metrics) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    Objects.requireNonNull(config, "config cannot be null");
    this.targets = Objects.requireNonNull(targets, "targets cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    this.requestTimeoutMs = config.getRequestTimeoutMs();
    this.silent = config.isSilent();

    WebClientOptions clientOptions = new WebClientOptions()
      .setSsl(config.isHttps())
      .setTrustAll(true)
      .setVerifyHost(false)
      .setConnectTimeout((int) Math.min(Integer.MAX_VALUE, requestTimeoutMs))
      .setUserAgent("ybstats");
    this.webClient = WebClient.create(vertx, clientOptions);
    this.probeClient = vertx.createNetClient(
      new NetClientOptions().setConnectTimeout((int) Math.min(Integer.MAX_VALUE, config.getProbeTimeoutMs())));
  }

  /**
   * Collects one kind from the work list the resolution yields for it.
   *
   * @param kind the endpoint kind
   * @return Future with every record of the pass; never fails because of a host
   */
  public Future<CollectionPass> collect(EndpointKind kind) {
    return collect(kind, targets.workList(kind));
  }

  /**
   * Collects one kind from an explicit work list.
   */
  public Future<CollectionPass> collect(EndpointKind kind, List<HostPort> work) {
    RecordSchema schema = KindSchemas.forKind(kind);
    OffsetDateTime timestamp = OffsetDateTime.now();
    long started = System.nanoTime();

    log.debug("Collecting {} from {} endpoints with parallelism {}", kind.fileName(), work.size(), targets.parallel());

    return AdmissionGate.runBounded(work, targets.parallel(), target -> fetch(kind, schema, target, timestamp))
      .map(perHost -> {
        List<StoredRecord> records = new ArrayList<>();
        perHost.forEach(records::addAll);
        metrics.recordPass(kind, Duration.ofNanos(System.nanoTime() - started), records.size());
        log.debug("Collected {} {} records", records.size(), kind.fileName());
        return new CollectionPass(kind, timestamp, records);
      });
  }

  /**
   * Releases the HTTP and probe clients.
   */
  public Future<Void> close() {
    webClient.close();
    return probeClient.close();
  }

  private Future<List<StoredRecord>> fetch(
      EndpointKind kind, RecordSchema schema, HostPort target, OffsetDateTime timestamp) {

    String path = targets.requestPath(kind);
    return probe(target)
      .compose(v -> get(target, path))
      .map(body -> parse(schema, target, timestamp, body))
      .map(records -> {
        metrics.recordFetch(kind, FetchOutcome.SUCCESS);
        return records;
      })
      .recover(err -> {
        FetchOutcome outcome = err instanceof FetchFailure failure ? failure.outcome : FetchOutcome.UNREACHABLE;
        metrics.recordFetch(kind, outcome);
        warn("Warning hostname:port {} {} for {}: {}", target.hostnamePort(), describe(outcome),
          kind.fileName(), err.getMessage());
        return Future.succeededFuture(List.of(StoredRecord.synthetic(target.hostnamePort(), timestamp, schema.columns())));
      });
  }

  private Future<Void> probe(HostPort target) {
    return probeClient.connect(target.port(), target.host())
      .recover(err -> Future.failedFuture(new FetchFailure(FetchOutcome.UNREACHABLE, "cannot be reached: " + err.getMessage())))
      .compose(socket -> socket.close());
  }

  private Future<String> get(HostPort target, String path) {
    return webClient.get(target.port(), target.host(), path)
      .timeout(requestTimeoutMs)
      .send()
      .recover(err -> {
        FetchOutcome outcome = isTimeout(err) ? FetchOutcome.TIMEOUT : FetchOutcome.UNREACHABLE;
        return Future.failedFuture(new FetchFailure(outcome, String.valueOf(err.getMessage())));
      })
      .compose(response -> {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
          return Future.failedFuture(new FetchFailure(FetchOutcome.HTTP_ERROR,
            "HTTP " + response.statusCode() + " for " + path));
        }
        String body = response.bodyAsString();
        return Future.succeededFuture(body == null ? "" : body);
      });
  }

  private List<StoredRecord> parse(RecordSchema schema, HostPort target, OffsetDateTime timestamp, String body) {
    try {
      return schema.toRecords(target.hostnamePort(), timestamp, body);
    } catch (MalformedPayloadException e) {
      throw new FetchFailure(FetchOutcome.MALFORMED, e.getMessage());
    }
  }

  static boolean isTimeout(Throwable err) {
    if (err instanceof TimeoutException) {
      return true;
    }
    String message = err.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT).contains("timeout");
  }

  private static String describe(FetchOutcome outcome) {
    return switch (outcome) {
      case UNREACHABLE -> "cannot be reached, skipping";
      case TIMEOUT -> "timed out, skipping";
      case HTTP_ERROR -> "returned an error, skipping";
      case MALFORMED -> "returned data that cannot be parsed, using empty record";
      case SUCCESS -> "succeeded";
    };
  }

  private void warn(String format, Object... arguments) {
    if (silent) {
      log.debug(format, arguments);
    } else {
      log.warn(format, arguments);
    }
  }

  /**
   * Failure of one host fetch, tagged with how it failed.
   */
  private static final class FetchFailure extends RuntimeException {

    private final FetchOutcome outcome;

    FetchFailure(FetchOutcome outcome, String message) {
      super(message, null, false, false);
      this.outcome = outcome;
    }
  }
}
