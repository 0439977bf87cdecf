package io.github.themoah.ybstats.collector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.ybstats.config.StatsConfig;
import io.github.themoah.ybstats.metrics.CollectionMetrics;
import io.github.themoah.ybstats.metrics.FetchOutcome;
import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.StoredRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for EndpointCollector against a local HTTP server.
 */
@ExtendWith(VertxExtension.class)
public class EndpointCollectorTest {

  private static final String VERSIONS_BODY =
    "{\"git_hash\":\"abc\",\"version_number\":\"2.20.1.0\",\"build_number\":\"97\"}";

  private HttpServer server;
  private int port;
  private int closedPort;
  private volatile Handler<HttpServerRequest> responder;
  private CollectionMetrics metrics;

  @BeforeEach
  void startServer(Vertx vertx, VertxTestContext ctx) {
    metrics = new CollectionMetrics(new SimpleMeterRegistry());
    responder = req -> req.response().putHeader("content-type", "application/json").end(VERSIONS_BODY);

    vertx.createHttpServer()
      .requestHandler(req -> responder.handle(req))
      .listen(0, "127.0.0.1")
      .compose(started -> {
        server = started;
        port = started.actualPort();
        return vertx.createHttpServer().requestHandler(req -> req.response().end()).listen(0, "127.0.0.1");
      })
      .compose(spare -> {
        closedPort = spare.actualPort();
        return spare.close();
      })
      .onComplete(ctx.succeedingThenComplete());
  }

  @AfterEach
  void stopServer(VertxTestContext ctx) {
    server.close().onComplete(ctx.succeedingThenComplete());
  }

  private EndpointCollector collector(Vertx vertx, String ports, long requestTimeoutMs) {
    StatsConfig config = StatsConfig.builder()
      .hosts("127.0.0.1")
      .ports(ports)
      .requestTimeoutMs(requestTimeoutMs)
      .parallel(2)
      .build();
    return new EndpointCollector(vertx, config, TargetResolver.resolve(config), metrics);
  }

  @Test
  void collect_parsesResponse(Vertx vertx, VertxTestContext ctx) {
    EndpointCollector collector = collector(vertx, String.valueOf(port), 5_000);

    collector.collect(EndpointKind.VERSIONS)
      .onComplete(ctx.succeeding(pass -> ctx.verify(() -> {
        assertEquals(EndpointKind.VERSIONS, pass.kind());
        assertEquals(1, pass.records().size());
        StoredRecord record = pass.records().get(0);
        assertEquals("127.0.0.1:" + port, record.hostnamePort());
        assertEquals("2.20.1.0", record.field("version_number"));
        assertEquals(pass.timestamp(), record.timestamp());
        assertFalse(record.synthetic());
        assertEquals(1, metrics.fetchCount(EndpointKind.VERSIONS, FetchOutcome.SUCCESS));
        assertEquals(0, metrics.failureCount(EndpointKind.VERSIONS));
        ctx.completeNow();
      })));
  }

  @Test
  void collect_unreachableHost_yieldsSyntheticRecord(Vertx vertx, VertxTestContext ctx) {
    EndpointCollector collector = collector(vertx, port + "," + closedPort, 5_000);

    collector.collect(EndpointKind.VERSIONS)
      .onComplete(ctx.succeeding(pass -> ctx.verify(() -> {
        assertEquals(2, pass.records().size());
        assertFalse(pass.records().get(0).synthetic());
        StoredRecord placeholder = pass.records().get(1);
        assertTrue(placeholder.synthetic());
        assertEquals("127.0.0.1:" + closedPort, placeholder.hostnamePort());
        assertEquals("", placeholder.field("version_number"));
        assertEquals(1, metrics.fetchCount(EndpointKind.VERSIONS, FetchOutcome.UNREACHABLE));
        ctx.completeNow();
      })));
  }

  @Test
  void collect_malformedBody_yieldsSyntheticRecord(Vertx vertx, VertxTestContext ctx) {
    responder = req -> req.response().end("<html>not json</html>");
    EndpointCollector collector = collector(vertx, String.valueOf(port), 5_000);

    collector.collect(EndpointKind.VERSIONS)
      .onComplete(ctx.succeeding(pass -> ctx.verify(() -> {
        assertEquals(1, pass.records().size());
        assertTrue(pass.records().get(0).synthetic());
        assertEquals(1, metrics.fetchCount(EndpointKind.VERSIONS, FetchOutcome.MALFORMED));
        ctx.completeNow();
      })));
  }

  @Test
  void collect_httpError_yieldsSyntheticRecord(Vertx vertx, VertxTestContext ctx) {
    responder = req -> req.response().setStatusCode(500).end("internal error");
    EndpointCollector collector = collector(vertx, String.valueOf(port), 5_000);

    collector.collect(EndpointKind.VERSIONS)
      .onComplete(ctx.succeeding(pass -> ctx.verify(() -> {
        assertTrue(pass.records().get(0).synthetic());
        assertEquals(1, metrics.fetchCount(EndpointKind.VERSIONS, FetchOutcome.HTTP_ERROR));
        ctx.completeNow();
      })));
  }

  @Test
  void collect_slowHost_yieldsSyntheticRecord(Vertx vertx, VertxTestContext ctx) {
    responder = req -> {
      // never answers
    };
    EndpointCollector collector = collector(vertx, String.valueOf(port), 300);

    collector.collect(EndpointKind.VERSIONS)
      .onComplete(ctx.succeeding(pass -> ctx.verify(() -> {
        assertTrue(pass.records().get(0).synthetic());
        assertEquals(1, metrics.failureCount(EndpointKind.VERSIONS));
        ctx.completeNow();
      })));
  }

  @Test
  void collect_requestsKindPath(Vertx vertx, VertxTestContext ctx) {
    StringBuilder seen = new StringBuilder();
    responder = req -> {
      seen.append(req.uri());
      req.response().end("[]");
    };
    StatsConfig config = StatsConfig.builder()
      .hosts("127.0.0.1")
      .masterPorts(String.valueOf(port))
      .tableId("000033e8")
      .build();
    EndpointCollector collector = new EndpointCollector(vertx, config, TargetResolver.resolve(config), metrics);

    collector.collect(EndpointKind.TABLE_DETAIL)
      .onComplete(ctx.succeeding(pass -> ctx.verify(() -> {
        assertEquals("/table?id=000033e8", seen.toString());
        ctx.completeNow();
      })));
  }

  @Test
  void collect_emptyWorkList_yieldsEmptyPass(Vertx vertx, VertxTestContext ctx) {
    StatsConfig config = StatsConfig.builder().hosts("127.0.0.1").ports(String.valueOf(port))
      .hostnameMatch("^nothing$").build();
    EndpointCollector collector = new EndpointCollector(vertx, config, TargetResolver.resolve(config), metrics);

    collector.collect(EndpointKind.VERSIONS)
      .onComplete(ctx.succeeding(pass -> ctx.verify(() -> {
        assertTrue(pass.records().isEmpty());
        ctx.completeNow();
      })));
  }

  @Test
  void isTimeout_ignoresDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    try {
      assertTrue(EndpointCollector.isTimeout(new IllegalStateException("Connection TIMEOUT after 500 ms")));
      assertFalse(EndpointCollector.isTimeout(new IllegalStateException("Connection refused")));
    } finally {
      Locale.setDefault(previous);
    }
  }
}
