package io.github.themoah.ybstats;

import io.github.themoah.ybstats.config.ReportOptions;
import io.github.themoah.ybstats.config.StatsConfig;
import io.github.themoah.ybstats.config.VertxConfig;
import io.github.themoah.ybstats.metrics.CollectionMetrics;
import io.github.themoah.ybstats.metrics.MicrometerConfig;
import io.vertx.core.Vertx;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: {@code ybstats <operation> [arguments]}.
 * Reports go to standard output, logging and errors to standard error.
 */
public class YbStatsLauncher {

  private static final Logger log = LoggerFactory.getLogger(YbStatsLauncher.class);

  public static void main(String[] args) {
    Command command;
    StatsConfig config;
    try {
      command = Command.parse(args);
      config = StatsConfig.load();
    } catch (StatsException e) {
      log.error(e.getMessage());
      System.exit(1);
      return;
    } catch (IOException e) {
      log.error("Cannot read configuration: {}", e.getMessage());
      System.exit(1);
      return;
    }

    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions());
    CollectionMetrics metrics = new CollectionMetrics(MicrometerConfig.createRegistry());

    StatsService service;
    try {
      service = StatsService.create(vertx, config, ReportOptions.fromEnvironment(), metrics,
        AdhocTrigger.enterKey(vertx, System.in, System.err), System.out);
    } catch (StatsException e) {
      log.error(e.getMessage());
      vertx.close().onComplete(v -> System.exit(1));
      return;
    }

    log.debug("Running {}", command.operation().command());
    service.run(command)
      .eventually(v -> service.close())
      .onComplete(ar -> {
        metrics.logSummary();
        int status = 0;
        if (ar.failed()) {
          Throwable err = ar.cause();
          if (err instanceof StatsException) {
            log.error(err.getMessage());
          } else {
            log.error("{} failed", command.operation().command(), err);
          }
          status = 1;
        }
        System.out.flush();
        int exitCode = status;
        vertx.close().onComplete(v -> System.exit(exitCode));
      });
  }
}
