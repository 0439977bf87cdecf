package io.github.themoah.ybstats.config;

import io.vertx.core.VertxOptions;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x runtime options for a collection run.
 * The event loop pool size can be set via YBSTATS_EVENT_LOOPS.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_EVENT_LOOPS = "YBSTATS_EVENT_LOOPS";

  // The adhoc diff parks a worker until the user presses enter.
  private static final long MAX_WORKER_EXECUTE_HOURS = 24;

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    options.setMaxWorkerExecuteTime(MAX_WORKER_EXECUTE_HOURS);
    options.setMaxWorkerExecuteTimeUnit(TimeUnit.HOURS);

    Integer eventLoops = eventLoopPoolSize();
    if (eventLoops != null) {
      log.debug("Using {} event loop threads", eventLoops);
      options.setEventLoopPoolSize(eventLoops);
    }
    return options;
  }

  static Integer eventLoopPoolSize() {
    String value = System.getenv(ENV_EVENT_LOOPS);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      int size = Integer.parseInt(value);
      return size > 0 ? size : null;
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using the Vert.x default", ENV_EVENT_LOOPS, value);
      return null;
    }
  }
}
