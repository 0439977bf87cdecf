package io.github.themoah.ybstats.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for the Micrometer registry that instruments a run.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private MicrometerConfig() {}

  /**
   * Creates an in-process registry; a command line run has no scrape endpoint, the
   * totals are written to the log when the run ends.
   */
  public static MeterRegistry createRegistry() {
    log.debug("Creating simple meter registry");
    return new SimpleMeterRegistry();
  }
}
