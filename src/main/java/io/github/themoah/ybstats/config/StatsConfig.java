package io.github.themoah.ybstats.config;

import io.github.themoah.ybstats.StatsException;
import io.github.themoah.ybstats.model.EndpointKind;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collection and storage settings. Loaded from an optional properties file
 * ({@code ybstats.*} keys) and overridden by {@code YBSTATS_*} environment variables.
 */
public class StatsConfig {

  private static final Logger log = LoggerFactory.getLogger(StatsConfig.class);

  public static final String DEFAULT_CONFIG_FILE = "ybstats.properties";
  private static final String ENV_CONFIG_FILE = "YBSTATS_CONFIG";
  private static final String PROP_PREFIX = "ybstats.";
  private static final String ENV_PREFIX = "YBSTATS_";

  public static final String DEFAULT_HOSTS = "127.0.0.1";
  public static final String DEFAULT_PORTS = "7000,9000,12000,13000";
  public static final String DEFAULT_MASTER_PORTS = "7000";
  public static final String DEFAULT_TSERVER_PORTS = "9000";
  public static final String DEFAULT_YSQL_PORTS = "13000";
  public static final String DEFAULT_NODE_EXPORTER_PORTS = "9300";
  public static final int DEFAULT_PARALLEL = 1;
  public static final long DEFAULT_REQUEST_TIMEOUT_MS = 10_000L;
  public static final long DEFAULT_PROBE_TIMEOUT_MS = 1_000L;
  public static final String DEFAULT_SNAPSHOT_DIRECTORY = "yb_stats.snapshots";

  private final String hosts;
  private final String ports;
  private final String masterPorts;
  private final String tserverPorts;
  private final String ysqlPorts;
  private final String nodeExporterPorts;
  private final int parallel;
  private final long requestTimeoutMs;
  private final long probeTimeoutMs;
  private final boolean https;
  private final boolean silent;
  private final String hostnameMatch;
  private final String tableId;
  private final Path snapshotDirectory;
  private final Set<EndpointKind> disabledKinds;

  private StatsConfig(Builder builder) {
    this.hosts = builder.hosts;
    this.ports = builder.ports;
    this.masterPorts = builder.masterPorts;
    this.tserverPorts = builder.tserverPorts;
    this.ysqlPorts = builder.ysqlPorts;
    this.nodeExporterPorts = builder.nodeExporterPorts;
    this.parallel = builder.parallel;
    this.requestTimeoutMs = builder.requestTimeoutMs;
    this.probeTimeoutMs = builder.probeTimeoutMs;
    this.https = builder.https;
    this.silent = builder.silent;
    this.hostnameMatch = builder.hostnameMatch;
    this.tableId = builder.tableId;
    this.snapshotDirectory = builder.snapshotDirectory;
    this.disabledKinds = Set.copyOf(builder.disabledKinds);
  }

  public String getHosts() {
    return hosts;
  }

  public String getPorts() {
    return ports;
  }

  public String getMasterPorts() {
    return masterPorts;
  }

  public String getTserverPorts() {
    return tserverPorts;
  }

  public String getYsqlPorts() {
    return ysqlPorts;
  }

  public String getNodeExporterPorts() {
    return nodeExporterPorts;
  }

  public int getParallel() {
    return parallel;
  }

  public long getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  public long getProbeTimeoutMs() {
    return probeTimeoutMs;
  }

  public boolean isHttps() {
    return https;
  }

  /**
   * When set, per-host warnings are logged at debug level.
   */
  public boolean isSilent() {
    return silent;
  }

  public String getHostnameMatch() {
    return hostnameMatch;
  }

  public String getTableId() {
    return tableId;
  }

  public Path getSnapshotDirectory() {
    return snapshotDirectory;
  }

  public Set<EndpointKind> getDisabledKinds() {
    return disabledKinds;
  }

  public boolean isEnabled(EndpointKind kind) {
    return !disabledKinds.contains(kind);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the properties file named by {@code YBSTATS_CONFIG} (or {@value #DEFAULT_CONFIG_FILE}
   * from the classpath when present), then applies the environment on top.
   *
   * @throws IOException if an explicitly named file cannot be read
   */
  public static StatsConfig load() throws IOException {
    Map<String, String> env = System.getenv();
    Properties props = new Properties();

    String file = env.get(ENV_CONFIG_FILE);
    if (file != null && !file.isBlank()) {
      log.info("Loading configuration from file: {}", file);
      try (InputStream is = Files.newInputStream(Path.of(file))) {
        props.load(is);
      }
    } else {
      try (InputStream is = StatsConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
        if (is != null) {
          log.info("Loading configuration from classpath: {}", DEFAULT_CONFIG_FILE);
          props.load(is);
        }
      }
    }
    return fromSources(props, env);
  }

  /**
   * Builds configuration from properties, with environment variables taking precedence.
   * Property {@code ybstats.request.timeout.ms} corresponds to {@code YBSTATS_REQUEST_TIMEOUT_MS}.
   *
   * @param props properties with {@code ybstats.*} keys
   * @param env environment variables
   * @return the configuration
   */
  public static StatsConfig fromSources(Properties props, Map<String, String> env) {
    Builder builder = builder();
    Source source = new Source(props, env);

    source.get("hosts").ifPresent(builder::hosts);
    source.get("ports").ifPresent(builder::ports);
    source.get("master.ports").ifPresent(builder::masterPorts);
    source.get("tserver.ports").ifPresent(builder::tserverPorts);
    source.get("ysql.ports").ifPresent(builder::ysqlPorts);
    source.get("node.exporter.ports").ifPresent(builder::nodeExporterPorts);
    source.get("parallel").ifPresent(value -> builder.parallel(parseInt("parallel", value, DEFAULT_PARALLEL)));
    source.get("request.timeout.ms").ifPresent(value ->
      builder.requestTimeoutMs(parseLong("request.timeout.ms", value, DEFAULT_REQUEST_TIMEOUT_MS)));
    source.get("probe.timeout.ms").ifPresent(value ->
      builder.probeTimeoutMs(parseLong("probe.timeout.ms", value, DEFAULT_PROBE_TIMEOUT_MS)));
    source.get("https").ifPresent(value -> builder.https(Boolean.parseBoolean(value)));
    source.get("silent").ifPresent(value -> builder.silent(Boolean.parseBoolean(value)));
    source.get("hostname.match").ifPresent(builder::hostnameMatch);
    source.get("table.id").ifPresent(builder::tableId);
    source.get("snapshot.dir").ifPresent(value -> builder.snapshotDirectory(Path.of(value)));
    source.get("disabled.kinds").ifPresent(value -> Arrays.stream(value.split(","))
      .map(String::trim)
      .filter(name -> !name.isEmpty())
      .forEach(name -> builder.disableKind(parseKind(name))));

    StatsConfig config = builder.build();
    log.debug("Configuration loaded: hosts={}, ports={}, parallel={}, snapshotDirectory={}",
      config.hosts, config.ports, config.parallel, config.snapshotDirectory);
    return config;
  }

  private static EndpointKind parseKind(String name) {
    try {
      return EndpointKind.fromName(name);
    } catch (IllegalArgumentException e) {
      throw new StatsException("Invalid disabled.kinds entry: " + e.getMessage(), e);
    }
  }

  private static int parseInt(String name, String value, int defaultValue) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  private static long parseLong(String name, String value, long defaultValue) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  /**
   * Looks a setting up in the environment first, then in the properties.
   */
  private record Source(Properties props, Map<String, String> env) {

    Optional<String> get(String key) {
      String envName = ENV_PREFIX + key.replace('.', '_').toUpperCase(Locale.ROOT);
      String value = env.get(envName);
      if (value == null || value.isBlank()) {
        value = props.getProperty(PROP_PREFIX + key);
      }
      return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
  }

  public static class Builder {

    private String hosts = DEFAULT_HOSTS;
    private String ports = DEFAULT_PORTS;
    private String masterPorts = DEFAULT_MASTER_PORTS;
    private String tserverPorts = DEFAULT_TSERVER_PORTS;
    private String ysqlPorts = DEFAULT_YSQL_PORTS;
    private String nodeExporterPorts = DEFAULT_NODE_EXPORTER_PORTS;
    private int parallel = DEFAULT_PARALLEL;
    private long requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    private long probeTimeoutMs = DEFAULT_PROBE_TIMEOUT_MS;
    private boolean https;
    private boolean silent;
    private String hostnameMatch = "";
    private String tableId = "";
    private Path snapshotDirectory = Path.of(DEFAULT_SNAPSHOT_DIRECTORY);
    private final Set<EndpointKind> disabledKinds = EnumSet.noneOf(EndpointKind.class);

    public Builder hosts(String hosts) {
      this.hosts = Objects.requireNonNull(hosts, "hosts cannot be null");
      return this;
    }

    public Builder ports(String ports) {
      this.ports = Objects.requireNonNull(ports, "ports cannot be null");
      return this;
    }

    public Builder masterPorts(String masterPorts) {
      this.masterPorts = Objects.requireNonNull(masterPorts, "masterPorts cannot be null");
      return this;
    }

    public Builder tserverPorts(String tserverPorts) {
      this.tserverPorts = Objects.requireNonNull(tserverPorts, "tserverPorts cannot be null");
      return this;
    }

    public Builder ysqlPorts(String ysqlPorts) {
      this.ysqlPorts = Objects.requireNonNull(ysqlPorts, "ysqlPorts cannot be null");
      return this;
    }

    public Builder nodeExporterPorts(String nodeExporterPorts) {
      this.nodeExporterPorts = Objects.requireNonNull(nodeExporterPorts, "nodeExporterPorts cannot be null");
      return this;
    }

    public Builder parallel(int parallel) {
      this.parallel = parallel;
      return this;
    }

    public Builder requestTimeoutMs(long requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    public Builder probeTimeoutMs(long probeTimeoutMs) {
      this.probeTimeoutMs = probeTimeoutMs;
      return this;
    }

    public Builder https(boolean https) {
      this.https = https;
      return this;
    }

    public Builder silent(boolean silent) {
      this.silent = silent;
      return this;
    }

    public Builder hostnameMatch(String hostnameMatch) {
      this.hostnameMatch = Objects.requireNonNull(hostnameMatch, "hostnameMatch cannot be null");
      return this;
    }

    public Builder tableId(String tableId) {
      this.tableId = Objects.requireNonNull(tableId, "tableId cannot be null");
      return this;
    }

    public Builder snapshotDirectory(Path snapshotDirectory) {
      this.snapshotDirectory = Objects.requireNonNull(snapshotDirectory, "snapshotDirectory cannot be null");
      return this;
    }

    public Builder disableKind(EndpointKind kind) {
      this.disabledKinds.add(kind);
      return this;
    }

    public StatsConfig build() {
      return new StatsConfig(this);
    }
  }
}
