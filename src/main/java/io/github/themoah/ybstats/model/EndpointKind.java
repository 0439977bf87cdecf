package io.github.themoah.ybstats.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The categories of diagnostic data exposed by the HTTP interface of a cluster node.
 * Each constant carries the data needed to fetch, store and compare it.
 */
public enum EndpointKind {
  METRICS("metrics", "/metrics", PortScope.ALL, RecordShape.METRIC),
  ENTITIES("entities", "/dump-entities", PortScope.MASTER, RecordShape.STRUCTURED),
  MASTERS("masters", "/api/v1/masters", PortScope.MASTER, RecordShape.STRUCTURED),
  TABLET_SERVERS("tablet_servers", "/api/v1/tablet-servers", PortScope.MASTER, RecordShape.STRUCTURED),
  VERSIONS("versions", "/api/v1/version", PortScope.ALL, RecordShape.STRUCTURED),
  VARS("vars", "/api/v1/varz", PortScope.SERVERS, RecordShape.STRUCTURED),
  NODE_EXPORTER("node_exporter", "/metrics", PortScope.NODE_EXPORTER, RecordShape.METRIC),
  STATEMENTS("statements", "/statements", PortScope.YSQL, RecordShape.METRIC),
  THREADS("threads", "/threadz?group=all", PortScope.SERVERS, RecordShape.STRUCTURED),
  GFLAGS("gflags", "/varz?raw", PortScope.SERVERS, RecordShape.STRUCTURED),
  CLUSTER_CONFIG("cluster_config", "/api/v1/cluster-config", PortScope.MASTER, RecordShape.STRUCTURED),
  HEALTH_CHECK("health_check", "/api/v1/health-check", PortScope.MASTER, RecordShape.STRUCTURED),
  DRIVES("drives", "/drives", PortScope.SERVERS, RecordShape.STRUCTURED),
  TABLET_SERVER_OPERATIONS("tablet_server_operations", "/operations", PortScope.TSERVER, RecordShape.STRUCTURED),
  MASTER_TASKS("master_tasks", "/tasks", PortScope.MASTER, RecordShape.STRUCTURED),
  TABLE_DETAIL("table_detail", "/table?id=", PortScope.MASTER, RecordShape.STRUCTURED),
  TABLET_DETAIL("tablet_detail", "/tablets", PortScope.TSERVER, RecordShape.STRUCTURED),
  LOGS("logs", "/logs?raw", PortScope.SERVERS, RecordShape.STRUCTURED),
  RPCS("rpcs", "/rpcz", PortScope.ALL, RecordShape.STRUCTURED),
  CLOCKS("clocks", "/tablet-server-clocks", PortScope.MASTER, RecordShape.STRUCTURED);

  private final String fileName;
  private final String path;
  private final PortScope portScope;
  private final RecordShape shape;

  EndpointKind(String fileName, String path, PortScope portScope, RecordShape shape) {
    this.fileName = fileName;
    this.path = path;
    this.portScope = portScope;
    this.shape = shape;
  }

  /**
   * Name of the file holding this kind inside a snapshot directory.
   */
  public String fileName() {
    return fileName;
  }

  public String path() {
    return path;
  }

  public PortScope portScope() {
    return portScope;
  }

  public RecordShape shape() {
    return shape;
  }

  public boolean isMetric() {
    return shape == RecordShape.METRIC;
  }

  /**
   * Looks up a kind by file name or constant name, ignoring case and accepting dashes.
   *
   * @param name the name to resolve, e.g. "tablet-servers"
   * @return the matching kind
   * @throws IllegalArgumentException if no kind matches
   */
  public static EndpointKind fromName(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (EndpointKind kind : values()) {
      if (kind.fileName.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown endpoint kind: " + name
      + ", expected one of " + Arrays.stream(values()).map(EndpointKind::fileName).collect(Collectors.joining(",")));
  }

  public static List<EndpointKind> ofShape(RecordShape shape) {
    return Arrays.stream(values())
      .filter(kind -> kind.shape == shape)
      .collect(Collectors.toList());
  }
}
