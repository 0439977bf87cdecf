package io.github.themoah.ybstats.schema;

import io.github.themoah.ybstats.model.EndpointKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The schema of every endpoint kind. Kinds differ only in this data; collection,
 * storage and comparison are shared.
 */
public final class KindSchemas {

  private static final Map<EndpointKind, RecordSchema> SCHEMAS = new EnumMap<>(EndpointKind.class);

  static {
    SCHEMAS.put(EndpointKind.METRICS, metricSchema(new MetricsJsonFlattener()));
    SCHEMAS.put(EndpointKind.NODE_EXPORTER, metricSchema(new PrometheusTextFlattener()));
    SCHEMAS.put(EndpointKind.STATEMENTS, metricSchema(new StatementsFlattener()));

    SCHEMAS.put(EndpointKind.ENTITIES, new RecordSchema(
      List.of("entity_type", "entity_id", "parent_id", "name", "state", "leader", "detail"),
      List.of("entity_type", "entity_id"),
      "name", "name",
      new CompositeFlattener(List.of(
        JsonRowsFlattener.array("/keyspaces").optional()
          .constant("entity_type", "keyspace")
          .column("entity_id", "/keyspace_id")
          .column("name", "/keyspace_name")
          .column("detail", "/keyspace_type")
          .build(),
        JsonRowsFlattener.array("/tables").optional()
          .constant("entity_type", "table")
          .column("entity_id", "/table_id")
          .column("parent_id", "/keyspace_id")
          .column("name", "/table_name")
          .column("state", "/state")
          .build(),
        JsonRowsFlattener.array("/tablets").optional()
          .constant("entity_type", "tablet")
          .column("entity_id", "/tablet_id")
          .column("parent_id", "/table_id")
          .column("state", "/state")
          .column("leader", "/leader")
          .column("detail", "/replicas")
          .build()
      ))));

    SCHEMAS.put(EndpointKind.MASTERS, new RecordSchema(
      List.of("permanent_uuid", "instance_seqno", "start_time_us", "role", "private_rpc_addresses",
        "http_addresses", "placement_cloud", "placement_region", "placement_zone", "placement_uuid", "error"),
      List.of("permanent_uuid"),
      "role", null,
      JsonRowsFlattener.array("/masters")
        .column("permanent_uuid", "/instance_id/permanent_uuid")
        .column("instance_seqno", "/instance_id/instance_seqno")
        .column("start_time_us", "/instance_id/start_time_us")
        .column("role")
        .column("private_rpc_addresses", "/registration/private_rpc_addresses")
        .column("http_addresses", "/registration/http_addresses")
        .column("placement_cloud", "/registration/cloud_info/placement_cloud")
        .column("placement_region", "/registration/cloud_info/placement_region")
        .column("placement_zone", "/registration/cloud_info/placement_zone")
        .column("placement_uuid", "/registration/placement_uuid")
        .column("error")
        .build()));

    List<String> tabletServerColumns = List.of("time_since_hb", "time_since_hb_sec", "status",
      "uptime_seconds", "ram_used_bytes", "num_sst_files", "total_sst_file_size_bytes",
      "uncompressed_sst_file_size_bytes", "read_ops_per_sec", "write_ops_per_sec", "user_tablets_total",
      "user_tablets_leaders", "system_tablets_total", "system_tablets_leaders", "active_tablets",
      "cloud", "region", "zone");
    JsonRowsFlattener.Builder tabletServers = JsonRowsFlattener.nestedEntries("", "placement_uuid", "server");
    tabletServerColumns.forEach(tabletServers::column);
    SCHEMAS.put(EndpointKind.TABLET_SERVERS, new RecordSchema(
      concat(List.of("placement_uuid", "server"), tabletServerColumns),
      List.of("server"),
      "server", null,
      tabletServers.build()));

    List<String> versionColumns = List.of("git_hash", "build_hostname", "build_timestamp", "build_username",
      "build_clean_repo", "build_id", "build_type", "version_number", "build_number");
    JsonRowsFlattener.Builder versions = JsonRowsFlattener.single();
    versionColumns.forEach(versions::column);
    SCHEMAS.put(EndpointKind.VERSIONS, new RecordSchema(
      versionColumns, List.of(), "version_number", null, versions.build()));

    SCHEMAS.put(EndpointKind.VARS, new RecordSchema(
      List.of("name", "value", "type"),
      List.of("name"),
      "name", null,
      JsonRowsFlattener.array("/flags").column("name").column("value").column("type").build()));

    SCHEMAS.put(EndpointKind.GFLAGS, new RecordSchema(
      List.of("name", "value"), List.of("name"), "name", null, new GflagsFlattener()));

    SCHEMAS.put(EndpointKind.CLUSTER_CONFIG, new RecordSchema(
      List.of("cluster_uuid", "version", "replication_info", "server_blacklist", "encryption_info"),
      List.of(),
      null, null,
      JsonRowsFlattener.single()
        .column("cluster_uuid")
        .column("version")
        .column("replication_info")
        .column("server_blacklist")
        .column("encryption_info")
        .build()));

    SCHEMAS.put(EndpointKind.HEALTH_CHECK, new RecordSchema(
      List.of("dead_nodes", "most_recent_uptime", "under_replicated_tablets", "leaderless_tablets"),
      List.of(),
      null, null,
      JsonRowsFlattener.single()
        .column("dead_nodes")
        .column("most_recent_uptime")
        .column("under_replicated_tablets")
        .column("leaderless_tablets")
        .build()));

    SCHEMAS.put(EndpointKind.RPCS, new RecordSchema(
      List.of("direction", "remote_ip", "state", "processed_call_count", "calls_in_flight", "detail"),
      List.of("direction", "remote_ip"),
      "state", null,
      new CompositeFlattener(List.of(
        JsonRowsFlattener.array("/inbound_connections").optional()
          .constant("direction", "inbound")
          .column("remote_ip").column("state").column("processed_call_count").column("calls_in_flight")
          .build(),
        JsonRowsFlattener.array("/outbound_connections").optional()
          .constant("direction", "outbound")
          .column("remote_ip").column("state").column("processed_call_count").column("calls_in_flight")
          .build(),
        JsonRowsFlattener.array("/connections").optional()
          .constant("direction", "ysql")
          .column("remote_ip", "/host")
          .column("state", "/backend_status")
          .column("detail", "/query")
          .build()
      ))));

    html(EndpointKind.THREADS, List.of("thread_name", "cumulative_user_cpu_s", "cumulative_kernel_cpu_s",
      "cumulative_iowait_cpu_s", "stack"), List.of("thread_name"), "thread_name", null);
    html(EndpointKind.DRIVES, List.of("path", "used_space", "total_space"), List.of("path"), "path", null);
    html(EndpointKind.TABLET_SERVER_OPERATIONS, List.of("tablet_id", "op_id", "transaction_type",
      "total_time_in_flight", "description"), List.of("tablet_id", "op_id"), "transaction_type", null);
    html(EndpointKind.MASTER_TASKS, List.of("task_name", "state", "start_time", "duration", "description"),
      List.of("task_name", "start_time"), "task_name", null);
    html(EndpointKind.TABLE_DETAIL, List.of("tablet_id", "partition", "split_depth", "state", "hidden",
      "message", "raft_config"), List.of("tablet_id"), "state", null);
    html(EndpointKind.TABLET_DETAIL, List.of("namespace", "table_name", "table_uuid", "tablet_id", "partition",
      "state", "hidden", "num_sst_files", "on_disk_size", "raft_config", "last_status"),
      List.of("tablet_id"), "state", "table_name");
    html(EndpointKind.CLOCKS, List.of("server", "time_since_heartbeat", "physical_time_utc", "hybrid_time_utc",
      "heartbeat_rtt", "cloud", "region", "zone"), List.of("server"), "server", null);

    SCHEMAS.put(EndpointKind.LOGS, new RecordSchema(
      List.of("severity", "log_time", "thread_id", "source", "message"),
      List.of("log_time", "thread_id", "source"),
      "source", null,
      new LogLinesFlattener()));
  }

  private KindSchemas() {}

  /**
   * Returns the schema of a kind.
   */
  public static RecordSchema forKind(EndpointKind kind) {
    RecordSchema schema = SCHEMAS.get(kind);
    if (schema == null) {
      throw new IllegalStateException("No schema registered for " + kind);
    }
    return schema;
  }

  private static RecordSchema metricSchema(RecordFlattener flattener) {
    return new RecordSchema(MetricColumns.ALL, MetricColumns.KEY,
      MetricColumns.METRIC_NAME, MetricColumns.TABLE_NAME, flattener);
  }

  private static void html(EndpointKind kind, List<String> columns, List<String> keys,
      String nameColumn, String tableColumn) {
    SCHEMAS.put(kind, new RecordSchema(columns, keys, nameColumn, tableColumn, new HtmlTableFlattener(columns)));
  }

  private static List<String> concat(List<String> first, List<String> second) {
    return Stream.concat(first.stream(), second.stream()).collect(Collectors.toList());
  }
}
