package io.github.themoah.ybstats.schema;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a server metric is a gauge. The server JSON does not say, so this
 * relies on known names and name prefixes; everything else is treated as a counter.
 */
public final class GaugeClassifier {

  private static final Set<String> GAUGES = Set.of(
    "threads_running",
    "hybrid_clock_hybrid_time",
    "hybrid_clock_error",
    "generic_current_allocated_bytes",
    "generic_heap_size",
    "block_cache_usage",
    "block_cache_single_touch_usage",
    "block_cache_multi_touch_usage",
    "follower_lag_ms",
    "log_wal_size",
    "log_cache_size",
    "log_cache_num_ops",
    "raft_term",
    "is_raft_leader",
    "ts_live_tablet_peers",
    "total_sst_file_size",
    "rocksdb_current_version_sst_files_size",
    "rocksdb_current_version_sst_files_uncompressed_size",
    "rocksdb_current_version_num_sst_files",
    "rpc_connections_alive",
    "rpc_inbound_calls_alive",
    "rpc_outbound_calls_alive",
    "rpcs_in_queue",
    "rpcs_queue_overflow",
    "active_tablets"
  );

  private static final List<String> GAUGE_PREFIXES = List.of(
    "mem_tracker",
    "tcmalloc_",
    "threads_running_",
    "async_replication_"
  );

  private GaugeClassifier() {}

  public static boolean isGauge(String metricName) {
    if (GAUGES.contains(metricName)) {
      return true;
    }
    for (String prefix : GAUGE_PREFIXES) {
      if (metricName.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
