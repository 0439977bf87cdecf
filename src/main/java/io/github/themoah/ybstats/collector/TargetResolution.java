package io.github.themoah.ybstats.collector;

import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.HostPort;
import io.github.themoah.ybstats.model.PortScope;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolved collection targets, and the options that were explicitly set away from
 * their defaults.
 *
 * @param hosts hosts in configured order
 * @param portsByScope ports per port scope
 * @param parallel maximum number of concurrent fetches in one pass, at least 1
 * @param hostnamePattern filter on host:port, null to keep every endpoint
 * @param tableId table id for table detail, empty when not configured
 * @param overrides option name to value for hosts, ports and parallel when they differ from defaults
 */
public record TargetResolution(
  List<String> hosts,
  Map<PortScope, List<Integer>> portsByScope,
  int parallel,
  Pattern hostnamePattern,
  String tableId,
  Map<String, String> overrides
) {

  public TargetResolution {
    hosts = List.copyOf(hosts);
    portsByScope = Map.copyOf(portsByScope);
    overrides = Map.copyOf(overrides);
  }

  /**
   * Builds the work list of a kind: every configured host crossed with the ports of the
   * kind's scope, minus endpoints the hostname filter rejects.
   */
  public List<HostPort> workList(EndpointKind kind) {
    if (kind == EndpointKind.TABLE_DETAIL && tableId.isBlank()) {
      return List.of();
    }
    List<HostPort> work = new ArrayList<>();
    for (String host : hosts) {
      for (int port : portsByScope.getOrDefault(kind.portScope(), List.of())) {
        HostPort target = new HostPort(host, port);
        if (matchesHostname(target.hostnamePort())) {
          work.add(target);
        }
      }
    }
    return work;
  }

  /**
   * Path to request for a kind, including the table id for table detail.
   */
  public String requestPath(EndpointKind kind) {
    if (kind == EndpointKind.TABLE_DETAIL) {
      return kind.path() + tableId;
    }
    return kind.path();
  }

  public boolean matchesHostname(String hostnamePort) {
    return hostnamePattern == null || hostnamePattern.matcher(hostnamePort).find();
  }
}
