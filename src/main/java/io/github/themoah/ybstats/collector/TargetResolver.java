package io.github.themoah.ybstats.collector;

import io.github.themoah.ybstats.StatsException;
import io.github.themoah.ybstats.config.StatsConfig;
import io.github.themoah.ybstats.model.PortScope;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the configured host, port and parallelism settings into a {@link TargetResolution}.
 */
public final class TargetResolver {

  private static final Logger log = LoggerFactory.getLogger(TargetResolver.class);

  private TargetResolver() {}

  /**
   * Resolves the targets of a configuration.
   *
   * @throws StatsException if a port is not a number or the hostname filter is not a valid regex
   */
  public static TargetResolution resolve(StatsConfig config) {
    List<String> hosts = splitList(config.getHosts());

    Map<PortScope, List<Integer>> ports = new EnumMap<>(PortScope.class);
    ports.put(PortScope.ALL, parsePorts(config.getPorts()));
    ports.put(PortScope.MASTER, parsePorts(config.getMasterPorts()));
    ports.put(PortScope.TSERVER, parsePorts(config.getTserverPorts()));
    ports.put(PortScope.YSQL, parsePorts(config.getYsqlPorts()));
    ports.put(PortScope.NODE_EXPORTER, parsePorts(config.getNodeExporterPorts()));
    Set<Integer> servers = new LinkedHashSet<>(ports.get(PortScope.MASTER));
    servers.addAll(ports.get(PortScope.TSERVER));
    ports.put(PortScope.SERVERS, new ArrayList<>(servers));

    int parallel = config.getParallel();
    if (parallel < 1) {
      log.warn("Parallelism must be >= 1, got {}, using 1", parallel);
      parallel = 1;
    }

    Map<String, String> overrides = new LinkedHashMap<>();
    if (!config.getHosts().equals(StatsConfig.DEFAULT_HOSTS)) {
      overrides.put("hosts", config.getHosts());
    }
    if (!config.getPorts().equals(StatsConfig.DEFAULT_PORTS)) {
      overrides.put("ports", config.getPorts());
    }
    if (parallel != StatsConfig.DEFAULT_PARALLEL) {
      overrides.put("parallel", String.valueOf(parallel));
    }

    TargetResolution resolution = new TargetResolution(
      hosts, ports, parallel, compileHostnamePattern(config.getHostnameMatch()), config.getTableId(), overrides);
    log.debug("Resolved {} hosts, ports {}, parallel {}", hosts.size(), ports, parallel);
    return resolution;
  }

  private static List<String> splitList(String value) {
    List<String> items = new ArrayList<>();
    for (String item : value.split(",")) {
      String trimmed = item.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }

  private static List<Integer> parsePorts(String value) {
    List<Integer> ports = new ArrayList<>();
    for (String item : splitList(value)) {
      try {
        int port = Integer.parseInt(item);
        if (port < 1 || port > 65535) {
          throw new StatsException("Port out of range: " + item);
        }
        ports.add(port);
      } catch (NumberFormatException e) {
        throw new StatsException("Invalid port number: " + item, e);
      }
    }
    return ports;
  }

  private static Pattern compileHostnamePattern(String regex) {
    if (regex == null || regex.isBlank()) {
      return null;
    }
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new StatsException("Invalid hostname match regex: " + regex, e);
    }
  }
}
