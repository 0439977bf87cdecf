package io.github.themoah.ybstats.model;

/**
 * Which configured port list an endpoint kind is fetched from.
 */
public enum PortScope {
  ALL,
  SERVERS,
  MASTER,
  TSERVER,
  YSQL,
  NODE_EXPORTER
}
