package io.github.themoah.ybstats.model;

/**
 * One endpoint to fetch from.
 *
 * @param host hostname or address
 * @param port HTTP port
 */
public record HostPort(
  String host,
  int port
) {
  public String hostnamePort() {
    return host + ":" + port;
  }

  @Override
  public String toString() {
    return hostnamePort();
  }
}
