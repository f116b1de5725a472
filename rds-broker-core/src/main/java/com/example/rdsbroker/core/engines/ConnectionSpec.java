package com.example.rdsbroker.core.engines;

import java.util.Objects;

/**
 * Where and as whom an engine driver connects.
 *
 * @param host server host name
 * @param port server port
 * @param database database to connect to
 * @param username login
 * @param password password
 * @param requireTls whether the connection must be encrypted
 */
public record ConnectionSpec(
    String host, int port, String database, String username, String password, boolean requireTls) {

  public ConnectionSpec {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    if (port <= 0 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
  }

  /** Same server and login, different database. */
  public ConnectionSpec withDatabase(final String otherDatabase) {
    return new ConnectionSpec(host, port, otherDatabase, username, password, requireTls);
  }

  @Override
  public String toString() {
    return "ConnectionSpec[host="
        + host
        + ", port="
        + port
        + ", database="
        + database
        + ", username="
        + username
        + ", password=REDACTED, requireTls="
        + requireTls
        + "]";
  }
}
