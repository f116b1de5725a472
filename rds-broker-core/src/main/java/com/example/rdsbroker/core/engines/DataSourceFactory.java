package com.example.rdsbroker.core.engines;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;

/**
 * Creates the {@link DataSource} an engine driver administers a server through. Implementations
 * typically configure a small connection pool.
 */
@FunctionalInterface
public interface DataSourceFactory {

  /**
   * Creates a new {@link DataSource}.
   *
   * @param jdbcUrl JDBC URL without credentials
   * @param username login
   * @param password password
   * @return a new {@link DataSource}; closed by the driver if it is {@link AutoCloseable}
   */
  DataSource create(String jdbcUrl, String username, String password);

  /** HikariCP pool of at most two connections that fails fast on a bad login. */
  static DataSourceFactory hikari(final String poolName) {
    return (jdbcUrl, username, password) -> {
      final var cfg = new HikariConfig();
      cfg.setJdbcUrl(jdbcUrl);
      cfg.setUsername(username);
      cfg.setPassword(password);
      cfg.setMaximumPoolSize(2);
      cfg.setMinimumIdle(0);
      cfg.setInitializationFailTimeout(1);
      cfg.setPoolName(poolName);
      return new HikariDataSource(cfg);
    };
  }
}
