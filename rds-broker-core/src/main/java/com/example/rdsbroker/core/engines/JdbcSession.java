package com.example.rdsbroker.core.engines;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * One administrative connection held for the lifetime of a driver session.
 *
 * <p>Not thread-safe: a driver session belongs to a single caller.
 */
final class JdbcSession implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(JdbcSession.class.getName());

  /**
   * Unit of work executed against an open {@link Connection}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface DbOperation<T> {
    T execute(Connection conn) throws SQLException;
  }

  private final DataSource dataSource;
  private final Connection connection;

  private JdbcSession(final DataSource dataSource, final Connection connection) {
    this.dataSource = dataSource;
    this.connection = connection;
  }

  /**
   * Creates the data source and checks out the session's connection.
   *
   * @throws RuntimeException as thrown by the factory, e.g. a pool that failed to start
   * @throws SQLException when the connection cannot be obtained
   */
  static JdbcSession open(
      final DataSourceFactory factory,
      final String jdbcUrl,
      final String username,
      final String password)
      throws SQLException {
    LOGGER.log(DEBUG, "Opening {0} as {1}", jdbcUrl, username);
    final var dataSource = Objects.requireNonNull(factory.create(jdbcUrl, username, password));
    try {
      return new JdbcSession(dataSource, dataSource.getConnection());
    } catch (final SQLException | RuntimeException e) {
      closeQuietly(dataSource);
      throw e;
    }
  }

  Connection connection() {
    return connection;
  }

  void execute(final String sql) throws SQLException {
    execute(sql, sql);
  }

  /** Executes {@code sql}, logging {@code loggable} instead when it contains secrets. */
  void execute(final String sql, final String loggable) throws SQLException {
    LOGGER.log(DEBUG, "Executing: {0}", loggable);
    try (final var stmt = connection.createStatement()) {
      stmt.execute(sql);
    }
  }

  int queryInt(final String sql) throws SQLException {
    try (final var stmt = connection.createStatement();
        final var rs = stmt.executeQuery(sql)) {
      if (!rs.next()) throw new SQLException("no row returned by: " + sql);
      return rs.getInt(1);
    }
  }

  List<String> queryStrings(final String sql) throws SQLException {
    final var result = new ArrayList<String>();
    try (final var stmt = connection.createStatement();
        final var rs = stmt.executeQuery(sql)) {
      while (rs.next()) result.add(rs.getString(1));
    }
    return result;
  }

  boolean exists(final String sql, final String param) throws SQLException {
    try (final var stmt = connection.prepareStatement(sql)) {
      stmt.setString(1, param);
      try (final var rs = stmt.executeQuery()) {
        return rs.next() && rs.getBoolean(1);
      }
    }
  }

  /** Runs {@code work} in a local transaction, rolling back on any failure. */
  <T> T inTransaction(final DbOperation<T> work) throws SQLException {
    connection.setAutoCommit(false);
    try {
      final var result = work.execute(connection);
      connection.commit();
      return result;
    } catch (final SQLException | RuntimeException e) {
      try {
        connection.rollback();
      } catch (final SQLException rollback) {
        e.addSuppressed(rollback);
      }
      throw e;
    } finally {
      connection.setAutoCommit(true);
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (final SQLException e) {
      LOGGER.log(WARNING, "Failed to close connection: {0}", e.getMessage());
    }
    closeQuietly(dataSource);
  }

  private static void closeQuietly(final DataSource dataSource) {
    if (dataSource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (final Exception e) {
        LOGGER.log(WARNING, "Failed to close data source: {0}", e.getMessage());
      }
    }
  }
}
