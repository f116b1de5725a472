package com.example.rdsbroker.core.engines;

import static com.example.rdsbroker.core.privileges.PgQuoting.quoteIdentifier;
import static java.lang.System.Logger.Level.DEBUG;

import com.example.rdsbroker.core.credentials.CredentialVault;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Encrypted record of the passwords handed out on one PostgreSQL server.
 *
 * <p>Lives in a dedicated database on the managed server, closed to PUBLIC, with one row per
 * user: {@code (username, encrypted_password, password_storage_version)}.
 */
final class PostgresStateStore implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(PostgresStateStore.class.getName());

  /** Bumped whenever the way passwords are sealed changes. */
  static final String PASSWORD_STORAGE_VERSION = "1.0";

  private static final String DUPLICATE_DATABASE = "42P04";

  private final JdbcSession session;
  private final CredentialVault vault;

  private PostgresStateStore(final JdbcSession session, final CredentialVault vault) {
    this.session = session;
    this.vault = vault;
  }

  /**
   * Ensures the state database and table exist, then opens a session on them.
   *
   * @param admin session on the managed server, in auto-commit mode
   */
  static PostgresStateStore open(
      final JdbcSession admin,
      final DataSourceFactory factory,
      final ConnectionSpec spec,
      final String stateDatabase,
      final CredentialVault vault)
      throws SQLException {
    try {
      admin.execute("CREATE DATABASE " + quoteIdentifier(stateDatabase));
      admin.execute("REVOKE ALL PRIVILEGES ON DATABASE " + quoteIdentifier(stateDatabase) + " FROM PUBLIC");
    } catch (final SQLException e) {
      if (!DUPLICATE_DATABASE.equals(e.getSQLState())) throw e;
      LOGGER.log(DEBUG, "State database {0} already exists", stateDatabase);
    }

    final var target = spec.withDatabase(stateDatabase);
    final var session =
        JdbcSession.open(
            factory, PostgresDriver.connectionUrl(target), target.username(), target.password());
    try {
      session.execute(
          "CREATE TABLE IF NOT EXISTS role (username varchar(128) NOT NULL, encrypted_password"
              + " varchar(128) NOT NULL, password_storage_version varchar(10), PRIMARY KEY(username))");
    } catch (final SQLException e) {
      session.close();
      throw e;
    }
    return new PostgresStateStore(session, vault);
  }

  Optional<String> fetchPassword(final String username) throws SQLException {
    try (final var stmt =
        session.connection().prepareStatement("SELECT encrypted_password FROM role WHERE username = ?")) {
      stmt.setString(1, username);
      try (final var rs = stmt.executeQuery()) {
        if (!rs.next()) return Optional.empty();
        return Optional.of(vault.decrypt(rs.getString(1)));
      }
    }
  }

  void storePassword(final String username, final String password) throws SQLException {
    LOGGER.log(DEBUG, "Storing password of {0}", username);
    try (final var stmt =
        session
            .connection()
            .prepareStatement(
                "INSERT INTO role (username, encrypted_password, password_storage_version)"
                    + " VALUES (?, ?, ?) ON CONFLICT (username) DO UPDATE SET"
                    + " encrypted_password = EXCLUDED.encrypted_password,"
                    + " password_storage_version = EXCLUDED.password_storage_version")) {
      stmt.setString(1, username);
      stmt.setString(2, vault.encrypt(password));
      stmt.setString(3, PASSWORD_STORAGE_VERSION);
      stmt.executeUpdate();
    }
  }

  void delete(final String username) throws SQLException {
    try (final var stmt = session.connection().prepareStatement("DELETE FROM role WHERE username = ?")) {
      stmt.setString(1, username);
      stmt.executeUpdate();
    }
  }

  void clear() throws SQLException {
    session.execute("DELETE FROM role");
  }

  @Override
  public void close() {
    session.close();
  }
}
