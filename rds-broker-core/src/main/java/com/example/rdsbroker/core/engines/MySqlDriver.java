package com.example.rdsbroker.core.engines;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.rdsbroker.core.credentials.Credential;
import com.example.rdsbroker.core.credentials.CredentialVault;
import com.example.rdsbroker.core.errors.ValidationException;
import java.sql.SQLException;
import java.util.Objects;

/**
 * MySQL and MariaDB driver.
 *
 * <p>Bindings become {@code 'user'@'%'} accounts granted a fixed privilege list on the bound
 * database. No passwords are kept: re-creating an existing user resets its password.
 */
public final class MySqlDriver implements EngineDriver {

  private static final System.Logger LOGGER = System.getLogger(MySqlDriver.class.getName());

  static final int ER_CANNOT_USER = 1396;

  static final String PRIVILEGES =
      "SELECT, INSERT, UPDATE, DELETE, CREATE, DROP, REFERENCES, INDEX, ALTER,"
          + " CREATE TEMPORARY TABLES, LOCK TABLES, EXECUTE, CREATE VIEW, SHOW VIEW, CREATE ROUTINE,"
          + " ALTER ROUTINE, EVENT, TRIGGER";

  private final DataSourceFactory factory;
  private final CredentialVault vault;

  private ConnectionSpec spec;
  private JdbcSession session;

  public MySqlDriver(final DataSourceFactory factory, final CredentialVault vault) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.vault = Objects.requireNonNull(vault, "vault");
  }

  static String connectionUrl(final ConnectionSpec spec) {
    return String.format(
        "jdbc:mysql://%s:%d/%s?sslMode=%s",
        spec.host(), spec.port(), spec.database(), spec.requireTls() ? "REQUIRED" : "PREFERRED");
  }

  @Override
  public void open(final ConnectionSpec spec) {
    close();
    try {
      final var opened =
          JdbcSession.open(factory, connectionUrl(spec), spec.username(), spec.password());
      try {
        // quoted literals below rely on backslashes being ordinary characters
        opened.execute("SET SESSION sql_mode = 'NO_BACKSLASH_ESCAPES'");
      } catch (final SQLException e) {
        opened.close();
        throw e;
      }
      this.session = opened;
      this.spec = spec;
    } catch (final SQLException | RuntimeException e) {
      throw SqlErrors.onOpen(spec.username(), e);
    }
  }

  @Override
  public void close() {
    if (session != null) session.close();
    session = null;
  }

  @Override
  public Credential createUser(
      final String bindingId, final String database, final String bindParameters) {
    if (bindParameters != null && !bindParameters.isBlank() && !"{}".equals(bindParameters.trim())) {
      throw new ValidationException("MySQL does not support bind parameters");
    }
    final var session = requireOpen();
    final var username = CredentialVault.username(bindingId);
    final var password = vault.password();
    final var account = account(username);
    try {
      final var exists =
          session.exists(
              "SELECT EXISTS(SELECT 1 FROM mysql.user WHERE User = ? AND Host = '%')", username);
      final var verb = exists ? "ALTER" : "CREATE";
      final var tls = spec.requireTls() ? " REQUIRE SSL" : "";
      session.execute(
          verb + " USER " + account + " IDENTIFIED BY " + literal(password) + tls,
          verb + " USER " + account + " IDENTIFIED BY 'REDACTED'" + tls);
      session.execute("GRANT " + PRIVILEGES + " ON " + identifier(database) + ".* TO " + account);
      LOGGER.log(INFO, "{0} user {1} on {2}", exists ? "Updated" : "Created", username, database);
      return new Credential(username, password, database);
    } catch (final SQLException e) {
      throw SqlErrors.translate("failed to create user " + username, e);
    }
  }

  @Override
  public void dropUser(final String bindingId, final String database) {
    final var session = requireOpen();
    final var username = CredentialVault.username(bindingId);
    try {
      if (dropIfExists(session, username)) return;
      final var legacy = CredentialVault.legacyUsername(bindingId);
      LOGGER.log(INFO, "User {0} does not exist, trying {1}", username, legacy);
      if (!dropIfExists(session, legacy)) {
        LOGGER.log(INFO, "User {0} does not exist either", legacy);
      }
    } catch (final SQLException e) {
      throw SqlErrors.translate("failed to drop user " + username, e);
    }
  }

  private static boolean dropIfExists(final JdbcSession session, final String username)
      throws SQLException {
    try {
      session.execute("DROP USER " + account(username));
      LOGGER.log(INFO, "Dropped user {0}", username);
      return true;
    } catch (final SQLException e) {
      if (e.getErrorCode() == ER_CANNOT_USER) return false;
      throw e;
    }
  }

  @Override
  public void resetState() {
    final var session = requireOpen();
    LOGGER.log(DEBUG, "Resetting state");
    try {
      final var users =
          session.queryStrings(
              "SELECT User FROM mysql.user WHERE Super_priv != 'Y' AND Host = '%'"
                  + " AND User != SUBSTRING_INDEX(CURRENT_USER(), '@', 1)");
      for (final var user : users) session.execute("DROP USER " + account(user));
      LOGGER.log(INFO, "Dropped {0} users", users.size());
    } catch (final SQLException e) {
      throw SqlErrors.translate("failed to reset state", e);
    }
  }

  @Override
  public String uri(final ConnectionSpec spec) {
    return String.format(
        "mysql://%s:%s@%s:%d/%s?reconnect=true&useSSL=%s",
        spec.username(),
        spec.password(),
        spec.host(),
        spec.port(),
        spec.database(),
        spec.requireTls());
  }

  @Override
  public String jdbcUri(final ConnectionSpec spec) {
    return String.format(
        "jdbc:mysql://%s:%d/%s?user=%s&password=%s",
        spec.host(), spec.port(), spec.database(), spec.username(), spec.password());
  }

  private JdbcSession requireOpen() {
    if (session == null) throw new IllegalStateException("driver is not open");
    return session;
  }

  private static String account(final String username) {
    return identifier(username) + "@'%'";
  }

  static String identifier(final String name) {
    if (name.isEmpty() || name.indexOf('`') >= 0 || name.indexOf('\0') >= 0) {
      throw new ValidationException("Invalid MySQL identifier: " + name);
    }
    return '`' + name + '`';
  }

  static String literal(final String value) {
    if (value.indexOf('\'') >= 0 || value.indexOf('\0') >= 0) {
      throw new ValidationException("Invalid MySQL literal");
    }
    return '\'' + value + '\'';
  }
}
