package com.example.rdsbroker.core.engines;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.rdsbroker.core.credentials.Credential;
import com.example.rdsbroker.core.credentials.CredentialVault;
import com.example.rdsbroker.core.errors.ValidationException;
import java.sql.SQLException;
import java.util.Objects;

/** SQL Server driver: contained database users in {@code db_owner}. */
public final class SqlServerDriver implements EngineDriver {

  private static final System.Logger LOGGER = System.getLogger(SqlServerDriver.class.getName());

  private final DataSourceFactory factory;
  private final CredentialVault vault;

  private JdbcSession session;

  public SqlServerDriver(final DataSourceFactory factory, final CredentialVault vault) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.vault = Objects.requireNonNull(vault, "vault");
  }

  static String connectionUrl(final ConnectionSpec spec) {
    return String.format(
        "jdbc:sqlserver://%s:%d;databaseName=%s;encrypt=%s",
        spec.host(), spec.port(), spec.database(), spec.requireTls());
  }

  @Override
  public void open(final ConnectionSpec spec) {
    close();
    try {
      session = JdbcSession.open(factory, connectionUrl(spec), spec.username(), spec.password());
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
      throw new ValidationException("SQL Server does not support bind parameters");
    }
    final var session = requireOpen();
    final var username = CredentialVault.username(bindingId);
    final var password = vault.password();
    final var user = identifier(username);
    try {
      session.inTransaction(
          conn -> {
            final var exists =
                session.exists(
                    "SELECT CASE WHEN EXISTS(SELECT 1 FROM sys.database_principals WHERE name = ?)"
                        + " THEN 1 ELSE 0 END",
                    username);
            if (exists) {
              session.execute(
                  "ALTER USER " + user + " WITH PASSWORD = " + literal(password),
                  "ALTER USER " + user + " WITH PASSWORD = 'REDACTED'");
            } else {
              session.execute(
                  "CREATE USER " + user + " WITH PASSWORD = " + literal(password),
                  "CREATE USER " + user + " WITH PASSWORD = 'REDACTED'");
              session.execute("ALTER ROLE db_owner ADD MEMBER " + user);
            }
            return null;
          });
      LOGGER.log(INFO, "Created user {0} on {1}", username, database);
      return new Credential(username, password, database);
    } catch (final SQLException e) {
      throw SqlErrors.translate("failed to create user " + username, e);
    }
  }

  @Override
  public void dropUser(final String bindingId, final String database) {
    final var session = requireOpen();
    final var username = CredentialVault.username(bindingId);
    final var legacy = CredentialVault.legacyUsername(bindingId);
    try {
      session.execute("DROP USER IF EXISTS " + identifier(username));
      session.execute("DROP USER IF EXISTS " + identifier(legacy));
      LOGGER.log(INFO, "Dropped user {0}", username);
    } catch (final SQLException e) {
      throw SqlErrors.translate("failed to drop user " + username, e);
    }
  }

  @Override
  public void resetState() {
    LOGGER.log(DEBUG, "Nothing to reset on SQL Server");
  }

  @Override
  public String uri(final ConnectionSpec spec) {
    return String.format(
        "sqlserver://%s:%s@%s:%d?database=%s",
        spec.username(), spec.password(), spec.host(), spec.port(), spec.database());
  }

  @Override
  public String jdbcUri(final ConnectionSpec spec) {
    return String.format(
        "jdbc:sqlserver://%s:%d;databaseName=%s;user=%s;password=%s;encrypt=%s",
        spec.host(),
        spec.port(),
        spec.database(),
        spec.username(),
        spec.password(),
        spec.requireTls());
  }

  private JdbcSession requireOpen() {
    if (session == null) throw new IllegalStateException("driver is not open");
    return session;
  }

  static String identifier(final String name) {
    if (name.isEmpty() || name.indexOf(']') >= 0) {
      throw new ValidationException("Invalid SQL Server identifier: " + name);
    }
    return '[' + name + ']';
  }

  static String literal(final String value) {
    return '\'' + value.replace("'", "''") + '\'';
  }
}
