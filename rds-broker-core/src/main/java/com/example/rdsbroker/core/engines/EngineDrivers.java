package com.example.rdsbroker.core.engines;

import com.example.rdsbroker.core.credentials.CredentialVault;
import com.example.rdsbroker.core.errors.ValidationException;
import java.util.Locale;
import java.util.Objects;

/** Picks the {@link EngineDriver} for an RDS engine name. */
public final class EngineDrivers {

  private final DataSourceFactory factory;
  private final CredentialVault vault;

  public EngineDrivers(final DataSourceFactory factory, final CredentialVault vault) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.vault = Objects.requireNonNull(vault, "vault");
  }

  /**
   * Returns a new, unopened driver.
   *
   * @param engine RDS engine name, e.g. {@code postgres} or {@code sqlserver-se}
   * @throws ValidationException for engines without a driver
   */
  public EngineDriver forEngine(final String engine) {
    final var name = engine == null ? "" : engine.toLowerCase(Locale.ROOT);
    switch (name) {
      case "postgres":
      case "postgresql":
        return new PostgresDriver(factory, vault);
      case "mysql":
      case "mariadb":
        return new MySqlDriver(factory, vault);
      case "sqlserver-ee":
      case "sqlserver-se":
      case "sqlserver-ex":
      case "sqlserver-web":
        return new SqlServerDriver(factory, vault);
      default:
        throw new ValidationException("SQL Engine '" + engine + "' not supported");
    }
  }
}
