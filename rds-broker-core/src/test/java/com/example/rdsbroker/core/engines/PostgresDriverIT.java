package com.example.rdsbroker.core.engines;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.example.rdsbroker.core.credentials.CredentialVault;
import com.example.rdsbroker.core.errors.AuthenticationFailedException;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class PostgresDriverIT {

  private PostgreSQLContainer<?> postgres;
  private EngineDrivers drivers;

  @BeforeAll
  void startContainer() {
    assumeTrue(dockerAvailable(), "Docker not available, skipping test");

    postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16"));
    postgres.start();

    drivers =
        new EngineDrivers(DataSourceFactory.hikari("postgres-driver-it"), new CredentialVault("k"));
  }

  @AfterAll
  void cleanup() {
    if (postgres != null) postgres.stop();
  }

  private ConnectionSpec masterSpec() {
    return new ConnectionSpec(
        postgres.getHost(),
        postgres.getFirstMappedPort(),
        postgres.getDatabaseName(),
        postgres.getUsername(),
        postgres.getPassword(),
        false);
  }

  private String url() {
    return PostgresDriver.connectionUrl(masterSpec());
  }

  @Test
  void wrongMasterPasswordShouldRaiseAuthenticationFailed() {
    final var spec = masterSpec();
    final var wrong =
        new ConnectionSpec(spec.host(), spec.port(), spec.database(), spec.username(), "nope", false);

    try (final var driver = drivers.forEngine("postgres")) {
      assertThrows(AuthenticationFailedException.class, () -> driver.open(wrong));
    }
  }

  @Test
  void ownerBindingShouldLoginAndKeepItsPassword() throws SQLException {
    final var database = postgres.getDatabaseName();

    try (final var driver = drivers.forEngine("postgres")) {
      driver.open(masterSpec());
      final var first = driver.createUser("owner-binding", database, null);
      final var second = driver.createUser("owner-binding", database, "{}");

      assertEquals(first.password(), second.password());

      try (final var conn = DriverManager.getConnection(url(), first.username(), first.password());
          final var st = conn.createStatement()) {
        st.execute("CREATE TABLE owned_by_binding (id int)");
        try (final var rs =
            st.executeQuery(
                "SELECT tableowner FROM pg_tables WHERE tablename = 'owned_by_binding'")) {
          assertTrue(rs.next());
          assertEquals(PostgresDriver.groupName(database), rs.getString(1));
        }
      }

      driver.dropUser("owner-binding", database);
    }

    assertThrows(
        SQLException.class,
        () -> DriverManager.getConnection(url(), CredentialVault.username("owner-binding"), "x"));
  }

  @Test
  void readOnlyBindingShouldOnlySelect() throws SQLException {
    final var database = postgres.getDatabaseName();
    try (final var conn =
            DriverManager.getConnection(url(), postgres.getUsername(), postgres.getPassword());
        final var st = conn.createStatement()) {
      st.execute("CREATE TABLE IF NOT EXISTS readable (id int)");
      st.execute("INSERT INTO readable VALUES (1)");
    }

    try (final var driver = drivers.forEngine("postgres")) {
      driver.open(masterSpec());
      final var credential =
          driver.createUser(
              "reader-binding",
              database,
              "{\"is_owner\":false,\"default_privilege_policy\":\"revoke\","
                  + "\"grant_privileges\":["
                  + "{\"target_type\":\"schema\",\"target_name\":\"public\",\"privilege\":\"USAGE\"},"
                  + "{\"target_type\":\"table\",\"target_schema\":\"public\","
                  + "\"target_name\":\"readable\",\"privilege\":\"SELECT\"}]}");

      try (final var conn =
              DriverManager.getConnection(url(), credential.username(), credential.password());
          final var st = conn.createStatement()) {
        try (final var rs = st.executeQuery("SELECT count(*) FROM readable")) {
          assertTrue(rs.next());
          assertEquals(1, rs.getInt(1));
        }
        assertThrows(SQLException.class, () -> st.execute("INSERT INTO readable VALUES (2)"));
      }

      driver.dropUser("reader-binding", database);
    }
  }

  @Test
  void extensionsShouldBeCreatedAndDropped() throws SQLException {
    try (final var driver = drivers.forEngine("postgres")) {
      driver.open(masterSpec());
      driver.createExtensions(List.of("pgcrypto"));
      assertTrue(extensionInstalled("pgcrypto"));
      driver.dropExtensions(List.of("pgcrypto"));
      assertFalse(extensionInstalled("pgcrypto"));
    }
  }

  private boolean extensionInstalled(final String name) throws SQLException {
    try (final var conn =
            DriverManager.getConnection(url(), postgres.getUsername(), postgres.getPassword());
        final var st = conn.prepareStatement("SELECT 1 FROM pg_extension WHERE extname = ?")) {
      st.setString(1, name);
      try (final var rs = st.executeQuery()) {
        return rs.next();
      }
    }
  }

  private boolean dockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (final Throwable t) {
      return false;
    }
  }
}
