package com.example.rdsbroker.core.engines;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.example.rdsbroker.core.credentials.CredentialVault;
import com.example.rdsbroker.core.errors.AuthenticationFailedException;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.utility.DockerImageName;

@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class MySqlDriverIT {

  private MySQLContainer<?> mysql;
  private EngineDrivers drivers;

  @BeforeAll
  void startContainer() {
    assumeTrue(dockerAvailable(), "Docker not available, skipping test");

    mysql = new MySQLContainer<>(DockerImageName.parse("mysql:8.0")).withUsername("root");
    mysql.start();

    drivers =
        new EngineDrivers(DataSourceFactory.hikari("mysql-driver-it"), new CredentialVault("k"));
  }

  @AfterAll
  void cleanup() {
    if (mysql != null) mysql.stop();
  }

  private ConnectionSpec masterSpec(final String password) {
    return new ConnectionSpec(
        mysql.getHost(),
        mysql.getFirstMappedPort(),
        mysql.getDatabaseName(),
        mysql.getUsername(),
        password,
        false);
  }

  private String url() {
    return MySqlDriver.connectionUrl(masterSpec(mysql.getPassword()))
        + "&allowPublicKeyRetrieval=true";
  }

  @Test
  void wrongMasterPasswordShouldRaiseAuthenticationFailed() {
    try (final var driver = drivers.forEngine("mysql")) {
      assertThrows(AuthenticationFailedException.class, () -> driver.open(masterSpec("nope")));
    }
  }

  @Test
  void bindingUserShouldWorkUntilDropped() throws SQLException {
    final var database = mysql.getDatabaseName();

    try (final var driver = drivers.forEngine("mysql")) {
      driver.open(masterSpec(mysql.getPassword()));
      driver.createUser("mysql-binding", database, null);
      final var credential = driver.createUser("mysql-binding", database, "{}");

      try (final var conn =
              DriverManager.getConnection(url(), credential.username(), credential.password());
          final var st = conn.createStatement()) {
        st.execute("CREATE TABLE binding_table (id int)");
        st.execute("INSERT INTO binding_table VALUES (1)");
        st.execute("DROP TABLE binding_table");
      }

      driver.dropUser("mysql-binding", database);
      assertDoesNotThrow(() -> driver.dropUser("mysql-binding", database));

      assertThrows(
          SQLException.class,
          () -> DriverManager.getConnection(url(), credential.username(), credential.password()));
    }
  }

  @Test
  void resetStateShouldRemoveBindingUsers() throws SQLException {
    final var database = mysql.getDatabaseName();

    try (final var driver = drivers.forEngine("mysql")) {
      driver.open(masterSpec(mysql.getPassword()));
      final var credential = driver.createUser("reset-binding", database, null);

      driver.resetState();

      assertThrows(
          SQLException.class,
          () -> DriverManager.getConnection(url(), credential.username(), credential.password()));
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
