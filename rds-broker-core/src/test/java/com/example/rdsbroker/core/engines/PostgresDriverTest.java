package com.example.rdsbroker.core.engines;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.example.rdsbroker.core.credentials.CredentialVault;
import com.example.rdsbroker.core.errors.AuthenticationFailedException;
import com.example.rdsbroker.core.errors.DatabaseException;
import com.example.rdsbroker.core.errors.ValidationException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.*;

public class PostgresDriverTest {

  private static final ConnectionSpec SPEC =
      new ConnectionSpec("pg.example.com", 5432, "cf_db", "master", "secret", true);

  private DataSource dataSource;
  private Connection connection;
  private Statement statement;
  private String lastUrl;
  private PostgresDriver driver;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = mock(DataSource.class);
    connection = mock(Connection.class);
    statement = mock(Statement.class);
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.createStatement()).thenReturn(statement);

    driver =
        new PostgresDriver(
            (url, user, password) -> {
              lastUrl = url;
              return dataSource;
            },
            new CredentialVault("key"));
  }

  @Nested
  @DisplayName("open")
  class Open {

    @Test
    void shouldRequireSslWhenTlsIsRequired() {
      driver.open(SPEC);

      assertEquals("jdbc:postgresql://pg.example.com:5432/cf_db?sslmode=require", lastUrl);
    }

    @Test
    void rejectedLoginShouldRaiseAuthenticationFailed() throws SQLException {
      when(dataSource.getConnection())
          .thenThrow(
              new SQLException("FATAL: password authentication failed for user \"master\"", "28P01"));

      final var e = assertThrows(AuthenticationFailedException.class, () -> driver.open(SPEC));
      assertInstanceOf(SQLException.class, e.getCause());
    }

    @Test
    void poolStartupFailureShouldBeUnwrapped() {
      final var failing =
          new PostgresDriver(
              (url, user, password) -> {
                throw new RuntimeException(
                    "Failed to initialize pool", new SQLException("auth failed", "28P01"));
              },
              new CredentialVault("key"));

      assertThrows(AuthenticationFailedException.class, () -> failing.open(SPEC));
    }
  }

  @Nested
  @DisplayName("createUser")
  class CreateUser {

    @Test
    void invalidBindParametersShouldFailBeforeAnySql() throws SQLException {
      driver.open(SPEC);

      assertThrows(
          ValidationException.class, () -> driver.createUser("b1", "cf_db", "{\"unknown\":1}"));
      assertThrows(ValidationException.class, () -> driver.createUser("b1", "cf_db", "not json"));
      verify(statement, never()).execute(anyString());
      verify(statement, never()).executeQuery(anyString());
    }

    @Test
    void shouldRequireAnOpenDriver() {
      assertThrows(IllegalStateException.class, () -> driver.createUser("b1", "cf_db", null));
    }
  }

  @Nested
  @DisplayName("extensions")
  class Extensions {

    @Test
    void shouldQuoteExtensionNames() throws SQLException {
      driver.open(SPEC);

      driver.createExtensions(List.of("uuid-ossp", "postgis"));
      driver.dropExtensions(List.of("postgis"));

      verify(statement).execute("CREATE EXTENSION IF NOT EXISTS \"uuid-ossp\"");
      verify(statement).execute("CREATE EXTENSION IF NOT EXISTS \"postgis\"");
      verify(statement).execute("DROP EXTENSION IF EXISTS \"postgis\"");
    }

    @Test
    void failuresShouldBeTranslated() throws SQLException {
      when(statement.execute(anyString()))
          .thenThrow(new SQLException("extension \"nope\" is not available", "0A000"));
      driver.open(SPEC);

      final var e =
          assertThrows(DatabaseException.class, () -> driver.createExtensions(List.of("nope")));
      assertEquals("0A000", e.sqlState());
    }
  }

  @Nested
  @DisplayName("URIs")
  class Uris {

    @Test
    void shouldEmbedCredentials() {
      assertEquals("postgres://u:p@h:5432/db", driver.uri(spec(true)));
      assertEquals("postgres://u:p@h:5432/db?sslmode=disable", driver.uri(spec(false)));
    }

    @Test
    void jdbcUriShouldEncodeParameters() {
      final var spec = new ConnectionSpec("h", 5432, "db", "u", "p&w=d", true);

      assertEquals(
          "jdbc:postgresql://h:5432/db?password=p%26w%3Dd&ssl=true&user=u", driver.jdbcUri(spec));
      assertEquals("jdbc:postgresql://h:5432/db?password=p&user=u", driver.jdbcUri(spec(false)));
    }

    private ConnectionSpec spec(final boolean tls) {
      return new ConnectionSpec("h", 5432, "db", "u", "p", tls);
    }
  }

  @Test
  void groupNameShouldDeriveFromDatabase() {
    assertEquals("cf_db_manager", PostgresDriver.groupName("cf_db"));
  }
}
