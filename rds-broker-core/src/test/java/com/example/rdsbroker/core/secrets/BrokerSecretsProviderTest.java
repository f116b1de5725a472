package com.example.rdsbroker.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.rdsbroker.core.MutableClock;
import com.example.rdsbroker.core.errors.BrokerException;
import com.example.rdsbroker.core.errors.ProviderException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.*;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.SecretsManagerException;

public class BrokerSecretsProviderTest {

  private static final String SECRET_ID = "rds-broker/secrets";
  private static final String SECRET_JSON =
      "{\"state_encryption_key\":\"k1\",\"master_password_seed\":\"seed\",\"extra\":1}";

  private SecretsManagerClient client;
  private MutableClock clock;

  @BeforeEach
  void setUp() {
    client = mock(SecretsManagerClient.class);
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(GetSecretValueResponse.builder().secretString(SECRET_JSON).build());
  }

  @Test
  @DisplayName("Should parse the broker secret and ignore unknown fields")
  void shouldParseSecret() {
    final var provider = new BrokerSecretsProvider(client, Duration.ZERO, clock);

    final var secrets = provider.get(SECRET_ID);

    assertEquals("k1", secrets.stateEncryptionKey());
    assertEquals("seed", secrets.masterPasswordSeed());
    assertFalse(secrets.toString().contains("seed"));
  }

  @Test
  @DisplayName("Zero TTL should fetch on every call")
  void zeroTtlShouldAlwaysFetch() {
    final var provider = new BrokerSecretsProvider(client, Duration.ZERO, clock);

    provider.get(SECRET_ID);
    provider.get(SECRET_ID);

    verify(client, times(2)).getSecretValue(any(GetSecretValueRequest.class));
  }

  @Test
  @DisplayName("Positive TTL should cache until expiry")
  void shouldCacheUntilExpiry() {
    final var provider = new BrokerSecretsProvider(client, Duration.ofMinutes(5), clock);

    provider.get(SECRET_ID);
    clock.advance(Duration.ofMinutes(5));
    provider.get(SECRET_ID);
    verify(client, times(1)).getSecretValue(any(GetSecretValueRequest.class));

    clock.advance(Duration.ofSeconds(1));
    provider.get(SECRET_ID);
    verify(client, times(2)).getSecretValue(any(GetSecretValueRequest.class));

    provider.resetCache();
    provider.get(SECRET_ID);
    verify(client, times(3)).getSecretValue(any(GetSecretValueRequest.class));
  }

  @Test
  @DisplayName("Invalid JSON should raise BrokerException")
  void invalidJsonShouldFail() {
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(GetSecretValueResponse.builder().secretString("not-json").build());
    final var provider = new BrokerSecretsProvider(client, Duration.ZERO, clock);

    final var e = assertThrows(BrokerException.class, () -> provider.get(SECRET_ID));
    assertEquals("Failed to parse broker secret " + SECRET_ID, e.getMessage());
  }

  @Test
  @DisplayName("Missing fields should raise BrokerException")
  void missingFieldsShouldFail() {
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(
            GetSecretValueResponse.builder()
                .secretString("{\"state_encryption_key\":\"k1\"}")
                .build());
    final var provider = new BrokerSecretsProvider(client, Duration.ZERO, clock);

    assertThrows(BrokerException.class, () -> provider.get(SECRET_ID));
  }

  @Test
  @DisplayName("Provider failures should be translated")
  void providerFailuresShouldBeTranslated() {
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenThrow(
            SecretsManagerException.builder()
                .statusCode(400)
                .awsErrorDetails(
                    AwsErrorDetails.builder()
                        .errorCode("AccessDeniedException")
                        .errorMessage("not allowed")
                        .build())
                .build());
    final var provider = new BrokerSecretsProvider(client, Duration.ZERO, clock);

    final var e = assertThrows(ProviderException.class, () -> provider.get(SECRET_ID));
    assertEquals("AccessDeniedException", e.code());
  }

  @Test
  void negativeTtlShouldBeRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new BrokerSecretsProvider(client, Duration.ofMillis(-1), clock));
  }

  @Test
  void ttlShouldComeFromSystemProperty() {
    System.setProperty("aws.sm.cache.ttl.millis", "1500");
    try {
      assertEquals(Duration.ofMillis(1500), BrokerSecretsProvider.ttlFromEnvironment());
      System.setProperty("aws.sm.cache.ttl.millis", "garbage");
      assertEquals(Duration.ZERO, BrokerSecretsProvider.ttlFromEnvironment());
    } finally {
      System.clearProperty("aws.sm.cache.ttl.millis");
    }
  }
}
