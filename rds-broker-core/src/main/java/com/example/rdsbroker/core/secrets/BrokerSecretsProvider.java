package com.example.rdsbroker.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.rdsbroker.core.aws.ProviderErrors;
import com.example.rdsbroker.core.errors.BrokerException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Reads {@link BrokerSecrets} from AWS Secrets Manager.
 *
 * <p>Values are cached per secret id for {@code ttl}; a zero TTL disables caching. The default TTL
 * comes from aws.sm.cache.ttl.millis / AWS_SM_CACHE_TTL_MILLIS (default 0).
 */
public class BrokerSecretsProvider {

  private static final System.Logger LOGGER =
      System.getLogger(BrokerSecretsProvider.class.getName());

  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final ConcurrentHashMap<String, CacheEntry> cache = new ConcurrentHashMap<>();
  private final SecretsManagerClient client;
  private final Duration ttl;
  private final Clock clock;

  public BrokerSecretsProvider(final SecretsManagerClient client) {
    this(client, ttlFromEnvironment(), Clock.systemUTC());
  }

  public BrokerSecretsProvider(
      final SecretsManagerClient client, final Duration ttl, final Clock clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
  }

  static Duration ttlFromEnvironment() {
    return Optional.ofNullable(System.getProperty("aws.sm.cache.ttl.millis"))
        .or(() -> Optional.ofNullable(System.getenv("AWS_SM_CACHE_TTL_MILLIS")))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            })
        .map(parsed -> Duration.ofMillis(Math.max(0L, parsed)))
        .orElse(Duration.ZERO);
  }

  /**
   * Fetches and parses the secret.
   *
   * @throws BrokerException if the secret cannot be fetched or is not valid JSON
   */
  public BrokerSecrets get(final String secretId) {
    if (ttl.isZero()) return fetch(secretId);

    final var now = Instant.now(clock);
    final var cached = cache.get(secretId);
    if (cached != null && !now.isAfter(cached.expiresAt())) return cached.secrets();

    final var secrets = fetch(secretId);
    cache.put(secretId, new CacheEntry(secrets, now.plus(ttl)));
    return secrets;
  }

  /** Clears the in-memory cache. */
  public void resetCache() {
    cache.clear();
  }

  private BrokerSecrets fetch(final String secretId) {
    LOGGER.log(DEBUG, "Fetching secret {0}", secretId);
    final var response =
        ProviderErrors.call(
            "get secret " + secretId,
            () ->
                client.getSecretValue(GetSecretValueRequest.builder().secretId(secretId).build()));
    try {
      return MAPPER.readValue(response.secretString(), BrokerSecrets.class);
    } catch (final JsonProcessingException | RuntimeException e) {
      throw new BrokerException("Failed to parse broker secret " + secretId, e);
    }
  }

  private record CacheEntry(BrokerSecrets secrets, Instant expiresAt) {}
}
