package com.example.rdsbroker.core.aws;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.regions.Region;

/**
 * Connection settings for the AWS control plane.
 *
 * <p>{@link #fromEnvironment()} reads system properties first and environment variables second:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.rds.endpoint / AWS_RDS_ENDPOINT (optional, useful for Localstack)
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (optional)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID and aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 *       (optional, default credentials chain otherwise)
 *   <li>rds.broker.tag.cache.ttl.seconds / RDS_BROKER_TAG_CACHE_TTL_SECONDS (default one week)
 * </ul>
 *
 * @param region AWS region
 * @param rdsEndpoint RDS endpoint override, or null
 * @param secretsManagerEndpoint Secrets Manager endpoint override, or null
 * @param accessKeyId static access key, or null
 * @param secretAccessKey static secret key, or null
 * @param tagCacheTtl TTL of the tag cache
 */
public record AwsSettings(
    Region region,
    URI rdsEndpoint,
    URI secretsManagerEndpoint,
    String accessKeyId,
    String secretAccessKey,
    Duration tagCacheTtl) {

  private static final Duration DEFAULT_TAG_CACHE_TTL = Duration.ofSeconds(604_800L);

  public AwsSettings {
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(tagCacheTtl, "tagCacheTtl");
    if (tagCacheTtl.isNegative()) throw new IllegalArgumentException("tagCacheTtl must be >= 0");
    if ((accessKeyId == null) != (secretAccessKey == null))
      throw new IllegalArgumentException("accessKeyId and secretAccessKey must be set together");
  }

  /** Resolves settings from system properties and environment variables. */
  public static AwsSettings fromEnvironment() {
    final var region = setting("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1);
    final var rdsEndpoint = setting("aws.rds.endpoint", "AWS_RDS_ENDPOINT").map(URI::create);
    final var smEndpoint = setting("aws.sm.endpoint", "AWS_SM_ENDPOINT").map(URI::create);
    final var accessKey = setting("aws.accessKeyId", "AWS_ACCESS_KEY_ID");
    final var secretKey =
        accessKey.flatMap(ignored -> setting("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY"));
    final var ttl =
        setting("rds.broker.tag.cache.ttl.seconds", "RDS_BROKER_TAG_CACHE_TTL_SECONDS")
            .flatMap(AwsSettings::parseLong)
            .map(seconds -> Duration.ofSeconds(Math.max(0L, seconds)))
            .orElse(DEFAULT_TAG_CACHE_TTL);

    return new AwsSettings(
        region,
        rdsEndpoint.orElse(null),
        smEndpoint.orElse(null),
        secretKey.isPresent() ? accessKey.orElse(null) : null,
        secretKey.orElse(null),
        ttl);
  }

  public Optional<URI> rdsEndpointOverride() {
    return Optional.ofNullable(rdsEndpoint);
  }

  public Optional<URI> secretsManagerEndpointOverride() {
    return Optional.ofNullable(secretsManagerEndpoint);
  }

  static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(val -> !val.isEmpty());
  }

  private static Optional<Long> parseLong(final String val) {
    try {
      return Optional.of(Long.parseLong(val));
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }
}
