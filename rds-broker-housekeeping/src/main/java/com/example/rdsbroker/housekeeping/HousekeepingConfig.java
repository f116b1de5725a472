package com.example.rdsbroker.housekeeping;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Housekeeping settings, read from system properties first and environment variables second:
 *
 * <ul>
 *   <li>rds.broker.name / RDS_BROKER_NAME (required): value of the {@code Broker Name} tag
 *   <li>rds.broker.secret.id / RDS_BROKER_SECRET_ID (required): Secrets Manager id of the broker
 *       secrets
 *   <li>rds.broker.snapshots.keep.days / RDS_BROKER_SNAPSHOTS_KEEP_DAYS (required, > 0)
 *   <li>rds.broker.housekeeping.interval.minutes / RDS_BROKER_HOUSEKEEPING_INTERVAL_MINUTES
 *       (default 60)
 *   <li>rds.broker.db.prefix / RDS_BROKER_DB_PREFIX (default {@code cf})
 *   <li>rds.broker.require.tls / RDS_BROKER_REQUIRE_TLS (default true)
 * </ul>
 *
 * @param brokerName broker name tag value
 * @param secretId broker secrets id
 * @param keepSnapshotsForDays snapshot retention in days
 * @param intervalMinutes minutes between runs
 * @param dbPrefix prefix of instance identifiers and database names
 * @param requireTls whether master connections must be encrypted
 */
public record HousekeepingConfig(
    String brokerName,
    String secretId,
    int keepSnapshotsForDays,
    long intervalMinutes,
    String dbPrefix,
    boolean requireTls) {

  public HousekeepingConfig {
    if (brokerName == null || brokerName.isBlank())
      throw new IllegalArgumentException("must provide a non-empty rds.broker.name");
    if (secretId == null || secretId.isBlank())
      throw new IllegalArgumentException("must provide a non-empty rds.broker.secret.id");
    if (keepSnapshotsForDays <= 0)
      throw new IllegalArgumentException(
          "must provide a valid number for rds.broker.snapshots.keep.days");
    if (intervalMinutes <= 0)
      throw new IllegalArgumentException("rds.broker.housekeeping.interval.minutes must be > 0");
    Objects.requireNonNull(dbPrefix, "dbPrefix");
  }

  public static HousekeepingConfig fromEnvironment() {
    return from(HousekeepingConfig::systemSetting);
  }

  /** Builds the config from a property lookup, e.g. a {@link java.util.Properties} in tests. */
  static HousekeepingConfig from(final Function<String, Optional<String>> lookup) {
    return new HousekeepingConfig(
        lookup.apply("rds.broker.name").orElse(null),
        lookup.apply("rds.broker.secret.id").orElse(null),
        lookup.apply("rds.broker.snapshots.keep.days").map(Integer::parseInt).orElse(0),
        lookup
            .apply("rds.broker.housekeeping.interval.minutes")
            .map(Long::parseLong)
            .orElse(60L),
        lookup.apply("rds.broker.db.prefix").orElse("cf"),
        lookup.apply("rds.broker.require.tls").map(Boolean::parseBoolean).orElse(true));
  }

  private static Optional<String> systemSetting(final String property) {
    final var env = property.toUpperCase(Locale.ROOT).replace('.', '_');
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(val -> !val.isEmpty());
  }

  /** Service instance id an instance identifier was derived from. */
  public String serviceInstanceId(final String dbInstanceIdentifier) {
    final var prefix = dbPrefix.replace('_', '-') + "-";
    return dbInstanceIdentifier.startsWith(prefix)
        ? dbInstanceIdentifier.substring(prefix.length())
        : dbInstanceIdentifier;
  }

  /** Database name used when the instance reports none. */
  public String defaultDbName(final String serviceInstanceId) {
    return dbPrefix.replace('-', '_') + "_" + serviceInstanceId.replace('-', '_');
  }
}
