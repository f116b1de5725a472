package com.example.rdsbroker.housekeeping;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.rdsbroker.core.aws.AwsClients;
import com.example.rdsbroker.core.aws.AwsSettings;
import com.example.rdsbroker.core.credentials.CredentialVault;
import com.example.rdsbroker.core.engines.DataSourceFactory;
import com.example.rdsbroker.core.engines.EngineDrivers;
import com.example.rdsbroker.core.instances.InstanceLifecycleManager;
import com.example.rdsbroker.core.secrets.BrokerSecrets;
import com.example.rdsbroker.core.secrets.BrokerSecretsProvider;
import com.example.rdsbroker.core.snapshots.SnapshotRetentionManager;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** Runs snapshot retention and the master credential check on a fixed schedule. */
public class HousekeepingApp {

  private static final System.Logger LOGGER = System.getLogger(HousekeepingApp.class.getName());

  private final ScheduledExecutorService scheduler;
  private final Runnable snapshots;
  private final Runnable credentials;
  private final long intervalMinutes;

  HousekeepingApp(
      final Runnable snapshots, final Runnable credentials, final long intervalMinutes) {
    this.snapshots = snapshots;
    this.credentials = credentials;
    this.intervalMinutes = intervalMinutes;
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              var t = new Thread(r, "rds-broker-housekeeping");
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Entry point. Reads {@link HousekeepingConfig} and {@link AwsSettings} from the environment and
   * runs until the JVM is stopped.
   *
   * @param args CLI args (unused)
   * @throws InterruptedException when interrupted while waiting
   */
  public static void main(String[] args) throws InterruptedException {
    final var config = HousekeepingConfig.fromEnvironment();
    final var settings = AwsSettings.fromEnvironment();

    final BrokerSecrets secrets;
    try (final var sm = AwsClients.secretsManager(settings)) {
      secrets = new BrokerSecretsProvider(sm).get(config.secretId());
    }
    final var rds = AwsClients.rds(settings);

    final var instances = InstanceLifecycleManager.create(rds, settings.tagCacheTtl());
    final var retention = new SnapshotRetentionManager(rds, instances.tagStore());
    final var drivers =
        new EngineDrivers(
            DataSourceFactory.hikari("rds-broker-housekeeping"),
            new CredentialVault(secrets.stateEncryptionKey()));

    final var app =
        new HousekeepingApp(
            new SnapshotHousekeeper(retention, config.brokerName(), config.keepSnapshotsForDays()),
            new MasterCredentialRotator(
                instances, drivers, config, secrets.masterPasswordSeed()),
            config.intervalMinutes());
    Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));

    app.start();
    LOGGER.log(INFO, "cron-start");
    app.awaitTermination();
    LOGGER.log(INFO, "cron-stop");
    rds.close();
  }

  void start() {
    scheduler.scheduleAtFixedRate(this::runOnce, 0L, intervalMinutes, TimeUnit.MINUTES);
  }

  /** Runs both tasks; an unexpected failure of one is logged and never cancels the schedule. */
  void runOnce() {
    runLogged("delete-snapshots", snapshots);
    runLogged("check-master-passwords", credentials);
  }

  private static void runLogged(final String name, final Runnable task) {
    try {
      task.run();
    } catch (final RuntimeException e) {
      LOGGER.log(ERROR, name + " failed", e);
    }
  }

  void awaitTermination() throws InterruptedException {
    scheduler.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS);
  }

  void shutdown() {
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) scheduler.shutdownNow();
    } catch (final InterruptedException e) {
      LOGGER.log(WARNING, "Interrupted while stopping housekeeping");
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
