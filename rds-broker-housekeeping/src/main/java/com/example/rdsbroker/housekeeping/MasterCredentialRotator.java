package com.example.rdsbroker.housekeeping;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.rdsbroker.core.credentials.CredentialVault;
import com.example.rdsbroker.core.engines.ConnectionSpec;
import com.example.rdsbroker.core.engines.EngineDrivers;
import com.example.rdsbroker.core.errors.AuthenticationFailedException;
import com.example.rdsbroker.core.errors.BrokerException;
import com.example.rdsbroker.core.instances.InstanceDescriptor;
import com.example.rdsbroker.core.instances.InstanceLifecycleManager;
import com.example.rdsbroker.core.instances.InstanceSpec;
import com.example.rdsbroker.core.tags.BrokerTags;
import java.util.List;
import java.util.Objects;

/**
 * Checks that every broker-managed instance still accepts its derived master password, and resets
 * the password of those that reject it.
 */
public class MasterCredentialRotator implements Runnable {

  private static final System.Logger LOGGER =
      System.getLogger(MasterCredentialRotator.class.getName());

  static final int MASTER_PASSWORD_LENGTH = 32;

  private final InstanceLifecycleManager instances;
  private final EngineDrivers drivers;
  private final HousekeepingConfig config;
  private final String masterPasswordSeed;

  public MasterCredentialRotator(
      final InstanceLifecycleManager instances,
      final EngineDrivers drivers,
      final HousekeepingConfig config,
      final String masterPasswordSeed) {
    this.instances = Objects.requireNonNull(instances, "instances");
    this.drivers = Objects.requireNonNull(drivers, "drivers");
    this.config = Objects.requireNonNull(config, "config");
    this.masterPasswordSeed = Objects.requireNonNull(masterPasswordSeed, "masterPasswordSeed");
  }

  String masterPassword(final String serviceInstanceId) {
    return CredentialVault.derive(masterPasswordSeed + serviceInstanceId, MASTER_PASSWORD_LENGTH);
  }

  @Override
  public void run() {
    LOGGER.log(INFO, "Started checking credentials of RDS instances managed by this broker");
    final List<InstanceDescriptor> managed;
    try {
      managed = instances.describeByTag(BrokerTags.BROKER_NAME, config.brokerName(), false);
    } catch (final BrokerException e) {
      LOGGER.log(ERROR, "Could not obtain the list of instances", e);
      return;
    }
    LOGGER.log(DEBUG, "Found {0} RDS instances managed by the broker", managed.size());

    for (final var instance : managed) check(instance);
    LOGGER.log(INFO, "Instances credentials check has ended");
  }

  void check(final InstanceDescriptor instance) {
    final var id = instance.identifier();
    final var endpoint = instance.findEndpoint();
    if (endpoint.isEmpty()) {
      LOGGER.log(DEBUG, "Instance {0} has no endpoint yet, skipping", id);
      return;
    }
    final var serviceInstanceId = config.serviceInstanceId(id);
    final var password = masterPassword(serviceInstanceId);
    final var dbName =
        instance.dbName() == null || instance.dbName().isEmpty()
            ? config.defaultDbName(serviceInstanceId)
            : instance.dbName();
    final var spec =
        new ConnectionSpec(
            endpoint.get().address(),
            endpoint.get().port(),
            dbName,
            instance.masterUsername(),
            password,
            config.requireTls());

    try (final var driver = drivers.forEngine(instance.engine())) {
      driver.open(spec);
      LOGGER.log(DEBUG, "Master credentials of {0} are valid", id);
    } catch (final AuthenticationFailedException e) {
      LOGGER.log(INFO, "Login failed on {0}, resetting the master password", id);
      try {
        instances.modify(id, InstanceSpec.builder().masterUserPassword(password).build(), true);
      } catch (final BrokerException modifyFailure) {
        LOGGER.log(ERROR, "Could not reset the master password of instance " + id, modifyFailure);
      }
    } catch (final BrokerException e) {
      LOGGER.log(ERROR, "Unknown error when connecting to " + id, e);
    }
  }
}
