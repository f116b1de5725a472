package com.example.rdsbroker.housekeeping;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.rdsbroker.core.errors.BrokerException;
import com.example.rdsbroker.core.snapshots.SnapshotRetentionManager;
import java.util.Objects;

/** One snapshot retention run. Failures are logged, never propagated to the scheduler. */
public class SnapshotHousekeeper implements Runnable {

  private static final System.Logger LOGGER = System.getLogger(SnapshotHousekeeper.class.getName());

  private final SnapshotRetentionManager retention;
  private final String brokerName;
  private final int keepForDays;

  public SnapshotHousekeeper(
      final SnapshotRetentionManager retention, final String brokerName, final int keepForDays) {
    this.retention = Objects.requireNonNull(retention, "retention");
    this.brokerName = Objects.requireNonNull(brokerName, "brokerName");
    this.keepForDays = keepForDays;
  }

  @Override
  public void run() {
    try {
      final var deleted = retention.deleteSnapshots(brokerName, keepForDays);
      LOGGER.log(INFO, "delete-snapshots: removed {0} snapshots", deleted.size());
    } catch (final BrokerException e) {
      LOGGER.log(ERROR, "delete-snapshots failed", e);
    }
  }
}
