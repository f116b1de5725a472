package com.example.rdsbroker.core.snapshots;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.rdsbroker.core.aws.ProviderErrors;
import com.example.rdsbroker.core.aws.RdsPages;
import com.example.rdsbroker.core.errors.BrokerException;
import com.example.rdsbroker.core.errors.NotFoundException;
import com.example.rdsbroker.core.tags.BrokerTags;
import com.example.rdsbroker.core.tags.TagStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBSnapshot;
import software.amazon.awssdk.services.rds.model.DeleteDbSnapshotRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbSnapshotsRequest;

/**
 * Deletes manual snapshots taken by this broker once they are older than a retention period.
 *
 * <p>Candidates are selected completely before anything is deleted, so a failure to list
 * snapshots or their tags leaves every snapshot in place. Deletion stops at the first failure;
 * snapshots deleted before it stay deleted and the next run picks up the rest.
 */
public final class SnapshotRetentionManager {

  private static final System.Logger LOGGER =
      System.getLogger(SnapshotRetentionManager.class.getName());

  private static final String MANUAL = "manual";

  private final RdsClient rds;
  private final TagStore tagStore;
  private final Clock clock;

  public SnapshotRetentionManager(final RdsClient rds, final TagStore tagStore) {
    this(rds, tagStore, Clock.systemUTC());
  }

  public SnapshotRetentionManager(final RdsClient rds, final TagStore tagStore, final Clock clock) {
    this.rds = Objects.requireNonNull(rds, "rds");
    this.tagStore = Objects.requireNonNull(tagStore, "tagStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Deletes manual snapshots whose {@link BrokerTags#BROKER_NAME} tag equals {@code ownerTagValue}
   * and that were created more than {@code keepForDays} days ago.
   *
   * @return identifiers of the snapshots deleted, in deletion order
   * @throws BrokerException wrapping the first failure, naming the snapshot involved
   */
  public List<String> deleteSnapshots(final String ownerTagValue, final int keepForDays) {
    Objects.requireNonNull(ownerTagValue, "ownerTagValue");
    if (keepForDays < 0) throw new IllegalArgumentException("keepForDays must be >= 0");

    final var cutoff = clock.instant().minus(Duration.ofHours(24L * keepForDays));
    LOGGER.log(
        INFO,
        "Deleting manual snapshots of broker {0} created before {1}",
        ownerTagValue,
        cutoff);

    final List<DBSnapshot> all;
    try {
      all =
          RdsPages.snapshots(rds, DescribeDbSnapshotsRequest.builder().snapshotType(MANUAL).build());
    } catch (final BrokerException e) {
      throw new BrokerException("failed to fetch snapshot list from AWS API: " + e.getMessage(), e);
    }

    final var candidates = new ArrayList<DBSnapshot>();
    for (final var snapshot : all) {
      if (snapshot.snapshotCreateTime() == null || !snapshot.snapshotCreateTime().isBefore(cutoff)) {
        continue;
      }
      final String owner;
      try {
        owner = BrokerTags.toMap(tagStore.get(snapshot.dbSnapshotArn(), false)).get(BrokerTags.BROKER_NAME);
      } catch (final BrokerException e) {
        throw new BrokerException(
            "failed to list tags for " + snapshot.dbSnapshotIdentifier() + ": " + e.getMessage(), e);
      }
      if (ownerTagValue.equals(owner)) candidates.add(snapshot);
    }
    LOGGER.log(DEBUG, "{0} of {1} manual snapshots are eligible", candidates.size(), all.size());

    final var deleted = new ArrayList<String>();
    for (final var snapshot : candidates) {
      final var id = snapshot.dbSnapshotIdentifier();
      final var request = DeleteDbSnapshotRequest.builder().dbSnapshotIdentifier(id).build();
      try {
        ProviderErrors.run("delete snapshot " + id, () -> rds.deleteDBSnapshot(request));
        LOGGER.log(INFO, "Deleted snapshot {0}", id);
      } catch (final NotFoundException e) {
        LOGGER.log(INFO, "Snapshot {0} was already gone", id);
      } catch (final BrokerException e) {
        throw new BrokerException("failed to delete " + id + ": " + e.getMessage(), e);
      }
      tagStore.invalidate(snapshot.dbSnapshotArn());
      deleted.add(id);
    }
    return deleted;
  }
}
