package com.example.rdsbroker.core.instances;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.rdsbroker.core.aws.ProviderErrors;
import com.example.rdsbroker.core.aws.RdsPages;
import com.example.rdsbroker.core.errors.BrokerException;
import com.example.rdsbroker.core.errors.EngineMismatchException;
import com.example.rdsbroker.core.errors.NotFoundException;
import com.example.rdsbroker.core.snapshots.SnapshotDescriptor;
import com.example.rdsbroker.core.tags.BrokerTags;
import com.example.rdsbroker.core.tags.RdsTagSource;
import com.example.rdsbroker.core.tags.TagStore;
import com.example.rdsbroker.core.versions.VersionResolver;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.AddTagsToResourceRequest;
import software.amazon.awssdk.services.rds.model.CreateDbInstanceRequest;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DeleteDbInstanceRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbSnapshotsRequest;
import software.amazon.awssdk.services.rds.model.ModifyDbInstanceRequest;
import software.amazon.awssdk.services.rds.model.RebootDbInstanceRequest;
import software.amazon.awssdk.services.rds.model.RemoveTagsFromResourceRequest;
import software.amazon.awssdk.services.rds.model.RestoreDbInstanceFromDbSnapshotRequest;
import software.amazon.awssdk.services.rds.model.RestoreDbInstanceToPointInTimeRequest;
import software.amazon.awssdk.services.rds.model.Tag;

/**
 * Drives instance create, modify, restore and delete against RDS.
 *
 * <p>The manager keeps no instance state of its own: every read goes back to the provider and is
 * translated into an {@link InstanceDescriptor}. Only tags are cached, in the {@link TagStore}
 * this manager owns.
 *
 * <p>Safe for concurrent use.
 */
public final class InstanceLifecycleManager {

  private static final System.Logger LOGGER =
      System.getLogger(InstanceLifecycleManager.class.getName());

  static final String FINAL_SNAPSHOT_SUFFIX = "-final-snapshot";

  private final RdsClient rds;
  private final TagStore tagStore;
  private final VersionResolver versions;

  public InstanceLifecycleManager(
      final RdsClient rds, final TagStore tagStore, final VersionResolver versions) {
    this.rds = Objects.requireNonNull(rds, "rds");
    this.tagStore = Objects.requireNonNull(tagStore, "tagStore");
    this.versions = Objects.requireNonNull(versions, "versions");
  }

  /** Wires a manager with its own tag cache on top of {@code rds}. */
  public static InstanceLifecycleManager create(final RdsClient rds, final Duration tagCacheTtl) {
    return new InstanceLifecycleManager(
        rds,
        new TagStore(new RdsTagSource(rds), tagCacheTtl, Clock.systemUTC()),
        new VersionResolver(rds));
  }

  public TagStore tagStore() {
    return tagStore;
  }

  public InstanceDescriptor describe(final String id) {
    return describe(id, false);
  }

  /**
   * Reads one instance.
   *
   * @param id instance identifier
   * @param refreshTags bypass the tag cache
   * @throws NotFoundException when no instance has that identifier
   */
  public InstanceDescriptor describe(final String id, final boolean refreshTags) {
    return toDescriptor(find(id), refreshTags);
  }

  /**
   * Lists every instance carrying the tag {@code key=value}, in provider enumeration order.
   *
   * @param refreshTags bypass the tag cache for every instance examined
   */
  public List<InstanceDescriptor> describeByTag(
      final String key, final String value, final boolean refreshTags) {
    final var matches = new ArrayList<InstanceDescriptor>();
    for (final var instance : RdsPages.instances(rds, DescribeDbInstancesRequest.builder().build())) {
      final var tags = tags(instance.dbInstanceArn(), refreshTags);
      if (value.equals(tags.get(key))) {
        matches.add(InstanceDescriptor.from(instance, tags));
      }
    }
    return matches;
  }

  /** Lists the snapshots of one instance, newest first. */
  public List<SnapshotDescriptor> describeSnapshots(final String instanceId) {
    final var request = DescribeDbSnapshotsRequest.builder().dbInstanceIdentifier(instanceId).build();
    return RdsPages.snapshots(rds, request).stream()
        .map(
            s ->
                new SnapshotDescriptor(
                    s.dbSnapshotIdentifier(),
                    s.dbInstanceIdentifier(),
                    s.dbSnapshotArn(),
                    s.snapshotCreateTime(),
                    tags(s.dbSnapshotArn(), false)))
        .sorted(SnapshotDescriptor.NEWEST_FIRST)
        .toList();
  }

  /**
   * Creates an instance.
   *
   * <p>Unset optional fields are omitted from the request. Boolean flags are always sent, unset
   * meaning {@code false}, and so is the backup retention period, unset meaning 0.
   */
  public void create(final String id, final InstanceSpec spec) {
    final var builder =
        CreateDbInstanceRequest.builder()
            .dbInstanceIdentifier(id)
            .engine(blankToNull(spec.engine()))
            .engineVersion(blankToNull(spec.engineVersion()))
            .dbInstanceClass(blankToNull(spec.dbInstanceClass()))
            .allocatedStorage(spec.allocatedStorage())
            .availabilityZone(blankToNull(spec.availabilityZone()))
            .characterSetName(blankToNull(spec.characterSetName()))
            .dbName(blankToNull(spec.dbName()))
            .dbParameterGroupName(blankToNull(spec.dbParameterGroupName()))
            .dbSubnetGroupName(blankToNull(spec.dbSubnetGroupName()))
            .iops(spec.iops())
            .kmsKeyId(blankToNull(spec.kmsKeyId()))
            .licenseModel(blankToNull(spec.licenseModel()))
            .masterUsername(blankToNull(spec.masterUsername()))
            .masterUserPassword(blankToNull(spec.masterUserPassword()))
            .optionGroupName(blankToNull(spec.optionGroupName()))
            .port(spec.port())
            .preferredBackupWindow(blankToNull(spec.preferredBackupWindow()))
            .preferredMaintenanceWindow(blankToNull(spec.preferredMaintenanceWindow()))
            .storageType(blankToNull(spec.storageType()))
            .autoMinorVersionUpgrade(isTrue(spec.autoMinorVersionUpgrade()))
            .copyTagsToSnapshot(isTrue(spec.copyTagsToSnapshot()))
            .multiAZ(isTrue(spec.multiAz()))
            .publiclyAccessible(isTrue(spec.publiclyAccessible()))
            .storageEncrypted(isTrue(spec.storageEncrypted()))
            .backupRetentionPeriod(
                spec.backupRetentionPeriod() == null ? 0 : spec.backupRetentionPeriod());
    if (!spec.dbSecurityGroups().isEmpty()) builder.dbSecurityGroups(spec.dbSecurityGroups());
    if (!spec.vpcSecurityGroupIds().isEmpty())
      builder.vpcSecurityGroupIds(spec.vpcSecurityGroupIds());
    if (!spec.tags().isEmpty()) builder.tags(toSdkTags(spec.tags()));

    final var request = builder.build();
    LOGGER.log(INFO, "Creating DB instance {0}", id);
    LOGGER.log(DEBUG, "CreateDBInstance request: {0}", request);
    ProviderErrors.run("create " + id, () -> rds.createDBInstance(request));
  }

  /**
   * Modifies an instance, sending only what actually changes.
   *
   * <ul>
   *   <li>a different engine is rejected with {@link EngineMismatchException}
   *   <li>storage is only ever grown; a smaller or equal value is dropped
   *   <li>an engine version matching the current one is dropped, see {@link
   *       VersionResolver#selectVersion}
   *   <li>a subnet or parameter group equal to the current one is dropped
   * </ul>
   *
   * <p>Requested tags are added after the modification succeeded. A tagging failure is logged and
   * does not fail the call.
   */
  public void modify(final String id, final InstanceSpec spec, final boolean applyImmediately) {
    // tags are not needed here and a tag lookup failure must not block the change
    final var current = InstanceDescriptor.from(find(id), Map.of());

    if (spec.engine() != null
        && !spec.engine().isBlank()
        && !spec.engine().equalsIgnoreCase(current.engine())) {
      throw new EngineMismatchException(current.engine(), spec.engine());
    }

    final var builder =
        ModifyDbInstanceRequest.builder()
            .dbInstanceIdentifier(id)
            .applyImmediately(applyImmediately)
            .dbInstanceClass(blankToNull(spec.dbInstanceClass()))
            .autoMinorVersionUpgrade(spec.autoMinorVersionUpgrade())
            .backupRetentionPeriod(spec.backupRetentionPeriod())
            .copyTagsToSnapshot(spec.copyTagsToSnapshot())
            .multiAZ(spec.multiAz())
            .publiclyAccessible(spec.publiclyAccessible())
            .iops(spec.iops())
            .masterUserPassword(blankToNull(spec.masterUserPassword()))
            .optionGroupName(blankToNull(spec.optionGroupName()))
            .preferredBackupWindow(blankToNull(spec.preferredBackupWindow()))
            .preferredMaintenanceWindow(blankToNull(spec.preferredMaintenanceWindow()))
            .storageType(blankToNull(spec.storageType()));
    if (!spec.dbSecurityGroups().isEmpty()) builder.dbSecurityGroups(spec.dbSecurityGroups());
    if (!spec.vpcSecurityGroupIds().isEmpty())
      builder.vpcSecurityGroupIds(spec.vpcSecurityGroupIds());

    if (spec.allocatedStorage() != null && spec.allocatedStorage() > current.allocatedStorage()) {
      builder.allocatedStorage(spec.allocatedStorage());
    }

    final var version =
        versions.selectVersion(current.engine(), current.engineVersion(), spec.engineVersion());
    if (version.changed()) {
      builder.engineVersion(version.version());
      builder.allowMajorVersionUpgrade(version.allowMajorVersionUpgrade());
    }

    final var subnetGroup = blankToNull(spec.dbSubnetGroupName());
    if (subnetGroup != null && !subnetGroup.equals(current.subnetGroup())) {
      builder.dbSubnetGroupName(subnetGroup);
    }
    final var parameterGroup = blankToNull(spec.dbParameterGroupName());
    if (parameterGroup != null && !parameterGroup.equals(current.parameterGroup())) {
      builder.dbParameterGroupName(parameterGroup);
    }

    final var request = builder.build();
    LOGGER.log(INFO, "Modifying DB instance {0} (applyImmediately={1})", id, applyImmediately);
    LOGGER.log(DEBUG, "ModifyDBInstance request: {0}", request);
    ProviderErrors.run("modify " + id, () -> rds.modifyDBInstance(request));

    if (!spec.tags().isEmpty()) {
      try {
        addTagsToResource(current.resourceName(), spec.tags());
      } catch (final BrokerException e) {
        LOGGER.log(WARNING, "DB instance {0} modified but tagging failed: {1}", id, e.getMessage());
      }
    }
  }

  /** Creates instance {@code id} from snapshot {@code snapshotId}. */
  public void restore(final String id, final String snapshotId, final InstanceSpec spec) {
    final var builder =
        RestoreDbInstanceFromDbSnapshotRequest.builder()
            .dbInstanceIdentifier(id)
            .dbSnapshotIdentifier(snapshotId)
            .dbInstanceClass(blankToNull(spec.dbInstanceClass()))
            .engine(blankToNull(spec.engine()))
            .autoMinorVersionUpgrade(spec.autoMinorVersionUpgrade())
            .availabilityZone(blankToNull(spec.availabilityZone()))
            .copyTagsToSnapshot(spec.copyTagsToSnapshot())
            .dbName(blankToNull(spec.dbName()))
            .dbParameterGroupName(blankToNull(spec.dbParameterGroupName()))
            .dbSubnetGroupName(blankToNull(spec.dbSubnetGroupName()))
            .iops(spec.iops())
            .licenseModel(blankToNull(spec.licenseModel()))
            .multiAZ(spec.multiAz())
            .optionGroupName(blankToNull(spec.optionGroupName()))
            .port(spec.port())
            .publiclyAccessible(spec.publiclyAccessible())
            .storageType(blankToNull(spec.storageType()));
    if (!spec.vpcSecurityGroupIds().isEmpty())
      builder.vpcSecurityGroupIds(spec.vpcSecurityGroupIds());
    if (!spec.tags().isEmpty()) builder.tags(toSdkTags(spec.tags()));

    final var request = builder.build();
    LOGGER.log(INFO, "Restoring DB instance {0} from snapshot {1}", id, snapshotId);
    LOGGER.log(DEBUG, "RestoreDBInstanceFromDBSnapshot request: {0}", request);
    ProviderErrors.run("restore " + id, () -> rds.restoreDBInstanceFromDBSnapshot(request));
  }

  /**
   * Creates instance {@code id} from the state of {@code sourceId} at {@code restoreTime}.
   *
   * @param restoreTime point in time, or null for the latest restorable time
   */
  public void restoreToPointInTime(
      final String id, final String sourceId, final Instant restoreTime, final InstanceSpec spec) {
    final var builder =
        RestoreDbInstanceToPointInTimeRequest.builder()
            .targetDBInstanceIdentifier(id)
            .sourceDBInstanceIdentifier(sourceId)
            .dbInstanceClass(blankToNull(spec.dbInstanceClass()))
            .engine(blankToNull(spec.engine()))
            .autoMinorVersionUpgrade(spec.autoMinorVersionUpgrade())
            .availabilityZone(blankToNull(spec.availabilityZone()))
            .copyTagsToSnapshot(spec.copyTagsToSnapshot())
            .dbName(blankToNull(spec.dbName()))
            .dbParameterGroupName(blankToNull(spec.dbParameterGroupName()))
            .dbSubnetGroupName(blankToNull(spec.dbSubnetGroupName()))
            .iops(spec.iops())
            .licenseModel(blankToNull(spec.licenseModel()))
            .multiAZ(spec.multiAz())
            .optionGroupName(blankToNull(spec.optionGroupName()))
            .port(spec.port())
            .publiclyAccessible(spec.publiclyAccessible())
            .storageType(blankToNull(spec.storageType()));
    if (restoreTime != null) {
      builder.restoreTime(restoreTime);
    } else {
      builder.useLatestRestorableTime(true);
    }
    if (!spec.vpcSecurityGroupIds().isEmpty())
      builder.vpcSecurityGroupIds(spec.vpcSecurityGroupIds());
    if (!spec.tags().isEmpty()) builder.tags(toSdkTags(spec.tags()));

    final var request = builder.build();
    LOGGER.log(INFO, "Restoring DB instance {0} from {1} at {2}", id, sourceId, restoreTime);
    LOGGER.log(DEBUG, "RestoreDBInstanceToPointInTime request: {0}", request);
    ProviderErrors.run("restore " + id, () -> rds.restoreDBInstanceToPointInTime(request));
  }

  /**
   * Deletes an instance. Unless {@code skipFinalSnapshot} is set, a final snapshot named {@code
   * <id>-final-snapshot} is taken first.
   */
  public void delete(final String id, final boolean skipFinalSnapshot) {
    final var builder =
        DeleteDbInstanceRequest.builder().dbInstanceIdentifier(id).skipFinalSnapshot(skipFinalSnapshot);
    if (!skipFinalSnapshot) builder.finalDBSnapshotIdentifier(id + FINAL_SNAPSHOT_SUFFIX);
    LOGGER.log(INFO, "Deleting DB instance {0} (skipFinalSnapshot={1})", id, skipFinalSnapshot);
    ProviderErrors.run("delete " + id, () -> rds.deleteDBInstance(builder.build()));
  }

  public void reboot(final String id) {
    reboot(id, false);
  }

  public void reboot(final String id, final boolean forceFailover) {
    final var request =
        RebootDbInstanceRequest.builder()
            .dbInstanceIdentifier(id)
            .forceFailover(forceFailover ? Boolean.TRUE : null)
            .build();
    LOGGER.log(INFO, "Rebooting DB instance {0}", id);
    ProviderErrors.run("reboot " + id, () -> rds.rebootDBInstance(request));
  }

  public Optional<String> getTag(final String id, final String key) {
    return getTag(id, key, false);
  }

  public Optional<String> getTag(final String id, final String key, final boolean refresh) {
    return describe(id, refresh).tag(key);
  }

  public void addTags(final String id, final Map<String, String> tags) {
    addTagsToResource(find(id).dbInstanceArn(), tags);
  }

  public void removeTag(final String id, final String key) {
    final var arn = find(id).dbInstanceArn();
    final var request =
        RemoveTagsFromResourceRequest.builder().resourceName(arn).tagKeys(key).build();
    try {
      ProviderErrors.run("remove tag from " + id, () -> rds.removeTagsFromResource(request));
    } finally {
      tagStore.invalidate(arn);
    }
  }

  /** See {@link VersionResolver#latestMinorUpgrade}. */
  public Optional<String> getLatestMinorVersion(final String engine, final String version) {
    return versions.latestMinorUpgrade(engine, version);
  }

  /** See {@link VersionResolver#fullTargetVersion}. */
  public String getFullValidTargetVersion(
      final String engine, final String currentVersion, final String targetMajor) {
    return versions.fullTargetVersion(engine, currentVersion, targetMajor);
  }

  private DBInstance find(final String id) {
    final var request = DescribeDbInstancesRequest.builder().dbInstanceIdentifier(id).build();
    return ProviderErrors.call("describe " + id, () -> rds.describeDBInstances(request))
        .dbInstances()
        .stream()
        .filter(instance -> id.equals(instance.dbInstanceIdentifier()))
        .findFirst()
        .orElseThrow(() -> new NotFoundException("DB instance " + id + " not found"));
  }

  private InstanceDescriptor toDescriptor(final DBInstance instance, final boolean refreshTags) {
    return InstanceDescriptor.from(instance, tags(instance.dbInstanceArn(), refreshTags));
  }

  private Map<String, String> tags(final String arn, final boolean refresh) {
    return BrokerTags.toMap(tagStore.get(arn, refresh));
  }

  private void addTagsToResource(final String arn, final Map<String, String> tags) {
    final var request =
        AddTagsToResourceRequest.builder().resourceName(arn).tags(toSdkTags(tags)).build();
    try {
      ProviderErrors.run("add tags to " + arn, () -> rds.addTagsToResource(request));
    } finally {
      tagStore.invalidate(arn);
    }
  }

  private static Collection<Tag> toSdkTags(final Map<String, String> tags) {
    return tags.entrySet().stream()
        .map(e -> Tag.builder().key(e.getKey()).value(e.getValue()).build())
        .toList();
  }

  private static String blankToNull(final String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private static boolean isTrue(final Boolean value) {
    return Boolean.TRUE.equals(value);
  }
}
