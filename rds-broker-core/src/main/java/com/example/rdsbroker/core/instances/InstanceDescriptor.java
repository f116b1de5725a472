package com.example.rdsbroker.core.instances;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DBParameterGroupStatus;
import software.amazon.awssdk.services.rds.model.PendingModifiedValues;

/**
 * The broker's view of a remote instance, rebuilt from the provider on every read.
 *
 * @param identifier instance identifier
 * @param resourceName provider ARN
 * @param status provider lifecycle status, e.g. {@code available}
 * @param engine engine name
 * @param engineVersion engine version
 * @param dbInstanceClass instance class
 * @param dbName initial database name, may be null
 * @param masterUsername master user name
 * @param allocatedStorage allocated storage in GiB
 * @param endpoint network endpoint, null until provisioning completes
 * @param subnetGroup subnet group name, may be null
 * @param parameterGroup first parameter group name, may be null
 * @param storageEncrypted encrypted at rest
 * @param publiclyAccessible publicly accessible
 * @param multiAz multi-AZ deployment
 * @param backupRetentionPeriod automated backup retention in days
 * @param readReplicaIdentifiers identifiers of read replicas
 * @param pendingModifications whether the provider reports a non-empty pending change set
 * @param tags resource tags
 */
public record InstanceDescriptor(
    String identifier,
    String resourceName,
    String status,
    String engine,
    String engineVersion,
    String dbInstanceClass,
    String dbName,
    String masterUsername,
    int allocatedStorage,
    Endpoint endpoint,
    String subnetGroup,
    String parameterGroup,
    boolean storageEncrypted,
    boolean publiclyAccessible,
    boolean multiAz,
    int backupRetentionPeriod,
    List<String> readReplicaIdentifiers,
    boolean pendingModifications,
    Map<String, String> tags) {

  private static final PendingModifiedValues NO_PENDING = PendingModifiedValues.builder().build();

  public InstanceDescriptor {
    readReplicaIdentifiers = List.copyOf(readReplicaIdentifiers);
    tags = Map.copyOf(tags);
  }

  /** Endpoint, present once the instance has finished provisioning. */
  public Optional<Endpoint> findEndpoint() {
    return Optional.ofNullable(endpoint);
  }

  public Optional<String> tag(final String key) {
    return Optional.ofNullable(tags.get(key));
  }

  static InstanceDescriptor from(final DBInstance instance, final Map<String, String> tags) {
    final var endpoint =
        Optional.ofNullable(instance.endpoint())
            .filter(e -> e.address() != null)
            .map(e -> new Endpoint(e.address(), e.port() == null ? 0 : e.port()))
            .orElse(null);
    final var subnetGroup =
        instance.dbSubnetGroup() == null ? null : instance.dbSubnetGroup().dbSubnetGroupName();
    final var parameterGroup =
        instance.hasDbParameterGroups()
            ? instance.dbParameterGroups().stream()
                .map(DBParameterGroupStatus::dbParameterGroupName)
                .findFirst()
                .orElse(null)
            : null;
    final var pending =
        instance.pendingModifiedValues() != null
            && !NO_PENDING.equals(instance.pendingModifiedValues());

    return new InstanceDescriptor(
        instance.dbInstanceIdentifier(),
        instance.dbInstanceArn(),
        instance.dbInstanceStatus(),
        instance.engine(),
        instance.engineVersion(),
        instance.dbInstanceClass(),
        instance.dbName(),
        instance.masterUsername(),
        orZero(instance.allocatedStorage()),
        endpoint,
        subnetGroup,
        parameterGroup,
        Boolean.TRUE.equals(instance.storageEncrypted()),
        Boolean.TRUE.equals(instance.publiclyAccessible()),
        Boolean.TRUE.equals(instance.multiAZ()),
        orZero(instance.backupRetentionPeriod()),
        instance.hasReadReplicaDBInstanceIdentifiers()
            ? instance.readReplicaDBInstanceIdentifiers()
            : List.of(),
        pending,
        tags);
  }

  private static int orZero(final Integer value) {
    return value == null ? 0 : value;
  }
}
