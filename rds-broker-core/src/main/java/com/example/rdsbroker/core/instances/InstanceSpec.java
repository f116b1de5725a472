package com.example.rdsbroker.core.instances;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Desired properties of an instance, used for create, modify and restore.
 *
 * <p>Every field is optional; {@code null} means "not specified". How unset fields are treated
 * depends on the operation, see {@link InstanceLifecycleManager}.
 *
 * <pre>{@code
 * InstanceSpec spec = InstanceSpec.builder()
 *     .engine("postgres")
 *     .engineVersion("15")
 *     .dbInstanceClass("db.t3.micro")
 *     .allocatedStorage(20)
 *     .tag(BrokerTags.BROKER_NAME, "my-broker")
 *     .build();
 * }</pre>
 */
public final class InstanceSpec {

  private final String dbInstanceClass;
  private final String engine;
  private final String engineVersion;
  private final Integer allocatedStorage;
  private final Boolean autoMinorVersionUpgrade;
  private final String availabilityZone;
  private final Integer backupRetentionPeriod;
  private final String characterSetName;
  private final Boolean copyTagsToSnapshot;
  private final String dbName;
  private final String dbParameterGroupName;
  private final List<String> dbSecurityGroups;
  private final String dbSubnetGroupName;
  private final Integer iops;
  private final String kmsKeyId;
  private final String licenseModel;
  private final String masterUsername;
  private final String masterUserPassword;
  private final Boolean multiAz;
  private final String optionGroupName;
  private final Integer port;
  private final String preferredBackupWindow;
  private final String preferredMaintenanceWindow;
  private final Boolean publiclyAccessible;
  private final Boolean storageEncrypted;
  private final String storageType;
  private final List<String> vpcSecurityGroupIds;
  private final Map<String, String> tags;

  private InstanceSpec(final Builder b) {
    this.dbInstanceClass = b.dbInstanceClass;
    this.engine = b.engine;
    this.engineVersion = b.engineVersion;
    this.allocatedStorage = b.allocatedStorage;
    this.autoMinorVersionUpgrade = b.autoMinorVersionUpgrade;
    this.availabilityZone = b.availabilityZone;
    this.backupRetentionPeriod = b.backupRetentionPeriod;
    this.characterSetName = b.characterSetName;
    this.copyTagsToSnapshot = b.copyTagsToSnapshot;
    this.dbName = b.dbName;
    this.dbParameterGroupName = b.dbParameterGroupName;
    this.dbSecurityGroups = List.copyOf(b.dbSecurityGroups);
    this.dbSubnetGroupName = b.dbSubnetGroupName;
    this.iops = b.iops;
    this.kmsKeyId = b.kmsKeyId;
    this.licenseModel = b.licenseModel;
    this.masterUsername = b.masterUsername;
    this.masterUserPassword = b.masterUserPassword;
    this.multiAz = b.multiAz;
    this.optionGroupName = b.optionGroupName;
    this.port = b.port;
    this.preferredBackupWindow = b.preferredBackupWindow;
    this.preferredMaintenanceWindow = b.preferredMaintenanceWindow;
    this.publiclyAccessible = b.publiclyAccessible;
    this.storageEncrypted = b.storageEncrypted;
    this.storageType = b.storageType;
    this.vpcSecurityGroupIds = List.copyOf(b.vpcSecurityGroupIds);
    this.tags = Map.copyOf(b.tags);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String dbInstanceClass() {
    return dbInstanceClass;
  }

  public String engine() {
    return engine;
  }

  public String engineVersion() {
    return engineVersion;
  }

  public Integer allocatedStorage() {
    return allocatedStorage;
  }

  public Boolean autoMinorVersionUpgrade() {
    return autoMinorVersionUpgrade;
  }

  public String availabilityZone() {
    return availabilityZone;
  }

  public Integer backupRetentionPeriod() {
    return backupRetentionPeriod;
  }

  public String characterSetName() {
    return characterSetName;
  }

  public Boolean copyTagsToSnapshot() {
    return copyTagsToSnapshot;
  }

  public String dbName() {
    return dbName;
  }

  public String dbParameterGroupName() {
    return dbParameterGroupName;
  }

  public List<String> dbSecurityGroups() {
    return dbSecurityGroups;
  }

  public String dbSubnetGroupName() {
    return dbSubnetGroupName;
  }

  public Integer iops() {
    return iops;
  }

  public String kmsKeyId() {
    return kmsKeyId;
  }

  public String licenseModel() {
    return licenseModel;
  }

  public String masterUsername() {
    return masterUsername;
  }

  public String masterUserPassword() {
    return masterUserPassword;
  }

  public Boolean multiAz() {
    return multiAz;
  }

  public String optionGroupName() {
    return optionGroupName;
  }

  public Integer port() {
    return port;
  }

  public String preferredBackupWindow() {
    return preferredBackupWindow;
  }

  public String preferredMaintenanceWindow() {
    return preferredMaintenanceWindow;
  }

  public Boolean publiclyAccessible() {
    return publiclyAccessible;
  }

  public Boolean storageEncrypted() {
    return storageEncrypted;
  }

  public String storageType() {
    return storageType;
  }

  public List<String> vpcSecurityGroupIds() {
    return vpcSecurityGroupIds;
  }

  public Map<String, String> tags() {
    return tags;
  }

  @Override
  public String toString() {
    return "InstanceSpec[engine="
        + engine
        + ", engineVersion="
        + engineVersion
        + ", dbInstanceClass="
        + dbInstanceClass
        + ", allocatedStorage="
        + allocatedStorage
        + ", dbName="
        + dbName
        + ", masterUsername="
        + masterUsername
        + ", masterUserPassword="
        + (masterUserPassword == null ? null : "REDACTED")
        + ", tags="
        + tags
        + "]";
  }

  /** Builder for {@link InstanceSpec}. */
  public static final class Builder {
    private String dbInstanceClass;
    private String engine;
    private String engineVersion;
    private Integer allocatedStorage;
    private Boolean autoMinorVersionUpgrade;
    private String availabilityZone;
    private Integer backupRetentionPeriod;
    private String characterSetName;
    private Boolean copyTagsToSnapshot;
    private String dbName;
    private String dbParameterGroupName;
    private List<String> dbSecurityGroups = List.of();
    private String dbSubnetGroupName;
    private Integer iops;
    private String kmsKeyId;
    private String licenseModel;
    private String masterUsername;
    private String masterUserPassword;
    private Boolean multiAz;
    private String optionGroupName;
    private Integer port;
    private String preferredBackupWindow;
    private String preferredMaintenanceWindow;
    private Boolean publiclyAccessible;
    private Boolean storageEncrypted;
    private String storageType;
    private List<String> vpcSecurityGroupIds = List.of();
    private final Map<String, String> tags = new LinkedHashMap<>();

    private Builder() {}

    public Builder dbInstanceClass(final String dbInstanceClass) {
      this.dbInstanceClass = dbInstanceClass;
      return this;
    }

    public Builder engine(final String engine) {
      this.engine = engine;
      return this;
    }

    public Builder engineVersion(final String engineVersion) {
      this.engineVersion = engineVersion;
      return this;
    }

    public Builder allocatedStorage(final Integer allocatedStorage) {
      if (allocatedStorage != null && allocatedStorage < 0)
        throw new IllegalArgumentException("allocatedStorage must be >= 0");
      this.allocatedStorage = allocatedStorage;
      return this;
    }

    public Builder autoMinorVersionUpgrade(final Boolean autoMinorVersionUpgrade) {
      this.autoMinorVersionUpgrade = autoMinorVersionUpgrade;
      return this;
    }

    public Builder availabilityZone(final String availabilityZone) {
      this.availabilityZone = availabilityZone;
      return this;
    }

    public Builder backupRetentionPeriod(final Integer backupRetentionPeriod) {
      if (backupRetentionPeriod != null && backupRetentionPeriod < 0)
        throw new IllegalArgumentException("backupRetentionPeriod must be >= 0");
      this.backupRetentionPeriod = backupRetentionPeriod;
      return this;
    }

    public Builder characterSetName(final String characterSetName) {
      this.characterSetName = characterSetName;
      return this;
    }

    public Builder copyTagsToSnapshot(final Boolean copyTagsToSnapshot) {
      this.copyTagsToSnapshot = copyTagsToSnapshot;
      return this;
    }

    public Builder dbName(final String dbName) {
      this.dbName = dbName;
      return this;
    }

    public Builder dbParameterGroupName(final String dbParameterGroupName) {
      this.dbParameterGroupName = dbParameterGroupName;
      return this;
    }

    public Builder dbSecurityGroups(final List<String> dbSecurityGroups) {
      this.dbSecurityGroups = Objects.requireNonNull(dbSecurityGroups, "dbSecurityGroups");
      return this;
    }

    public Builder dbSubnetGroupName(final String dbSubnetGroupName) {
      this.dbSubnetGroupName = dbSubnetGroupName;
      return this;
    }

    public Builder iops(final Integer iops) {
      this.iops = iops;
      return this;
    }

    public Builder kmsKeyId(final String kmsKeyId) {
      this.kmsKeyId = kmsKeyId;
      return this;
    }

    public Builder licenseModel(final String licenseModel) {
      this.licenseModel = licenseModel;
      return this;
    }

    public Builder masterUsername(final String masterUsername) {
      this.masterUsername = masterUsername;
      return this;
    }

    public Builder masterUserPassword(final String masterUserPassword) {
      this.masterUserPassword = masterUserPassword;
      return this;
    }

    public Builder multiAz(final Boolean multiAz) {
      this.multiAz = multiAz;
      return this;
    }

    public Builder optionGroupName(final String optionGroupName) {
      this.optionGroupName = optionGroupName;
      return this;
    }

    public Builder port(final Integer port) {
      this.port = port;
      return this;
    }

    public Builder preferredBackupWindow(final String preferredBackupWindow) {
      this.preferredBackupWindow = preferredBackupWindow;
      return this;
    }

    public Builder preferredMaintenanceWindow(final String preferredMaintenanceWindow) {
      this.preferredMaintenanceWindow = preferredMaintenanceWindow;
      return this;
    }

    public Builder publiclyAccessible(final Boolean publiclyAccessible) {
      this.publiclyAccessible = publiclyAccessible;
      return this;
    }

    public Builder storageEncrypted(final Boolean storageEncrypted) {
      this.storageEncrypted = storageEncrypted;
      return this;
    }

    public Builder storageType(final String storageType) {
      this.storageType = storageType;
      return this;
    }

    public Builder vpcSecurityGroupIds(final List<String> vpcSecurityGroupIds) {
      this.vpcSecurityGroupIds = Objects.requireNonNull(vpcSecurityGroupIds, "vpcSecurityGroupIds");
      return this;
    }

    public Builder tag(final String key, final String value) {
      tags.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder tags(final Map<String, String> tags) {
      tags.forEach(this::tag);
      return this;
    }

    public InstanceSpec build() {
      return new InstanceSpec(this);
    }
  }
}
