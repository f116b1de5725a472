package com.example.rdsbroker.core.versions;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.rdsbroker.core.aws.ProviderErrors;
import com.example.rdsbroker.core.errors.AmbiguousVersionException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBEngineVersion;
import software.amazon.awssdk.services.rds.model.DescribeDbEngineVersionsRequest;
import software.amazon.awssdk.services.rds.model.UpgradeTarget;

/** Engine version comparison and upgrade-target lookup. */
public final class VersionResolver {

  private static final System.Logger LOGGER = System.getLogger(VersionResolver.class.getName());

  private final RdsClient rds;

  public VersionResolver(final RdsClient rds) {
    this.rds = Objects.requireNonNull(rds, "rds");
  }

  /**
   * Decides which version a modification should send.
   *
   * <p>Only as many components as {@code requestedVersion} carries are compared: re-specifying
   * "11" or "11.5" on an instance running "11.5.2" keeps "11.5.2". Any mismatch adopts the
   * requested version as-is and allows a major upgrade when its "major:minor" pair sorts after the
   * current one.
   *
   * @param engine engine name, for diagnostics
   * @param currentVersion version the instance runs now
   * @param requestedVersion version asked for, null or blank for "no preference"
   * @return selected version
   */
  public VersionSelection selectVersion(
      final String engine, final String currentVersion, final String requestedVersion) {
    if (requestedVersion == null || requestedVersion.isBlank()) {
      return VersionSelection.keep(currentVersion);
    }
    if (currentVersion == null || currentVersion.isBlank()) {
      return new VersionSelection(requestedVersion, true, false);
    }

    final var requested = requestedVersion.split("\\.");
    final var current = currentVersion.split("\\.");
    if (matchesPrefix(requested, current)) {
      LOGGER.log(
          DEBUG,
          "Requested {0} version {1} matches current {2}, keeping it",
          engine,
          requestedVersion,
          currentVersion);
      return VersionSelection.keep(currentVersion);
    }

    final var allowMajor = majorMinor(requested).compareTo(majorMinor(current)) > 0;
    return new VersionSelection(requestedVersion, true, allowMajor);
  }

  /**
   * Finds the newest minor upgrade reachable from a version.
   *
   * @return the last non-major upgrade target in provider order, empty when there is none
   * @throws AmbiguousVersionException when the provider does not know exactly one such version
   */
  public Optional<String> latestMinorUpgrade(final String engine, final String version) {
    final var description = describeExactly(engine, version);
    final var minors =
        targets(description).stream()
            .filter(target -> !Boolean.TRUE.equals(target.isMajorVersionUpgrade()))
            .map(UpgradeTarget::engineVersion)
            .toList();
    return minors.isEmpty() ? Optional.empty() : Optional.of(minors.get(minors.size() - 1));
  }

  /**
   * Resolves a major version moniker such as "12" to the newest concrete version reachable from
   * {@code currentVersion}.
   *
   * @return the concrete version, or "" when the instance already runs that major and no newer
   *     version on it is reachable
   * @throws AmbiguousVersionException when the current version is not uniquely known, or no target
   *     on a different major is reachable
   */
  public String fullTargetVersion(
      final String engine, final String currentVersion, final String targetMajor) {
    Objects.requireNonNull(targetMajor, "targetMajor");
    final var description = describeExactly(engine, currentVersion);
    final var onTargetMajor =
        targets(description).stream()
            .map(UpgradeTarget::engineVersion)
            .filter(candidate -> onMajor(candidate, targetMajor))
            .toList();
    if (!onTargetMajor.isEmpty()) return onTargetMajor.get(onTargetMajor.size() - 1);

    if (onMajor(currentVersion, targetMajor)) return "";
    if (targets(description).isEmpty()) {
      throw new AmbiguousVersionException(
          String.format("%s %s has no upgrade targets", engine, currentVersion));
    }
    throw new AmbiguousVersionException(
        String.format(
            "no upgrade target of %s %s is on major version %s", engine, currentVersion, targetMajor));
  }

  private DBEngineVersion describeExactly(final String engine, final String version) {
    final var request =
        DescribeDbEngineVersionsRequest.builder().engine(engine).engineVersion(version).build();
    final var versions =
        ProviderErrors.call(
                "describe engine version " + engine + " " + version,
                () -> rds.describeDBEngineVersions(request))
            .dbEngineVersions();
    if (versions.size() != 1) {
      throw new AmbiguousVersionException(
          String.format(
              "expected exactly one description of %s %s, got %d",
              engine, version, versions.size()));
    }
    return versions.get(0);
  }

  private static List<UpgradeTarget> targets(final DBEngineVersion description) {
    return description.hasValidUpgradeTarget() ? description.validUpgradeTarget() : List.of();
  }

  private static boolean matchesPrefix(final String[] requested, final String[] current) {
    if (requested.length > current.length) return false;
    for (var i = 0; i < requested.length; i++) {
      if (!requested[i].equals(current[i])) return false;
    }
    return true;
  }

  private static String majorMinor(final String[] parts) {
    return parts[0] + ":" + (parts.length > 1 ? parts[1] : "");
  }

  private static boolean onMajor(final String version, final String major) {
    return version.equals(major) || version.startsWith(major + ".");
  }
}
