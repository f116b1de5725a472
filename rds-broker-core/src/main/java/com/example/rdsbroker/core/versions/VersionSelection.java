package com.example.rdsbroker.core.versions;

/**
 * Outcome of {@link VersionResolver#selectVersion}.
 *
 * @param version the version to run
 * @param changed whether {@code version} differs from the instance's current version
 * @param allowMajorVersionUpgrade whether the provider must be told a major upgrade is intended
 */
public record VersionSelection(String version, boolean changed, boolean allowMajorVersionUpgrade) {

  static VersionSelection keep(final String current) {
    return new VersionSelection(current, false, false);
  }
}
