package com.example.rdsbroker.core.snapshots;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * A manual or automated snapshot as listed by the provider.
 *
 * @param identifier snapshot identifier
 * @param instanceIdentifier identifier of the instance the snapshot was taken from
 * @param resourceName provider ARN
 * @param createdAt creation time, null while the snapshot is still being taken
 * @param tags snapshot tags
 */
public record SnapshotDescriptor(
    String identifier,
    String instanceIdentifier,
    String resourceName,
    Instant createdAt,
    Map<String, String> tags) {

  /** Newest first; snapshots still in progress sort ahead of completed ones. */
  public static final Comparator<SnapshotDescriptor> NEWEST_FIRST =
      Comparator.comparing(
          SnapshotDescriptor::createdAt, Comparator.nullsFirst(Comparator.reverseOrder()));

  public SnapshotDescriptor {
    tags = Map.copyOf(tags);
  }

  public Optional<Instant> findCreatedAt() {
    return Optional.ofNullable(createdAt);
  }
}
