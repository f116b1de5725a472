package com.example.rdsbroker.core.aws;

import java.util.ArrayList;
import java.util.List;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DBSnapshot;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbSnapshotsRequest;

/** Marker-driven pagination over RDS describe calls, with provider errors translated. */
public final class RdsPages {

  private RdsPages() {}

  public static List<DBInstance> instances(
      final RdsClient rds, final DescribeDbInstancesRequest request) {
    final var result = new ArrayList<DBInstance>();
    String marker = null;
    do {
      final var page = request.toBuilder().marker(marker).build();
      final var response = ProviderErrors.call("describe DB instances", () -> rds.describeDBInstances(page));
      if (response.hasDbInstances()) result.addAll(response.dbInstances());
      marker = response.marker();
    } while (marker != null && !marker.isEmpty());
    return result;
  }

  public static List<DBSnapshot> snapshots(
      final RdsClient rds, final DescribeDbSnapshotsRequest request) {
    final var result = new ArrayList<DBSnapshot>();
    String marker = null;
    do {
      final var page = request.toBuilder().marker(marker).build();
      final var response = ProviderErrors.call("describe DB snapshots", () -> rds.describeDBSnapshots(page));
      if (response.hasDbSnapshots()) result.addAll(response.dbSnapshots());
      marker = response.marker();
    } while (marker != null && !marker.isEmpty());
    return result;
  }
}
