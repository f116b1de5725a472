package com.example.rdsbroker.core.snapshots;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

import com.example.rdsbroker.core.MutableClock;
import com.example.rdsbroker.core.errors.BrokerException;
import com.example.rdsbroker.core.tags.RdsTagSource;
import com.example.rdsbroker.core.tags.TagStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.*;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBSnapshot;
import software.amazon.awssdk.services.rds.model.DeleteDbSnapshotRequest;
import software.amazon.awssdk.services.rds.model.DeleteDbSnapshotResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbSnapshotsRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbSnapshotsResponse;
import software.amazon.awssdk.services.rds.model.ListTagsForResourceRequest;
import software.amazon.awssdk.services.rds.model.ListTagsForResourceResponse;
import software.amazon.awssdk.services.rds.model.RdsException;
import software.amazon.awssdk.services.rds.model.Tag;

public class SnapshotRetentionManagerTest {

  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private RdsClient rds;
  private SnapshotRetentionManager manager;

  @BeforeEach
  void setUp() {
    rds = mock(RdsClient.class);
    final var clock = new MutableClock(NOW);
    manager =
        new SnapshotRetentionManager(
            rds, new TagStore(new RdsTagSource(rds), Duration.ofDays(7), clock), clock);
    when(rds.deleteDBSnapshot(any(DeleteDbSnapshotRequest.class)))
        .thenReturn(DeleteDbSnapshotResponse.builder().build());
  }

  private static DBSnapshot snapshot(final String id, final Instant created) {
    return DBSnapshot.builder()
        .dbSnapshotIdentifier(id)
        .dbSnapshotArn("arn:" + id)
        .snapshotCreateTime(created)
        .build();
  }

  private void givenSnapshots(final DBSnapshot... snapshots) {
    when(rds.describeDBSnapshots(any(DescribeDbSnapshotsRequest.class)))
        .thenReturn(DescribeDbSnapshotsResponse.builder().dbSnapshots(snapshots).build());
  }

  private void givenOwner(final String id, final String broker) {
    when(rds.listTagsForResource(
            argThat((ListTagsForResourceRequest r) -> r != null && r.resourceName().equals("arn:" + id))))
        .thenReturn(
            ListTagsForResourceResponse.builder()
                .tagList(Tag.builder().key("Broker Name").value(broker).build())
                .build());
  }

  private static RdsException error(final String code) {
    return (RdsException)
        RdsException.builder()
            .statusCode(400)
            .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(code).build())
            .build();
  }

  @Test
  @DisplayName("Should delete only old snapshots owned by this broker")
  void shouldDeleteOldOwnedSnapshots() {
    givenSnapshots(
        snapshot("old-mine", NOW.minus(Duration.ofDays(40))),
        snapshot("old-theirs", NOW.minus(Duration.ofDays(40))),
        snapshot("new-mine", NOW.minus(Duration.ofDays(2))),
        snapshot("in-progress", null));
    givenOwner("old-mine", "broker-a");
    givenOwner("old-theirs", "broker-b");
    givenOwner("new-mine", "broker-a");

    final var deleted = manager.deleteSnapshots("broker-a", 35);

    assertEquals(List.of("old-mine"), deleted);
    verify(rds, times(1)).deleteDBSnapshot(any(DeleteDbSnapshotRequest.class));
    verify(rds)
        .deleteDBSnapshot(
            argThat((DeleteDbSnapshotRequest r) -> r.dbSnapshotIdentifier().equals("old-mine")));
  }

  @Test
  @DisplayName("Should only list manual snapshots")
  void shouldListManualSnapshots() {
    givenSnapshots();

    manager.deleteSnapshots("broker-a", 35);

    verify(rds)
        .describeDBSnapshots(
            argThat((DescribeDbSnapshotsRequest r) -> "manual".equals(r.snapshotType())));
  }

  @Test
  @DisplayName("Should delete nothing when a tag lookup fails")
  void shouldDeleteNothingWhenTagLookupFails() {
    givenSnapshots(
        snapshot("a", NOW.minus(Duration.ofDays(40))), snapshot("b", NOW.minus(Duration.ofDays(40))));
    givenOwner("a", "broker-a");
    when(rds.listTagsForResource(
            argThat((ListTagsForResourceRequest r) -> r != null && r.resourceName().equals("arn:b"))))
        .thenThrow(error("Throttling"));

    final var e = assertThrows(BrokerException.class, () -> manager.deleteSnapshots("broker-a", 35));

    assertTrue(e.getMessage().startsWith("failed to list tags for b"));
    verify(rds, never()).deleteDBSnapshot(any(DeleteDbSnapshotRequest.class));
  }

  @Test
  @DisplayName("Should report a listing failure")
  void shouldReportListingFailure() {
    when(rds.describeDBSnapshots(any(DescribeDbSnapshotsRequest.class)))
        .thenThrow(error("Throttling"));

    final var e = assertThrows(BrokerException.class, () -> manager.deleteSnapshots("broker-a", 35));

    assertTrue(e.getMessage().startsWith("failed to fetch snapshot list from AWS API"));
  }

  @Test
  @DisplayName("Should abort the batch on the first hard delete failure")
  void shouldAbortOnFirstDeleteFailure() {
    givenSnapshots(
        snapshot("a", NOW.minus(Duration.ofDays(40))),
        snapshot("b", NOW.minus(Duration.ofDays(40))),
        snapshot("c", NOW.minus(Duration.ofDays(40))));
    givenOwner("a", "broker-a");
    givenOwner("b", "broker-a");
    givenOwner("c", "broker-a");
    when(rds.deleteDBSnapshot(
            argThat((DeleteDbSnapshotRequest r) -> r != null && r.dbSnapshotIdentifier().equals("b"))))
        .thenThrow(error("InvalidDBSnapshotState"));

    final var e = assertThrows(BrokerException.class, () -> manager.deleteSnapshots("broker-a", 35));

    assertTrue(e.getMessage().startsWith("failed to delete b"));
    verify(rds, never())
        .deleteDBSnapshot(argThat((DeleteDbSnapshotRequest r) -> r.dbSnapshotIdentifier().equals("c")));
  }

  @Test
  @DisplayName("Should treat an already deleted snapshot as deleted")
  void shouldTolerateAlreadyDeleted() {
    givenSnapshots(snapshot("a", NOW.minus(Duration.ofDays(40))));
    givenOwner("a", "broker-a");
    when(rds.deleteDBSnapshot(any(DeleteDbSnapshotRequest.class)))
        .thenThrow(error("DBSnapshotNotFound"));

    assertEquals(List.of("a"), manager.deleteSnapshots("broker-a", 35));
  }
}
