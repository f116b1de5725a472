package com.example.rdsbroker.housekeeping;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.rdsbroker.core.errors.ProviderException;
import com.example.rdsbroker.core.snapshots.SnapshotRetentionManager;
import java.util.List;
import org.junit.jupiter.api.*;

public class SnapshotHousekeeperTest {

  @Test
  void shouldDeleteSnapshotsOfTheBroker() {
    final var retention = mock(SnapshotRetentionManager.class);
    when(retention.deleteSnapshots("my-broker", 7)).thenReturn(List.of("s1", "s2"));

    new SnapshotHousekeeper(retention, "my-broker", 7).run();

    verify(retention).deleteSnapshots("my-broker", 7);
  }

  @Test
  void providerFailuresShouldNotEscape() {
    final var retention = mock(SnapshotRetentionManager.class);
    when(retention.deleteSnapshots(anyString(), anyInt()))
        .thenThrow(new ProviderException("Throttling", "slow down", null));

    assertDoesNotThrow(() -> new SnapshotHousekeeper(retention, "my-broker", 7).run());
  }
}
