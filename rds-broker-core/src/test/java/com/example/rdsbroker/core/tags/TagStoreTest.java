package com.example.rdsbroker.core.tags;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.rdsbroker.core.MutableClock;
import com.example.rdsbroker.core.errors.ProviderException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

public class TagStoreTest {

  private static final String ARN = "arn:aws:rds:eu-west-1:123:db:db-1";

  private MutableClock clock;
  private TagSource source;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    source = mock(TagSource.class);
    when(source.fetch(ARN)).thenReturn(List.of(new Tag("Broker Name", "b1")));
  }

  @Nested
  @DisplayName("Caching")
  class Caching {

    @Test
    @DisplayName("Should serve repeated reads from cache within TTL")
    void shouldServeFromCache() {
      final var store = new TagStore(source, Duration.ofMinutes(5), clock);

      store.get(ARN, false);
      clock.advance(Duration.ofMinutes(4));
      final var tags = store.get(ARN, false);

      assertEquals(List.of(new Tag("Broker Name", "b1")), tags);
      verify(source, times(1)).fetch(ARN);
    }

    @Test
    @DisplayName("Should refetch after TTL expiry")
    void shouldRefetchAfterExpiry() {
      final var store = new TagStore(source, Duration.ofMinutes(5), clock);

      store.get(ARN, false);
      clock.advance(Duration.ofMinutes(6));
      store.get(ARN, false);

      verify(source, times(2)).fetch(ARN);
    }

    @Test
    @DisplayName("Should bypass cache on forced refresh and repopulate it")
    void shouldBypassOnForceRefresh() {
      final var store = new TagStore(source, Duration.ofMinutes(5), clock);
      store.get(ARN, false);

      when(source.fetch(ARN)).thenReturn(List.of(new Tag("Broker Name", "b2")));
      assertEquals("b2", store.get(ARN, true).get(0).value());
      assertEquals("b2", store.get(ARN, false).get(0).value());
      verify(source, times(2)).fetch(ARN);
    }

    @Test
    @DisplayName("Should not cache with a zero TTL")
    void shouldNotCacheWithZeroTtl() {
      final var store = new TagStore(source, Duration.ZERO, clock);

      store.get(ARN, false);
      store.get(ARN, false);

      verify(source, times(2)).fetch(ARN);
    }

    @Test
    @DisplayName("Should go remote after invalidate")
    void shouldGoRemoteAfterInvalidate() {
      final var store = new TagStore(source, Duration.ofMinutes(5), clock);

      store.get(ARN, false);
      store.invalidate(ARN);
      store.get(ARN, false);

      verify(source, times(2)).fetch(ARN);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should keep the previous entry when a refresh fails")
    void shouldKeepPreviousEntryOnFailure() {
      final var store = new TagStore(source, Duration.ofMinutes(5), clock);
      store.get(ARN, false);

      when(source.fetch(ARN)).thenThrow(new ProviderException("Throttling", "slow down", null));
      assertThrows(ProviderException.class, () -> store.get(ARN, true));

      assertEquals("b1", store.get(ARN, false).get(0).value());
    }

    @Test
    @DisplayName("Should reject a negative TTL")
    void shouldRejectNegativeTtl() {
      assertThrows(
          IllegalArgumentException.class,
          () -> new TagStore(source, Duration.ofSeconds(-1), clock));
    }
  }

  @Test
  @DisplayName("Concurrent misses on one key should issue a single remote call")
  void concurrentMissesShouldCoalesce() throws Exception {
    final var calls = new AtomicInteger();
    final var release = new CountDownLatch(1);
    final TagSource slow =
        id -> {
          calls.incrementAndGet();
          try {
            release.await(5, TimeUnit.SECONDS);
          } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return List.of(new Tag("k", "v"));
        };
    final var store = new TagStore(slow, Duration.ofMinutes(5), clock);

    final var pool = Executors.newFixedThreadPool(4);
    try {
      final var futures =
          List.of(
              pool.submit(() -> store.get(ARN, false)),
              pool.submit(() -> store.get(ARN, false)),
              pool.submit(() -> store.get(ARN, false)),
              pool.submit(() -> store.get(ARN, false)));
      Thread.sleep(100);
      release.countDown();
      for (final var future : futures) assertEquals("v", future.get(5, TimeUnit.SECONDS).get(0).value());
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, calls.get());
  }

  @Nested
  @DisplayName("Key locks")
  class KeyLocks {

    @Test
    @DisplayName("Should not keep a lock per resource once reads are done")
    void shouldReleaseKeyLocks() {
      final TagSource echo = id -> List.of(new Tag("k", id));
      final var store = new TagStore(echo, Duration.ofMinutes(5), clock);

      for (var i = 0; i < 100; i++) {
        store.get("arn:aws:rds:eu-west-1:123:snapshot:s-" + i, false);
        store.invalidate("arn:aws:rds:eu-west-1:123:snapshot:s-" + i);
      }
      store.get(ARN, true);

      assertEquals(0, store.lockCount());
    }

    @Test
    @DisplayName("Invalidate during a refresh should not leave the refreshed value cached")
    void invalidateShouldWaitForInFlightRefresh() throws Exception {
      final var entered = new CountDownLatch(1);
      final var release = new CountDownLatch(1);
      final var calls = new AtomicInteger();
      final TagSource slow =
          id -> {
            if (calls.incrementAndGet() == 1) {
              entered.countDown();
              try {
                release.await(5, TimeUnit.SECONDS);
              } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              return List.of(new Tag("k", "before"));
            }
            return List.of(new Tag("k", "after"));
          };
      final var store = new TagStore(slow, Duration.ofMinutes(5), clock);

      final var reader = new Thread(() -> store.get(ARN, false));
      reader.start();
      assertTrue(entered.await(5, TimeUnit.SECONDS));

      final var invalidator = new Thread(() -> store.invalidate(ARN));
      invalidator.start();
      awaitParked(invalidator);
      release.countDown();
      reader.join(5_000);
      invalidator.join(5_000);

      assertEquals("after", store.get(ARN, false).get(0).value());
      assertEquals(2, calls.get());
      assertEquals(0, store.lockCount());
    }

    @Test
    @DisplayName("Clear during a refresh should not leave the refreshed value cached")
    void clearShouldDiscardInFlightRefresh() throws Exception {
      final var entered = new CountDownLatch(1);
      final var release = new CountDownLatch(1);
      final var calls = new AtomicInteger();
      final TagSource slow =
          id -> {
            if (calls.incrementAndGet() == 1) {
              entered.countDown();
              try {
                release.await(5, TimeUnit.SECONDS);
              } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            }
            return List.of(new Tag("k", "v" + calls.get()));
          };
      final var store = new TagStore(slow, Duration.ofMinutes(5), clock);

      final var reader = new Thread(() -> store.get(ARN, false));
      reader.start();
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      store.clear();
      release.countDown();
      reader.join(5_000);

      assertEquals("v2", store.get(ARN, false).get(0).value());
    }

    private void awaitParked(final Thread thread) throws InterruptedException {
      final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (thread.getState() != Thread.State.WAITING
          && thread.getState() != Thread.State.TERMINATED
          && System.nanoTime() < deadline) {
        Thread.sleep(10);
      }
    }
  }
}
