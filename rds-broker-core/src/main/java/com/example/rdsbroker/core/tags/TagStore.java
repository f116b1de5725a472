package com.example.rdsbroker.core.tags;

import static java.lang.System.Logger.Level.DEBUG;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Read-through cache of resource tags keyed by resource identifier.
 *
 * <p>Reads never take a lock: entries are immutable and swapped atomically. Refreshes of the same
 * key are serialized through a per-key lock so concurrent misses issue a single remote call, while
 * refreshes of different keys proceed independently. A key lock lives only while some caller
 * holds or waits for it.
 *
 * <p>{@link #invalidate} waits for an in-flight refresh of the same key, and a refresh that
 * overlaps {@link #clear} does not repopulate the cache.
 *
 * <p>A remote failure leaves any previous entry in place and propagates. A {@link Duration#ZERO}
 * TTL disables caching; every call then goes to the {@link TagSource}.
 */
public final class TagStore {

  private static final System.Logger LOGGER = System.getLogger(TagStore.class.getName());

  /** One week, the historical default for broker tag caching. */
  public static final Duration DEFAULT_TTL = Duration.ofDays(7);

  private final TagSource source;
  private final Duration ttl;
  private final Clock clock;
  private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
  private final AtomicLong clears = new AtomicLong();

  public TagStore(final TagSource source) {
    this(source, DEFAULT_TTL, Clock.systemUTC());
  }

  public TagStore(final TagSource source, final Duration ttl, final Clock clock) {
    this.source = Objects.requireNonNull(source, "source");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
  }

  /**
   * Returns the tags of a resource.
   *
   * @param resourceId provider resource name
   * @param forceRefresh bypass any cached entry and repopulate it
   * @return tags in provider order
   */
  public List<Tag> get(final String resourceId, final boolean forceRefresh) {
    Objects.requireNonNull(resourceId, "resourceId");
    if (!forceRefresh) {
      final var cached = fresh(resourceId);
      if (cached.isPresent()) return cached.get();
    }

    final var lock = acquire(resourceId);
    try {
      if (!forceRefresh) {
        // another caller may have refreshed while we waited
        final var cached = fresh(resourceId);
        if (cached.isPresent()) return cached.get();
      }
      LOGGER.log(DEBUG, "Fetching tags for {0} (forceRefresh={1})", resourceId, forceRefresh);
      final var clearsBefore = clears.get();
      final var tags = List.copyOf(source.fetch(resourceId));
      final var entry = new CacheEntry(tags, clock.instant());
      entries.put(resourceId, entry);
      if (clears.get() != clearsBefore) entries.remove(resourceId, entry);
      return tags;
    } finally {
      release(resourceId, lock);
    }
  }

  /** Drops the cached entry for a resource; the next {@link #get} goes remote. */
  public void invalidate(final String resourceId) {
    final var lock = acquire(resourceId);
    try {
      entries.remove(resourceId);
    } finally {
      release(resourceId, lock);
    }
  }

  /** Drops every cached entry. */
  public void clear() {
    clears.incrementAndGet();
    entries.clear();
  }

  /** Number of key locks currently alive. */
  int lockCount() {
    return locks.size();
  }

  private KeyLock acquire(final String resourceId) {
    final var keyLock =
        locks.compute(
            resourceId,
            (k, existing) -> {
              final var held = existing == null ? new KeyLock() : existing;
              held.users++;
              return held;
            });
    keyLock.lock.lock();
    return keyLock;
  }

  private void release(final String resourceId, final KeyLock keyLock) {
    keyLock.lock.unlock();
    locks.computeIfPresent(resourceId, (k, existing) -> --existing.users == 0 ? null : existing);
  }

  private Optional<List<Tag>> fresh(final String resourceId) {
    final var now = clock.instant();
    return Optional.ofNullable(entries.get(resourceId))
        .filter(entry -> entry.expiresAt(ttl).isAfter(now))
        .map(CacheEntry::tags);
  }

  /** Per-key lock; {@code users} is only touched inside {@code locks.compute*}. */
  private static final class KeyLock {
    private final ReentrantLock lock = new ReentrantLock();
    private int users;
  }

  private record CacheEntry(List<Tag> tags, Instant fetchedAt) {
    Instant expiresAt(final Duration ttl) {
      return fetchedAt.plus(ttl);
    }
  }
}
