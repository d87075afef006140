package org.disasterops.routing.engine;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Expiring origin/destination route cache.
 * <ul>
 * <li>Lock-free lookups on a {@link ConcurrentHashMap}; writers are serialized.</li>
 * <li>Immutable entries replaced atomically.</li>
 * <li>Expiry: an entry is expired when {@code expiresAt <= now} ({@code expiresAt} is exclusive).</li>
 * <li>Lookups never modify the map; expired entries stay until {@link #put} replaces them or
 * {@link #runScheduledSweep} removes them.</li>
 * <li>Hard capacity; the entry closest to expiry is evicted to make room.</li>
 * </ul>
 */
public final class RouteCache {

    public enum LookupState {
        /** No entry for the key. */
        MISSING,
        /** An entry exists but its TTL has elapsed. */
        EXPIRED,
        /** A live entry exists. */
        HIT
    }

    @Getter
    @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
    @Accessors(fluent = true)
    public static final class LookupResult {
        private final LookupState state;
        /** Cached waypoints for HIT, empty otherwise. */
        private final List<String> waypoints;
    }

    private static final LookupResult MISSING_RESULT = new LookupResult(LookupState.MISSING, List.of());
    private static final LookupResult EXPIRED_RESULT = new LookupResult(LookupState.EXPIRED, List.of());

    private record Key(String origin, String destination) {
    }

    private record Entry(List<String> waypoints, Instant expiresAt) {
        boolean traverses(String from, String to) {
            for (int i = 0; i + 1 < waypoints.size(); i++) {
                if (waypoints.get(i).equals(from) && waypoints.get(i + 1).equals(to)) {
                    return true;
                }
            }
            return false;
        }
    }

    private final ConcurrentHashMap<Key, Entry> entries = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    @Getter
    @Accessors(fluent = true)
    private final Duration ttl;
    @Getter
    @Accessors(fluent = true)
    private final int maxEntries;

    public RouteCache(Duration ttl, int maxEntries) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
    }

    public LookupResult lookup(String origin, String destination, Instant now) {
        Key key = new Key(origin, destination);
        Entry entry = entries.get(key);
        if (entry == null) {
            return MISSING_RESULT;
        }
        if (!entry.expiresAt().isAfter(now)) {
            return EXPIRED_RESULT;
        }
        return new LookupResult(LookupState.HIT, entry.waypoints());
    }

    /**
     * Stores or replaces the route for {@code origin -> destination}, expiring at {@code now + ttl}.
     */
    public void put(String origin, String destination, List<String> waypoints, Instant now) {
        Key key = new Key(origin, destination);
        Entry entry = new Entry(List.copyOf(waypoints), now.plus(ttl));
        writeLock.lock();
        try {
            if (!entries.containsKey(key) && entries.size() >= maxEntries) {
                removeExpiredLocked(now, Integer.MAX_VALUE);
                if (entries.size() >= maxEntries) {
                    evictOldestExpiryLocked();
                }
            }
            entries.put(key, entry);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drops every entry whose path uses the directed segment {@code from -> to}.
     *
     * @return number of removed entries.
     */
    public int invalidateTraversing(String from, String to) {
        writeLock.lock();
        try {
            int removed = 0;
            for (Map.Entry<Key, Entry> mapEntry : entries.entrySet()) {
                Entry current = mapEntry.getValue();
                if (current.traverses(from, to) && entries.remove(mapEntry.getKey(), current)) {
                    removed++;
                }
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes expired entries.
     *
     * @param maxRemovals max entries to remove; {@code <= 0} means unbounded.
     * @return number of removed entries.
     */
    public int runScheduledSweep(Instant now, int maxRemovals) {
        writeLock.lock();
        try {
            return removeExpiredLocked(now, maxRemovals <= 0 ? Integer.MAX_VALUE : maxRemovals);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Entry count; expired entries count until removed.
     */
    public int size() {
        return entries.size();
    }

    public void clear() {
        writeLock.lock();
        try {
            entries.clear();
        } finally {
            writeLock.unlock();
        }
    }

    private int removeExpiredLocked(Instant now, int limit) {
        int removed = 0;
        for (Map.Entry<Key, Entry> mapEntry : entries.entrySet()) {
            if (removed >= limit) {
                break;
            }
            Entry current = mapEntry.getValue();
            if (!current.expiresAt().isAfter(now) && entries.remove(mapEntry.getKey(), current)) {
                removed++;
            }
        }
        return removed;
    }

    private void evictOldestExpiryLocked() {
        Key oldestKey = null;
        Instant oldest = null;
        for (Map.Entry<Key, Entry> mapEntry : entries.entrySet()) {
            Instant expiresAt = mapEntry.getValue().expiresAt();
            if (oldest == null || expiresAt.isBefore(oldest)) {
                oldest = expiresAt;
                oldestKey = mapEntry.getKey();
            }
        }
        if (oldestKey != null) {
            entries.remove(oldestKey);
        }
    }
}
