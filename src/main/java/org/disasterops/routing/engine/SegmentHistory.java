package org.disasterops.routing.engine;

import org.disasterops.network.SegmentKey;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded per-segment change log; the oldest entry is dropped once a segment reaches the limit.
 *
 * <p>Not thread-safe; the engine lock guards it.</p>
 */
final class SegmentHistory<T> {
    private final int limit;
    private final Map<SegmentKey, Deque<HistoryEntry<T>>> entries = new HashMap<>();

    SegmentHistory(int limit) {
        this.limit = limit;
    }

    void record(SegmentKey key, T value, Instant at) {
        Deque<HistoryEntry<T>> log = entries.computeIfAbsent(key, ignored -> new ArrayDeque<>());
        if (log.size() == limit) {
            log.removeFirst();
        }
        log.addLast(new HistoryEntry<>(at, value));
    }

    List<HistoryEntry<T>> entries(SegmentKey key) {
        Deque<HistoryEntry<T>> log = entries.get(key);
        return log == null ? List.of() : List.copyOf(log);
    }

    void clear() {
        entries.clear();
    }
}
