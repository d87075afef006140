package org.disasterops.network;

import java.util.Objects;

/**
 * Directed {@code (from, to)} key of a road segment.
 */
public record SegmentKey(String from, String to) {

    public SegmentKey {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static SegmentKey of(String from, String to) {
        return new SegmentKey(from, to);
    }

    @Override
    public String toString() {
        return from + "->" + to;
    }
}
