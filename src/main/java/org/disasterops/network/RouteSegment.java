package org.disasterops.network;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable directed road segment with its current condition and traffic.
 *
 * <p>Updates never mutate a segment; {@code withCondition}/{@code withTraffic} return the
 * replacement record.</p>
 */
@Value
public class RouteSegment {
    String from;
    String to;
    double baseDistance;
    double baseTime;
    @With
    RoadCondition condition;
    @With
    TrafficLevel traffic;
    @With
    Instant lastUpdated;

    /**
     * Null condition or traffic fall back to {@link RoadCondition#GOOD} and
     * {@link TrafficLevel#LIGHT}.
     */
    @Builder(toBuilder = true)
    public RouteSegment(
            String from,
            String to,
            double baseDistance,
            double baseTime,
            RoadCondition condition,
            TrafficLevel traffic,
            Instant lastUpdated
    ) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        if (!Double.isFinite(baseDistance) || baseDistance < 0.0d) {
            throw new IllegalArgumentException("baseDistance must be finite and >= 0 for " + from + "->" + to);
        }
        if (!Double.isFinite(baseTime) || baseTime < 0.0d) {
            throw new IllegalArgumentException("baseTime must be finite and >= 0 for " + from + "->" + to);
        }
        this.baseDistance = baseDistance;
        this.baseTime = baseTime;
        this.condition = condition == null ? RoadCondition.GOOD : condition;
        this.traffic = traffic == null ? TrafficLevel.LIGHT : traffic;
        this.lastUpdated = Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    /**
     * Current traversal time: base time scaled by condition and traffic multipliers.
     * Infinite when the segment is blocked.
     */
    public double effectiveTime() {
        return baseTime * condition.multiplier() * traffic.multiplier();
    }

    /**
     * Product of condition and traffic multipliers.
     */
    public double delayFactor() {
        return condition.multiplier() * traffic.multiplier();
    }

    public boolean isPassable() {
        return !condition.isBlocked();
    }

    public SegmentKey key() {
        return new SegmentKey(from, to);
    }
}
