package org.disasterops.network;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Physical state of a road segment and the travel-time multiplier it implies.
 *
 * <p>{@link #BLOCKED} carries an infinite multiplier; blocked segments are never part of a
 * routable graph.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum RoadCondition {
    EXCELLENT(1.0d),
    GOOD(1.2d),
    FAIR(1.5d),
    POOR(2.0d),
    DAMAGED(3.0d),
    BLOCKED(Double.POSITIVE_INFINITY);

    private final double multiplier;

    public boolean isBlocked() {
        return this == BLOCKED;
    }
}
