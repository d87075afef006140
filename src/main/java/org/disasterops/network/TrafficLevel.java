package org.disasterops.network;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Congestion level of a road segment and its travel-time multiplier.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum TrafficLevel {
    LIGHT(1.0d),
    MODERATE(1.3d),
    HEAVY(1.8d),
    SEVERE(2.5d);

    private final double multiplier;
}
