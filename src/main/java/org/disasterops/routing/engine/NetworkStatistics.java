package org.disasterops.routing.engine;

import lombok.Builder;
import lombok.Value;
import org.disasterops.network.RoadCondition;
import org.disasterops.network.TrafficLevel;

import java.util.Map;

/**
 * Aggregate counters of the engine's network, routes and cache.
 */
@Value
@Builder
public class NetworkStatistics {
    int totalSegments;
    int blockedSegments;
    int passableSegments;
    int activeRoutes;
    /** Segment count per traffic level; every level present. */
    Map<TrafficLevel, Integer> trafficDistribution;
    /** Segment count per condition; every condition present. */
    Map<RoadCondition, Integer> conditionDistribution;
    int cacheSize;
}
