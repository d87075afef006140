package org.disasterops.routing.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of one active route.
 */
@Value
@Builder
public class RouteStatus {
    String routeId;
    RouteState state;
    double estimatedTime;
    double totalDistance;
    /** Mean condition times traffic multiplier; infinite while a segment is blocked. */
    double delayFactor;
    int blockedSegments;
    Instant lastUpdated;
    List<String> waypoints;

    static RouteStatus of(DynamicRoute route) {
        int blocked = route.blockedSegmentCount();
        return RouteStatus.builder()
                .routeId(route.getRouteId())
                .state(blocked > 0 ? RouteState.BLOCKED : RouteState.ACTIVE)
                .estimatedTime(route.getEstimatedTime())
                .totalDistance(route.getTotalDistance())
                .delayFactor(route.delayFactor())
                .blockedSegments(blocked)
                .lastUpdated(route.getLastRecalculatedAt())
                .waypoints(route.getWaypoints())
                .build();
    }
}
