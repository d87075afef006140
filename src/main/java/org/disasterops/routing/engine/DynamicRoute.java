package org.disasterops.routing.engine;

import lombok.Builder;
import lombok.Value;
import org.disasterops.network.RouteSegment;
import org.disasterops.network.SegmentKey;

import java.time.Instant;
import java.util.List;

/**
 * Immutable materialized route.
 *
 * <p>Total distance and estimated time are sums over {@code segments}. The engine replaces
 * the whole value on recalculation, so readers never see a partially updated route.</p>
 */
@Value
@Builder(toBuilder = true)
public class DynamicRoute {
    String routeId;
    String origin;
    String destination;
    List<String> waypoints;
    List<RouteSegment> segments;
    double totalDistance;
    double estimatedTime;
    int priority;
    Instant createdAt;
    Instant lastRecalculatedAt;

    static DynamicRoute materialize(
            String routeId,
            List<String> waypoints,
            List<RouteSegment> segments,
            int priority,
            Instant now
    ) {
        return DynamicRoute.builder()
                .routeId(routeId)
                .origin(waypoints.get(0))
                .destination(waypoints.get(waypoints.size() - 1))
                .waypoints(List.copyOf(waypoints))
                .segments(List.copyOf(segments))
                .totalDistance(sumDistance(segments))
                .estimatedTime(sumTime(segments))
                .priority(priority)
                .createdAt(now)
                .lastRecalculatedAt(now)
                .build();
    }

    /**
     * Same path with current segment records; sums are recomputed, waypoints are kept.
     */
    DynamicRoute recalculated(List<RouteSegment> currentSegments, Instant now) {
        return toBuilder()
                .segments(List.copyOf(currentSegments))
                .totalDistance(sumDistance(currentSegments))
                .estimatedTime(sumTime(currentSegments))
                .lastRecalculatedAt(now)
                .build();
    }

    public boolean traverses(SegmentKey key) {
        for (RouteSegment segment : segments) {
            if (segment.getFrom().equals(key.from()) && segment.getTo().equals(key.to())) {
                return true;
            }
        }
        return false;
    }

    public int blockedSegmentCount() {
        int blocked = 0;
        for (RouteSegment segment : segments) {
            if (!segment.isPassable()) {
                blocked++;
            }
        }
        return blocked;
    }

    /**
     * Mean of condition times traffic multipliers; {@code 1.0} for a zero-segment route.
     */
    public double delayFactor() {
        if (segments.isEmpty()) {
            return 1.0d;
        }
        double sum = 0.0d;
        for (RouteSegment segment : segments) {
            sum += segment.delayFactor();
        }
        return sum / segments.size();
    }

    private static double sumDistance(List<RouteSegment> segments) {
        double total = 0.0d;
        for (RouteSegment segment : segments) {
            total += segment.getBaseDistance();
        }
        return total;
    }

    private static double sumTime(List<RouteSegment> segments) {
        double total = 0.0d;
        for (RouteSegment segment : segments) {
            total += segment.effectiveTime();
        }
        return total;
    }
}
