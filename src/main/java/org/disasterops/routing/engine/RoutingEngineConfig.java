package org.disasterops.routing.engine;

import lombok.Builder;
import lombok.Value;
import org.disasterops.network.RoadCondition;

import java.time.Duration;

/**
 * Immutable tuning of {@link DynamicRoutingEngine}.
 */
@Value
@Builder
public class RoutingEngineConfig {
    /** Lifetime of a cached origin/destination route. */
    @Builder.Default
    Duration cacheTtl = Duration.ofMinutes(5);
    /** Cache capacity; the entry closest to expiry is evicted when full. */
    @Builder.Default
    int maxCachedRoutes = 10_000;
    /** Entries kept per segment in condition and traffic history. */
    @Builder.Default
    int historyLimit = 100;
    /** Queries at or above this priority use A* instead of Dijkstra. */
    @Builder.Default
    int aStarPriorityThreshold = 4;
    /** Priority attached to routes produced by alternative-route queries. */
    @Builder.Default
    int alternativeRoutePriority = 3;
    /** Condition of every segment created by {@link DynamicRoutingEngine#initializeNetwork}. */
    @Builder.Default
    RoadCondition defaultCondition = RoadCondition.GOOD;
    /** Active routes tracked at once; the oldest registration is dropped beyond this. */
    @Builder.Default
    int maxActiveRoutes = 10_000;

    public static RoutingEngineConfig defaults() {
        return RoutingEngineConfig.builder().build();
    }

    /**
     * @return this config.
     * @throws RoutingEngineException when a field is out of range.
     */
    public RoutingEngineConfig validate() {
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw invalid("cacheTtl must be positive, got " + cacheTtl);
        }
        if (maxCachedRoutes <= 0) {
            throw invalid("maxCachedRoutes must be > 0, got " + maxCachedRoutes);
        }
        if (historyLimit <= 0) {
            throw invalid("historyLimit must be > 0, got " + historyLimit);
        }
        if (aStarPriorityThreshold < 1) {
            throw invalid("aStarPriorityThreshold must be >= 1, got " + aStarPriorityThreshold);
        }
        if (alternativeRoutePriority < 1 || alternativeRoutePriority > 5) {
            throw invalid("alternativeRoutePriority must be in [1,5], got " + alternativeRoutePriority);
        }
        if (defaultCondition == null || defaultCondition.isBlocked()) {
            throw invalid("defaultCondition must be a passable condition, got " + defaultCondition);
        }
        if (maxActiveRoutes <= 0) {
            throw invalid("maxActiveRoutes must be > 0, got " + maxActiveRoutes);
        }
        return this;
    }

    private static RoutingEngineException invalid(String message) {
        return new RoutingEngineException(RoutingEngineException.REASON_INVALID_CONFIG, message);
    }
}
