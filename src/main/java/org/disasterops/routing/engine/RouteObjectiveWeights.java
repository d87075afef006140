package org.disasterops.routing.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Weights of the single-path multi-criteria cost
 * {@code time * wTime + distance * wDistance + delayFactor * wCondition}.
 */
@Value
@Builder
public class RouteObjectiveWeights {
    @Builder.Default
    double time = 1.0d;
    @Builder.Default
    double distance = 0.5d;
    @Builder.Default
    double condition = 0.3d;

    public static RouteObjectiveWeights defaults() {
        return RouteObjectiveWeights.builder().build();
    }

    public RouteObjectiveWeights validate() {
        requireWeight("time", time);
        requireWeight("distance", distance);
        requireWeight("condition", condition);
        if (time + distance + condition <= 0.0d) {
            throw new RoutingEngineException(
                    RoutingEngineException.REASON_INVALID_CONFIG,
                    "at least one route objective weight must be positive"
            );
        }
        return this;
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new RoutingEngineException(
                    RoutingEngineException.REASON_INVALID_CONFIG,
                    name + " weight must be finite and >= 0, got " + value
            );
        }
    }
}
