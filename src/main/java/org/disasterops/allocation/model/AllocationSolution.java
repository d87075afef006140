package org.disasterops.allocation.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Optimizer output. Immutable.
 *
 * <p>Score semantics depend on the producing optimizer: the genetic algorithm reports its
 * fitness as {@code coverageScore}, annealing reports {@code 1 / (1 + cost)}, the Pareto
 * search reports the coverage and speed objectives.</p>
 */
@Value
@Builder
public class AllocationSolution {
    Assignment assignment;
    /** center id -> resource id -> quantity shipped. */
    @Singular
    Map<String, Map<String, Integer>> allocations;
    /** zone id -> resource id -> quantity received. */
    @Singular
    Map<String, Map<String, Integer>> deliveries;
    @Singular
    List<DeliveryRoute> routes;
    double totalCost;
    double coverageScore;
    double timeEfficiency;

    public int allocated(String centerId, String resourceId) {
        return allocations.getOrDefault(centerId, Map.of()).getOrDefault(resourceId, 0);
    }

    public int delivered(String zoneId, String resourceId) {
        return deliveries.getOrDefault(zoneId, Map.of()).getOrDefault(resourceId, 0);
    }
}
