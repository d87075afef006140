package org.disasterops.allocation.model;

/**
 * Chosen {@code center -> zone} delivery of a solution.
 *
 * @param travelCost shortest-path travel time; {@code +INF} when unreachable.
 */
public record DeliveryRoute(String centerId, String zoneId, double travelCost, boolean reachable) {
}
