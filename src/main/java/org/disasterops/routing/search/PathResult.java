package org.disasterops.routing.search;

import java.util.List;

/**
 * Point-to-point search output.
 *
 * @param reachable whether the destination is reachable from the origin.
 * @param cost total path cost, {@code +INF} when unreachable.
 * @param waypoints location ids from origin to destination, empty when unreachable.
 * @param settledNodes number of nodes settled by the search.
 */
public record PathResult(boolean reachable, double cost, List<String> waypoints, int settledNodes) {

    public PathResult {
        waypoints = List.copyOf(waypoints);
    }

    public static PathResult unreachable(int settledNodes) {
        return new PathResult(false, Double.POSITIVE_INFINITY, List.of(), settledNodes);
    }
}
