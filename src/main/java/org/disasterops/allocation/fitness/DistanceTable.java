package org.disasterops.allocation.fitness;

import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.network.NetworkGraph;
import org.disasterops.routing.search.EdgeMetric;
import org.disasterops.routing.search.RouteSearch;

import java.util.List;

/**
 * Center-to-zone travel times, one one-to-many search per center.
 *
 * <p>Pairs without a path (or with an endpoint missing from the graph) are {@code +INF}.</p>
 */
public final class DistanceTable {
    private final double[][] travelCost;
    private final int unreachablePairs;

    private DistanceTable(double[][] travelCost) {
        this.travelCost = travelCost;
        int unreachable = 0;
        for (double[] row : travelCost) {
            for (double cost : row) {
                if (!Double.isFinite(cost)) {
                    unreachable++;
                }
            }
        }
        this.unreachablePairs = unreachable;
    }

    public static DistanceTable compute(List<ReliefCenter> centers, List<DisasterZone> zones, NetworkGraph graph) {
        RouteSearch search = new RouteSearch(graph);
        double[][] table = new double[centers.size()][zones.size()];
        for (int c = 0; c < centers.size(); c++) {
            double[] costs = search.costsFrom(centers.get(c).id(), EdgeMetric.TIME);
            for (int z = 0; z < zones.size(); z++) {
                int node = graph.nodeIndex(zones.get(z).id());
                table[c][z] = node < 0 ? Double.POSITIVE_INFINITY : costs[node];
            }
        }
        return new DistanceTable(table);
    }

    public double travelCost(int centerIndex, int zoneIndex) {
        return travelCost[centerIndex][zoneIndex];
    }

    public boolean isReachable(int centerIndex, int zoneIndex) {
        return Double.isFinite(travelCost[centerIndex][zoneIndex]);
    }

    public int unreachablePairs() {
        return unreachablePairs;
    }
}
