package org.disasterops.routing.heuristic;

import org.disasterops.network.NetworkGraph;

import java.util.function.IntToDoubleFunction;

/**
 * Admissibility calibration for the geographic heuristic.
 *
 * <p>cost_per_km = min over edges with positive great-circle length of
 * (edge cost / great-circle km). Any path from {@code n} to the goal then costs at least
 * {@code cost_per_km * greatCircle(n, goal)} by the triangle inequality.</p>
 */
public final class GeometryLowerBoundModel {
    public static final String REASON_GRAPH_REQUIRED = "HEUR_LB_GRAPH_REQUIRED";
    public static final String REASON_EMPTY_GRAPH = "HEUR_LB_EMPTY_GRAPH";
    public static final String REASON_INVALID_EDGE_COST = "HEUR_LB_INVALID_EDGE_COST";
    public static final String REASON_NO_POSITIVE_DISTANCE_EDGES = "HEUR_LB_NO_POSITIVE_DISTANCE_EDGES";

    private final double lowerBoundCostPerKm;

    private GeometryLowerBoundModel(double lowerBoundCostPerKm) {
        this.lowerBoundCostPerKm = lowerBoundCostPerKm;
    }

    public double lowerBoundCostPerKm() {
        return lowerBoundCostPerKm;
    }

    /**
     * Calibrates the lower bound for one graph and one edge cost function.
     *
     * @param graph snapshot with geodetic coordinates.
     * @param edgeCost cost of traversing an edge id; must be finite and non-negative.
     * @return calibrated model.
     * @throws HeuristicConfigurationException when no bound can be derived.
     */
    public static GeometryLowerBoundModel calibrate(NetworkGraph graph, IntToDoubleFunction edgeCost) {
        if (graph == null || edgeCost == null) {
            throw new HeuristicConfigurationException(
                    REASON_GRAPH_REQUIRED,
                    "graph and edge cost function must be provided for lower-bound calibration"
            );
        }
        if (graph.edgeCount() == 0) {
            throw new HeuristicConfigurationException(
                    REASON_EMPTY_GRAPH,
                    "graph must contain at least one edge for lower-bound calibration"
            );
        }

        double bestRatio = Double.POSITIVE_INFINITY;
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            double cost = edgeCost.applyAsDouble(edgeId);
            if (!Double.isFinite(cost) || cost < 0.0d) {
                throw new HeuristicConfigurationException(
                        REASON_INVALID_EDGE_COST,
                        "edge " + edgeId + " has invalid cost: " + cost
                );
            }
            int fromNode = graph.getEdgeOrigin(edgeId);
            int toNode = graph.getEdgeDestination(edgeId);
            double km = GeometryDistance.greatCircleDistanceKm(
                    graph.getNodeLatitude(fromNode),
                    graph.getNodeLongitude(fromNode),
                    graph.getNodeLatitude(toNode),
                    graph.getNodeLongitude(toNode)
            );
            if (km <= 0.0d) {
                continue;
            }
            double ratio = cost / km;
            if (ratio < bestRatio) {
                bestRatio = ratio;
            }
        }

        if (!Double.isFinite(bestRatio)) {
            throw new HeuristicConfigurationException(
                    REASON_NO_POSITIVE_DISTANCE_EDGES,
                    "no edge has positive great-circle length"
            );
        }
        return new GeometryLowerBoundModel(bestRatio);
    }
}
