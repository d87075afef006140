package org.disasterops.routing.heuristic;

import org.disasterops.network.NetworkGraph;

import java.util.Objects;

/**
 * Great-circle heuristic provider.
 *
 * <p>Estimates are great-circle kilometres to the goal times the calibrated lower-bound
 * cost per kilometre, which keeps A* optimal.</p>
 */
public final class GeographicHeuristicProvider implements HeuristicProvider {
    private final NetworkGraph graph;
    private final double lowerBoundCostPerKm;

    public GeographicHeuristicProvider(NetworkGraph graph, GeometryLowerBoundModel lowerBoundModel) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.lowerBoundCostPerKm = Objects.requireNonNull(lowerBoundModel, "lowerBoundModel").lowerBoundCostPerKm();
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.GEOGRAPHIC;
    }

    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        if (goalNodeId < 0 || goalNodeId >= graph.nodeCount()) {
            throw new IllegalArgumentException(
                    "goalNodeId out of bounds: " + goalNodeId + " [0, " + graph.nodeCount() + ")"
            );
        }
        return new BoundGeographicHeuristic(
                graph,
                graph.getNodeLatitude(goalNodeId),
                graph.getNodeLongitude(goalNodeId),
                lowerBoundCostPerKm
        );
    }

    private static final class BoundGeographicHeuristic implements GoalBoundHeuristic {
        private final NetworkGraph graph;
        private final double goalLatDeg;
        private final double goalLonDeg;
        private final double lowerBoundCostPerKm;

        private BoundGeographicHeuristic(
                NetworkGraph graph,
                double goalLatDeg,
                double goalLonDeg,
                double lowerBoundCostPerKm
        ) {
            this.graph = graph;
            this.goalLatDeg = goalLatDeg;
            this.goalLonDeg = goalLonDeg;
            this.lowerBoundCostPerKm = lowerBoundCostPerKm;
        }

        @Override
        public double estimateFromNode(int nodeId) {
            double km = GeometryDistance.greatCircleDistanceKm(
                    graph.getNodeLatitude(nodeId),
                    graph.getNodeLongitude(nodeId),
                    goalLatDeg,
                    goalLonDeg
            );
            return km * lowerBoundCostPerKm;
        }
    }
}
