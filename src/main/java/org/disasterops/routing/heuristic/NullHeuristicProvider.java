package org.disasterops.routing.heuristic;

import org.disasterops.network.NetworkGraph;

import java.util.Objects;

/**
 * Always estimates zero, so planners behave like plain Dijkstra.
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private final int nodeCount;

    public NullHeuristicProvider(NetworkGraph graph) {
        Objects.requireNonNull(graph, "graph");
        this.nodeCount = graph.nodeCount();
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        if (goalNodeId < 0 || goalNodeId >= nodeCount) {
            throw new IllegalArgumentException(
                    "goalNodeId out of bounds: " + goalNodeId + " [0, " + nodeCount + ")"
            );
        }
        return GoalBoundHeuristic.ZERO;
    }
}
