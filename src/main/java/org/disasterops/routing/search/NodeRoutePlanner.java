package org.disasterops.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.disasterops.network.NetworkGraph;
import org.disasterops.routing.heuristic.GoalBoundHeuristic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Single-direction node-based shortest-path planner.
 *
 * <p>Two priority modes controlled by {@code useHeuristic}:</p>
 * <ul>
 * <li>{@code false}: pure Dijkstra priority ({@code g}).</li>
 * <li>{@code true}: A* priority ({@code g + h}).</li>
 * </ul>
 * <p>Stale queue entries are skipped lazily; a node may be re-expanded when a cheaper label
 * arrives, so any admissible heuristic yields an optimal path.</p>
 */
final class NodeRoutePlanner {
    private static final int NO_EDGE = -1;

    private final boolean useHeuristic;

    NodeRoutePlanner(boolean useHeuristic) {
        this.useHeuristic = useHeuristic;
    }

    PathResult compute(
            NetworkGraph graph,
            int sourceNodeId,
            int targetNodeId,
            EdgeCostFunction costFunction,
            GoalBoundHeuristic heuristic
    ) {
        if (sourceNodeId == targetNodeId) {
            return new PathResult(true, 0.0d, List.of(graph.nodeId(sourceNodeId)), 0);
        }

        int nodeCount = graph.nodeCount();
        double[] gScore = new double[nodeCount];
        Arrays.fill(gScore, Double.POSITIVE_INFINITY);
        int[] predecessorEdge = new int[nodeCount];
        Arrays.fill(predecessorEdge, NO_EDGE);

        PriorityQueue<FrontierState> frontier = new PriorityQueue<>();
        gScore[sourceNodeId] = 0.0d;
        frontier.add(new FrontierState(sourceNodeId, 0.0d, computePriority(heuristic, sourceNodeId, 0.0d)));

        NetworkGraph.EdgeIterator iterator = graph.iterator();
        int settledNodes = 0;
        while (!frontier.isEmpty()) {
            FrontierState state = frontier.poll();
            int node = state.nodeId();
            if (state.gScore() > gScore[node]) {
                continue;
            }
            settledNodes++;
            if (node == targetNodeId) {
                return new PathResult(true, gScore[node], buildWaypoints(graph, predecessorEdge, targetNodeId), settledNodes);
            }

            iterator.resetForNode(node);
            while (iterator.hasNext()) {
                int edgeId = iterator.next();
                double edgeCost = costFunction.cost(graph, edgeId);
                if (!Double.isFinite(edgeCost)) {
                    continue;
                }
                double nextG = state.gScore() + edgeCost;
                int next = graph.getEdgeDestination(edgeId);
                if (nextG < gScore[next]) {
                    gScore[next] = nextG;
                    predecessorEdge[next] = edgeId;
                    frontier.add(new FrontierState(next, nextG, computePriority(heuristic, next, nextG)));
                }
            }
        }
        return PathResult.unreachable(settledNodes);
    }

    /**
     * Invalid heuristic outputs are clamped to zero so the queue stays well ordered.
     */
    private double computePriority(GoalBoundHeuristic heuristic, int nodeId, double gScore) {
        if (!useHeuristic) {
            return gScore;
        }
        double estimate = heuristic.estimateFromNode(nodeId);
        if (!Double.isFinite(estimate) || estimate < 0.0d) {
            estimate = 0.0d;
        }
        return gScore + estimate;
    }

    private static List<String> buildWaypoints(NetworkGraph graph, int[] predecessorEdge, int targetNodeId) {
        IntArrayList reversed = new IntArrayList();
        int cursor = targetNodeId;
        reversed.add(cursor);
        while (predecessorEdge[cursor] != NO_EDGE) {
            cursor = graph.getEdgeOrigin(predecessorEdge[cursor]);
            reversed.add(cursor);
        }
        List<String> waypoints = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            waypoints.add(graph.nodeId(reversed.getInt(i)));
        }
        return waypoints;
    }

    private record FrontierState(int nodeId, double gScore, double priority) implements Comparable<FrontierState> {
        /**
         * Orders frontier by priority, then node id for stability.
         */
        @Override
        public int compareTo(FrontierState other) {
            int byPriority = Double.compare(this.priority, other.priority);
            if (byPriority != 0) {
                return byPriority;
            }
            return Integer.compare(this.nodeId, other.nodeId);
        }
    }
}
