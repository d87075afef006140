package org.disasterops.routing.heuristic;

/**
 * Immutable estimator of the remaining cost to a goal fixed at bind time.
 *
 * <p>Hot path contract: {@link #estimateFromNode(int)} must avoid allocations and never
 * overestimate the true remaining cost.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Zero estimator; turns A* into plain Dijkstra.
     */
    GoalBoundHeuristic ZERO = nodeId -> 0.0d;

    /**
     * Estimates remaining cost from a node to the bound goal.
     *
     * @param nodeId internal node index.
     * @return admissible lower-bound estimate.
     */
    double estimateFromNode(int nodeId);
}
