package org.disasterops.routing.heuristic;

/**
 * Heuristic provider contract used by route planners.
 *
 * <p>Providers are immutable and bound to one graph snapshot. Binding returns an immutable
 * goal-bound estimator suitable for concurrent reads.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a concrete goal node and returns a reusable estimator.
     *
     * @param goalNodeId internal goal node index.
     * @return immutable estimator bound to the goal.
     */
    GoalBoundHeuristic bindGoal(int goalNodeId);
}
