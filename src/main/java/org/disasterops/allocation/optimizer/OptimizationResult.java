package org.disasterops.allocation.optimizer;

import org.disasterops.allocation.model.AllocationSolution;

/**
 * Solution plus search trace.
 *
 * @param solution converted best solution.
 * @param initialScore score of the starting point (best of the first generation for the
 * genetic algorithm, cost of the random start for annealing).
 * @param bestScore best score found.
 * @param bestScoreHistory best-so-far score after each generation or annealing step.
 */
public record OptimizationResult(
        AllocationSolution solution,
        double initialScore,
        double bestScore,
        double[] bestScoreHistory
) {
}
