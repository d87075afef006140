package org.disasterops.allocation.fitness;

import org.disasterops.allocation.model.Assignment;

import java.util.Objects;

/**
 * Scores assignments of one {@link AllocationProblem}.
 * <p>
 * Three views of the same assignment:
 * <ul>
 * <li>{@link #evaluate}: weighted fitness, higher is better.</li>
 * <li>{@link #annealingCost}: priority-scaled travel cost, lower is better.</li>
 * <li>{@link #objectives}: minimized Pareto objectives.</li>
 * </ul>
 * Unreachable pairs cost {@code unreachablePenalty} and contribute no coverage. Incomplete
 * assignments fail with {@link AllocationException}.
 */
public final class FitnessEvaluator {
    private final AllocationProblem problem;
    private final FitnessWeights weights;
    private final double unreachablePenalty;

    public FitnessEvaluator(AllocationProblem problem, FitnessWeights weights, double unreachablePenalty) {
        this.problem = Objects.requireNonNull(problem, "problem");
        this.weights = Objects.requireNonNull(weights, "weights").validate();
        if (!Double.isFinite(unreachablePenalty) || unreachablePenalty < 0.0d) {
            throw new IllegalArgumentException("unreachablePenalty must be finite and >= 0, got " + unreachablePenalty);
        }
        this.unreachablePenalty = unreachablePenalty;
    }

    public AllocationProblem problem() {
        return problem;
    }

    public double unreachablePenalty() {
        return unreachablePenalty;
    }

    public FitnessBreakdown evaluate(Assignment assignment) {
        return evaluate(problem.encode(assignment));
    }

    public FitnessBreakdown evaluate(int[] genes) {
        problem.requireGenome(genes);
        DistanceTable distances = problem.distances();
        double totalDistance = 0.0d;
        double coverage = 0.0d;
        double efficiency = 0.0d;
        int unreachable = 0;
        for (int z = 0; z < genes.length; z++) {
            int c = genes[z];
            if (!distances.isReachable(c, z)) {
                totalDistance += unreachablePenalty;
                unreachable++;
                continue;
            }
            totalDistance += distances.travelCost(c, z);
            double match = problem.resourceMatch(c, z);
            coverage += problem.zone(z).getPriority() / 5.0d * match;
            efficiency += match;
        }
        double fitness = coverage * weights.getCoverage()
                + efficiency * weights.getEfficiency()
                - totalDistance * weights.getDistance();
        return new FitnessBreakdown(totalDistance, coverage, efficiency, fitness, unreachable);
    }

    public double fitness(int[] genes) {
        return evaluate(genes).fitness();
    }

    /**
     * Sum of travel cost; unreachable pairs cost the penalty.
     */
    public double totalTravelCost(int[] genes) {
        return evaluate(genes).totalDistance();
    }

    public double annealingCost(Assignment assignment) {
        return annealingCost(problem.encode(assignment));
    }

    /**
     * Sum of {@code travelCost * (6 - priority) / 5}; urgent zones weigh less so the search
     * accepts longer trips to serve them. Unreachable pairs cost the penalty.
     */
    public double annealingCost(int[] genes) {
        problem.requireGenome(genes);
        DistanceTable distances = problem.distances();
        double cost = 0.0d;
        for (int z = 0; z < genes.length; z++) {
            int c = genes[z];
            if (!distances.isReachable(c, z)) {
                cost += unreachablePenalty;
                continue;
            }
            cost += distances.travelCost(c, z) * (6 - problem.zone(z).getPriority()) / 5.0d;
        }
        return cost;
    }

    public ObjectiveVector objectives(Assignment assignment) {
        return objectives(problem.encode(assignment));
    }

    /**
     * {@code (totalCost, -sum(match * priority), -sum(1 / (1 + travelCost)))}.
     */
    public ObjectiveVector objectives(int[] genes) {
        problem.requireGenome(genes);
        DistanceTable distances = problem.distances();
        double totalCost = 0.0d;
        double coverage = 0.0d;
        double speed = 0.0d;
        for (int z = 0; z < genes.length; z++) {
            int c = genes[z];
            if (!distances.isReachable(c, z)) {
                totalCost += unreachablePenalty;
                continue;
            }
            double travel = distances.travelCost(c, z);
            totalCost += travel;
            coverage += problem.resourceMatch(c, z) * problem.zone(z).getPriority();
            speed += 1.0d / (1.0d + travel);
        }
        return new ObjectiveVector(totalCost, -coverage, -speed);
    }
}
