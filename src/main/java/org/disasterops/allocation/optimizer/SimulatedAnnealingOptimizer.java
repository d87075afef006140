package org.disasterops.allocation.optimizer;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import lombok.extern.slf4j.Slf4j;
import org.disasterops.allocation.fitness.AllocationProblem;
import org.disasterops.allocation.fitness.FitnessEvaluator;
import org.disasterops.allocation.fitness.FitnessWeights;
import org.disasterops.allocation.model.AllocationSolution;
import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.network.NetworkGraph;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Simulated annealing over zone-to-center genomes, minimizing the priority-scaled
 * annealing cost.
 *
 * <p>Neighbors move 1-2 random zones to random centers. A worse neighbor is accepted with
 * probability {@code exp(-delta / T)}. The best genome seen is returned, so its cost never
 * exceeds the cost of the random start.</p>
 */
@Slf4j
public final class SimulatedAnnealingOptimizer implements AllocationOptimizer {
    private final AnnealingConfig config;
    private final Random random;

    public SimulatedAnnealingOptimizer() {
        this(AnnealingConfig.defaults(), new Random());
    }

    public SimulatedAnnealingOptimizer(AnnealingConfig config, Random random) {
        if (config == null) {
            throw new OptimizerConfigurationException(OptimizerConfigurationException.REASON_CONFIG_REQUIRED, "config must be provided");
        }
        this.config = config.validate();
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public AllocationSolution optimizeAllocation(List<ReliefCenter> centers, List<DisasterZone> zones, NetworkGraph graph) {
        return run(AllocationProblem.of(centers, zones, graph)).solution();
    }

    /**
     * Runs one cooling schedule; {@code bestScoreHistory[i]} is the best cost after step {@code i}.
     */
    public OptimizationResult run(AllocationProblem problem) {
        FitnessEvaluator evaluator = new FitnessEvaluator(problem, FitnessWeights.defaults(), config.getUnreachablePenalty());

        int[] current = new int[problem.zoneCount()];
        for (int z = 0; z < current.length; z++) {
            current[z] = random.nextInt(problem.centerCount());
        }
        double currentCost = evaluator.annealingCost(current);
        double initialCost = currentCost;
        int[] best = current.clone();
        double bestCost = currentCost;

        DoubleArrayList history = new DoubleArrayList();
        double temperature = config.getInitialTemperature();
        while (temperature > config.getMinTemperature()) {
            int[] neighbor = neighbor(problem, current);
            double neighborCost = evaluator.annealingCost(neighbor);
            if (accept(currentCost, neighborCost, temperature)) {
                current = neighbor;
                currentCost = neighborCost;
                if (neighborCost < bestCost) {
                    best = neighbor.clone();
                    bestCost = neighborCost;
                }
            }
            history.add(bestCost);
            temperature *= config.getCoolingRate();
        }
        log.debug("Annealing finished after {} steps: initial cost {}, best cost {}", history.size(), initialCost, bestCost);

        AllocationSolution solution = SolutionAssembler.assemble(
                problem,
                best,
                bestCost,
                1.0d / (1.0d + bestCost),
                SolutionAssembler.timeEfficiency(bestCost, problem.zoneCount())
        );
        return new OptimizationResult(solution, initialCost, bestCost, history.toDoubleArray());
    }

    private int[] neighbor(AllocationProblem problem, int[] current) {
        int[] neighbor = current.clone();
        int changes = 1 + random.nextInt(2);
        for (int i = 0; i < changes; i++) {
            neighbor[random.nextInt(neighbor.length)] = random.nextInt(problem.centerCount());
        }
        return neighbor;
    }

    private boolean accept(double currentCost, double neighborCost, double temperature) {
        if (neighborCost < currentCost) {
            return true;
        }
        return random.nextDouble() < Math.exp(-(neighborCost - currentCost) / temperature);
    }
}
