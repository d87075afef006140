package org.disasterops.allocation.optimizer;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.disasterops.allocation.fitness.AllocationProblem;
import org.disasterops.allocation.fitness.FitnessEvaluator;
import org.disasterops.allocation.model.AllocationSolution;
import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.network.NetworkGraph;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Genetic search over zone-to-center genomes.
 * <p>
 * Each generation keeps the floored elite share, then fills the rest with children of two
 * tournament winners: uniform per-zone crossover, and with probability {@code mutationRate}
 * 1-2 zones moved to a center some individual of the current population already uses for
 * that zone. The best individual ever evaluated is returned, so the reported fitness never
 * decreases across generations.
 * </p>
 */
@Slf4j
public final class GeneticAlgorithmOptimizer implements AllocationOptimizer {
    private final GeneticAlgorithmConfig config;
    private final Random random;

    public GeneticAlgorithmOptimizer() {
        this(GeneticAlgorithmConfig.defaults(), new Random());
    }

    public GeneticAlgorithmOptimizer(GeneticAlgorithmConfig config, Random random) {
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
     * Runs the search; {@code bestScoreHistory[g]} is the best fitness seen up to generation {@code g}.
     */
    public OptimizationResult run(AllocationProblem problem) {
        FitnessEvaluator evaluator = new FitnessEvaluator(problem, config.getWeights(), config.getUnreachablePenalty());
        int populationSize = config.getPopulationSize();
        int[][] population = new int[populationSize][];
        for (int i = 0; i < populationSize; i++) {
            population[i] = randomGenome(problem);
        }

        int[] bestGenes = null;
        double bestFitness = Double.NEGATIVE_INFINITY;
        double initialBest = Double.NEGATIVE_INFINITY;
        DoubleArrayList history = new DoubleArrayList(config.getGenerations());
        double[] fitness = new double[populationSize];

        for (int generation = 0; generation < config.getGenerations(); generation++) {
            for (int i = 0; i < populationSize; i++) {
                fitness[i] = evaluator.fitness(population[i]);
                if (fitness[i] > bestFitness) {
                    bestFitness = fitness[i];
                    bestGenes = population[i].clone();
                }
            }
            if (generation == 0) {
                initialBest = bestFitness;
            }
            history.add(bestFitness);
            if (generation % config.getLogInterval() == 0) {
                log.debug("Generation {}: best fitness = {}", generation, String.format("%.4f", bestFitness));
            }
            population = evolve(problem, population, fitness);
        }

        double totalCost = evaluator.totalTravelCost(bestGenes);
        AllocationSolution solution = SolutionAssembler.assemble(
                problem,
                bestGenes,
                totalCost,
                bestFitness,
                SolutionAssembler.timeEfficiency(totalCost, problem.zoneCount())
        );
        return new OptimizationResult(solution, initialBest, bestFitness, history.toDoubleArray());
    }

    private int[][] evolve(AllocationProblem problem, int[][] population, double[] fitness) {
        int populationSize = population.length;
        int[][] next = new int[populationSize][];
        int filled = 0;

        int eliteCount = (int) (config.getEliteFraction() * populationSize);
        if (eliteCount > 0) {
            Integer[] order = new Integer[populationSize];
            for (int i = 0; i < populationSize; i++) {
                order[i] = i;
            }
            Arrays.sort(order, (a, b) -> Double.compare(fitness[b], fitness[a]));
            for (int i = 0; i < eliteCount; i++) {
                next[filled++] = population[order[i]].clone();
            }
        }

        while (filled < populationSize) {
            int[] parent1 = population[tournament(fitness)];
            int[] parent2 = population[tournament(fitness)];
            int[] child = crossover(parent1, parent2);
            if (random.nextDouble() < config.getMutationRate()) {
                mutate(problem, child, population);
            }
            next[filled++] = child;
        }
        return next;
    }

    private int tournament(double[] fitness) {
        int n = fitness.length;
        int[] pool = new int[n];
        for (int i = 0; i < n; i++) {
            pool[i] = i;
        }
        int best = -1;
        for (int k = 0; k < config.getTournamentSize(); k++) {
            int pick = k + random.nextInt(n - k);
            int candidate = pool[pick];
            pool[pick] = pool[k];
            pool[k] = candidate;
            if (best < 0 || fitness[candidate] > fitness[best]) {
                best = candidate;
            }
        }
        return best;
    }

    private int[] crossover(int[] parent1, int[] parent2) {
        int[] child = new int[parent1.length];
        for (int z = 0; z < child.length; z++) {
            child[z] = random.nextBoolean() ? parent1[z] : parent2[z];
        }
        return child;
    }

    private void mutate(AllocationProblem problem, int[] child, int[][] population) {
        int mutations = 1 + random.nextInt(2);
        for (int m = 0; m < mutations; m++) {
            int zone = random.nextInt(child.length);
            boolean[] used = new boolean[problem.centerCount()];
            for (int[] individual : population) {
                used[individual[zone]] = true;
            }
            IntArrayList candidates = new IntArrayList();
            for (int c = 0; c < used.length; c++) {
                if (used[c]) {
                    candidates.add(c);
                }
            }
            child[zone] = candidates.getInt(random.nextInt(candidates.size()));
        }
    }

    private int[] randomGenome(AllocationProblem problem) {
        int[] genes = new int[problem.zoneCount()];
        for (int z = 0; z < genes.length; z++) {
            genes[z] = random.nextInt(problem.centerCount());
        }
        return genes;
    }
}
