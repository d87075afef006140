package org.disasterops.allocation.optimizer;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.disasterops.allocation.fitness.AllocationProblem;
import org.disasterops.allocation.fitness.FitnessEvaluator;
import org.disasterops.allocation.fitness.FitnessWeights;
import org.disasterops.allocation.fitness.ObjectiveVector;
import org.disasterops.allocation.model.AllocationSolution;
import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.network.NetworkGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * NSGA-II over zone-to-center genomes with objectives
 * {@code (totalCost, -coverage, -speed)}, all minimized.
 * <p>
 * Per generation: crowded-comparison tournaments (lower rank, then larger crowding distance)
 * pick parents; children come from uniform crossover and, with probability
 * {@code mutationRate}, 1-2 random reassignments. Parents and children are merged and the
 * next population is filled front by front, the overflowing front truncated by descending
 * crowding distance.
 * </p>
 */
@Slf4j
public final class MultiObjectiveOptimizer implements ParetoOptimizer {
    private final MultiObjectiveConfig config;
    private final Random random;

    public MultiObjectiveOptimizer() {
        this(MultiObjectiveConfig.defaults(), new Random());
    }

    public MultiObjectiveOptimizer(MultiObjectiveConfig config, Random random) {
        if (config == null) {
            throw new OptimizerConfigurationException(OptimizerConfigurationException.REASON_CONFIG_REQUIRED, "config must be provided");
        }
        this.config = config.validate();
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public List<AllocationSolution> optimizeParetoFront(List<ReliefCenter> centers, List<DisasterZone> zones, NetworkGraph graph) {
        return run(AllocationProblem.of(centers, zones, graph));
    }

    /**
     * @return distinct non-dominated solutions of the final population, by ascending total cost.
     */
    public List<AllocationSolution> run(AllocationProblem problem) {
        FitnessEvaluator evaluator = new FitnessEvaluator(problem, FitnessWeights.defaults(), config.getUnreachablePenalty());
        int populationSize = config.getPopulationSize();

        List<int[]> population = new ArrayList<>(populationSize);
        List<ObjectiveVector> objectives = new ArrayList<>(populationSize);
        for (int i = 0; i < populationSize; i++) {
            int[] genes = new int[problem.zoneCount()];
            for (int z = 0; z < genes.length; z++) {
                genes[z] = random.nextInt(problem.centerCount());
            }
            population.add(genes);
            objectives.add(evaluator.objectives(genes));
        }

        for (int generation = 0; generation < config.getGenerations(); generation++) {
            List<IntArrayList> fronts = NonDominatedSorter.sort(objectives);
            int[] rank = NonDominatedSorter.ranks(fronts, population.size());
            double[] crowding = crowdingByIndex(fronts, objectives);

            List<int[]> combined = new ArrayList<>(population);
            List<ObjectiveVector> combinedObjectives = new ArrayList<>(objectives);
            for (int i = 0; i < populationSize; i++) {
                int[] parent1 = population.get(tournament(rank, crowding));
                int[] parent2 = population.get(tournament(rank, crowding));
                int[] child = crossover(parent1, parent2);
                if (random.nextDouble() < config.getMutationRate()) {
                    mutate(problem, child);
                }
                combined.add(child);
                combinedObjectives.add(evaluator.objectives(child));
            }

            List<Integer> survivors = selectSurvivors(combinedObjectives, populationSize);
            List<int[]> nextPopulation = new ArrayList<>(populationSize);
            List<ObjectiveVector> nextObjectives = new ArrayList<>(populationSize);
            for (int index : survivors) {
                nextPopulation.add(combined.get(index));
                nextObjectives.add(combinedObjectives.get(index));
            }
            population = nextPopulation;
            objectives = nextObjectives;
            if (generation % 20 == 0) {
                log.debug("Generation {}: first front size {}", generation, fronts.get(0).size());
            }
        }

        return paretoFront(problem, population, objectives);
    }

    /**
     * Indexes of the {@code size} survivors among {@code objectives}.
     */
    static List<Integer> selectSurvivors(List<ObjectiveVector> objectives, int size) {
        List<Integer> survivors = new ArrayList<>(size);
        for (IntArrayList front : NonDominatedSorter.sort(objectives)) {
            if (survivors.size() + front.size() <= size) {
                for (int k = 0; k < front.size(); k++) {
                    survivors.add(front.getInt(k));
                }
                if (survivors.size() == size) {
                    break;
                }
                continue;
            }
            List<ObjectiveVector> frontObjectives = new ArrayList<>(front.size());
            for (int k = 0; k < front.size(); k++) {
                frontObjectives.add(objectives.get(front.getInt(k)));
            }
            double[] distance = CrowdingDistance.compute(frontObjectives);
            List<Integer> order = new ArrayList<>(front.size());
            for (int k = 0; k < front.size(); k++) {
                order.add(k);
            }
            order.sort(Comparator.comparingDouble((Integer k) -> -distance[k]).thenComparingInt(k -> k));
            int remaining = size - survivors.size();
            for (int k = 0; k < remaining; k++) {
                survivors.add(front.getInt(order.get(k)));
            }
            break;
        }
        return survivors;
    }

    private static double[] crowdingByIndex(List<IntArrayList> fronts, List<ObjectiveVector> objectives) {
        double[] crowding = new double[objectives.size()];
        for (IntArrayList front : fronts) {
            List<ObjectiveVector> frontObjectives = new ArrayList<>(front.size());
            for (int k = 0; k < front.size(); k++) {
                frontObjectives.add(objectives.get(front.getInt(k)));
            }
            double[] distance = CrowdingDistance.compute(frontObjectives);
            for (int k = 0; k < front.size(); k++) {
                crowding[front.getInt(k)] = distance[k];
            }
        }
        return crowding;
    }

    private int tournament(int[] rank, double[] crowding) {
        int best = random.nextInt(rank.length);
        for (int k = 1; k < config.getTournamentSize(); k++) {
            int candidate = random.nextInt(rank.length);
            if (rank[candidate] < rank[best]
                    || (rank[candidate] == rank[best] && crowding[candidate] > crowding[best])) {
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

    private void mutate(AllocationProblem problem, int[] child) {
        int changes = 1 + random.nextInt(2);
        for (int i = 0; i < changes; i++) {
            child[random.nextInt(child.length)] = random.nextInt(problem.centerCount());
        }
    }

    private static List<AllocationSolution> paretoFront(
            AllocationProblem problem,
            List<int[]> population,
            List<ObjectiveVector> objectives
    ) {
        IntArrayList firstFront = NonDominatedSorter.sort(objectives).get(0);
        Set<IntArrayList> seen = new HashSet<>();
        List<Integer> members = new ArrayList<>();
        for (int k = 0; k < firstFront.size(); k++) {
            int index = firstFront.getInt(k);
            if (seen.add(IntArrayList.wrap(population.get(index)))) {
                members.add(index);
            }
        }
        members.sort(Comparator.comparingDouble((Integer i) -> objectives.get(i).totalCost()).thenComparingInt(i -> i));

        List<AllocationSolution> solutions = new ArrayList<>(members.size());
        for (int index : members) {
            ObjectiveVector objective = objectives.get(index);
            solutions.add(SolutionAssembler.assemble(
                    problem,
                    population.get(index),
                    objective.totalCost(),
                    -objective.negatedCoverage(),
                    -objective.negatedSpeed()
            ));
        }
        return solutions;
    }
}
