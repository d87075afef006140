package org.disasterops.allocation.optimizer;

import lombok.Builder;
import lombok.Value;
import org.disasterops.allocation.fitness.AllocationException;
import org.disasterops.allocation.fitness.FitnessWeights;

/**
 * Genetic algorithm tuning.
 */
@Value
@Builder
public class GeneticAlgorithmConfig {
    @Builder.Default
    int populationSize = 50;
    @Builder.Default
    int generations = 100;
    /** Probability that a child is mutated. */
    @Builder.Default
    double mutationRate = 0.1d;
    /** Share of each generation copied unchanged from the fittest individuals (floored). */
    @Builder.Default
    double eliteFraction = 0.1d;
    /** Distinct individuals sampled per tournament. */
    @Builder.Default
    int tournamentSize = 3;
    /** Travel cost charged for an unreachable center/zone pair. */
    @Builder.Default
    double unreachablePenalty = 1000.0d;
    @Builder.Default
    FitnessWeights weights = FitnessWeights.defaults();
    /** Progress is logged every this many generations. */
    @Builder.Default
    int logInterval = 20;

    public static GeneticAlgorithmConfig defaults() {
        return GeneticAlgorithmConfig.builder().build();
    }

    public GeneticAlgorithmConfig validate() {
        ConfigChecks.requirePositive(OptimizerConfigurationException.REASON_INVALID_POPULATION, "populationSize", populationSize);
        ConfigChecks.requirePositive(OptimizerConfigurationException.REASON_INVALID_GENERATIONS, "generations", generations);
        ConfigChecks.requireProbability("mutationRate", mutationRate);
        ConfigChecks.requireProbability("eliteFraction", eliteFraction);
        ConfigChecks.requireTournament(tournamentSize, populationSize);
        ConfigChecks.requirePenalty(unreachablePenalty);
        ConfigChecks.requirePositive(OptimizerConfigurationException.REASON_INVALID_GENERATIONS, "logInterval", logInterval);
        if (weights == null) {
            throw new OptimizerConfigurationException(OptimizerConfigurationException.REASON_CONFIG_REQUIRED, "weights must be provided");
        }
        try {
            weights.validate();
        } catch (AllocationException ex) {
            throw new OptimizerConfigurationException(OptimizerConfigurationException.REASON_INVALID_WEIGHTS, ex.getMessage());
        }
        return this;
    }
}
