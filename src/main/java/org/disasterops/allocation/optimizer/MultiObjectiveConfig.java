package org.disasterops.allocation.optimizer;

import lombok.Builder;
import lombok.Value;

/**
 * NSGA-II tuning.
 */
@Value
@Builder
public class MultiObjectiveConfig {
    @Builder.Default
    int populationSize = 50;
    @Builder.Default
    int generations = 100;
    @Builder.Default
    double mutationRate = 0.1d;
    /** Crowded-comparison tournament size. */
    @Builder.Default
    int tournamentSize = 2;
    @Builder.Default
    double unreachablePenalty = 1000.0d;

    public static MultiObjectiveConfig defaults() {
        return MultiObjectiveConfig.builder().build();
    }

    public MultiObjectiveConfig validate() {
        ConfigChecks.requirePositive(OptimizerConfigurationException.REASON_INVALID_POPULATION, "populationSize", populationSize);
        ConfigChecks.requirePositive(OptimizerConfigurationException.REASON_INVALID_GENERATIONS, "generations", generations);
        ConfigChecks.requireProbability("mutationRate", mutationRate);
        ConfigChecks.requireTournament(tournamentSize, populationSize);
        ConfigChecks.requirePenalty(unreachablePenalty);
        return this;
    }
}
