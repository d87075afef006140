package org.disasterops.allocation.optimizer;

import lombok.experimental.UtilityClass;

/**
 * Shared range checks of optimizer configs.
 */
@UtilityClass
class ConfigChecks {

    static void requirePositive(String reasonCode, String name, int value) {
        if (value <= 0) {
            throw new OptimizerConfigurationException(reasonCode, name + " must be > 0, got " + value);
        }
    }

    static void requireProbability(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0d || value > 1.0d) {
            throw new OptimizerConfigurationException(
                    OptimizerConfigurationException.REASON_INVALID_RATE,
                    name + " must be in [0,1], got " + value
            );
        }
    }

    static void requirePenalty(double value) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new OptimizerConfigurationException(
                    OptimizerConfigurationException.REASON_INVALID_PENALTY,
                    "unreachablePenalty must be finite and >= 0, got " + value
            );
        }
    }

    static void requireTournament(int tournamentSize, int populationSize) {
        if (tournamentSize < 1 || tournamentSize > populationSize) {
            throw new OptimizerConfigurationException(
                    OptimizerConfigurationException.REASON_INVALID_TOURNAMENT,
                    "tournamentSize must be in [1, populationSize=" + populationSize + "], got " + tournamentSize
            );
        }
    }
}
