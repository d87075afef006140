package org.disasterops.allocation.fitness;

import lombok.Builder;
import lombok.Value;

/**
 * Weights of {@code coverage * wCoverage + efficiency * wEfficiency - distance * wDistance}.
 */
@Value
@Builder
public class FitnessWeights {
    @Builder.Default
    double coverage = 0.5d;
    @Builder.Default
    double efficiency = 0.3d;
    @Builder.Default
    double distance = 0.2d;

    public static FitnessWeights defaults() {
        return FitnessWeights.builder().build();
    }

    public FitnessWeights validate() {
        requireWeight("coverage", coverage);
        requireWeight("efficiency", efficiency);
        requireWeight("distance", distance);
        return this;
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new AllocationException(
                    AllocationException.REASON_INVALID_WEIGHTS,
                    name + " weight must be finite and >= 0, got " + value
            );
        }
    }
}
