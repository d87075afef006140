package org.disasterops.allocation.optimizer;

import lombok.Builder;
import lombok.Value;

/**
 * Simulated annealing schedule. The loop runs while {@code temperature > minTemperature},
 * multiplying the temperature by {@code coolingRate} each step.
 */
@Value
@Builder
public class AnnealingConfig {
    @Builder.Default
    double initialTemperature = 1000.0d;
    @Builder.Default
    double coolingRate = 0.95d;
    @Builder.Default
    double minTemperature = 1.0d;
    @Builder.Default
    double unreachablePenalty = 10_000.0d;

    public static AnnealingConfig defaults() {
        return AnnealingConfig.builder().build();
    }

    public AnnealingConfig validate() {
        if (!Double.isFinite(coolingRate) || coolingRate <= 0.0d || coolingRate >= 1.0d) {
            throw new OptimizerConfigurationException(
                    OptimizerConfigurationException.REASON_INVALID_RATE,
                    "coolingRate must be in (0,1), got " + coolingRate
            );
        }
        if (!Double.isFinite(minTemperature) || minTemperature <= 0.0d) {
            throw new OptimizerConfigurationException(
                    OptimizerConfigurationException.REASON_INVALID_TEMPERATURE,
                    "minTemperature must be finite and > 0, got " + minTemperature
            );
        }
        if (!Double.isFinite(initialTemperature) || initialTemperature <= minTemperature) {
            throw new OptimizerConfigurationException(
                    OptimizerConfigurationException.REASON_INVALID_TEMPERATURE,
                    "initialTemperature must be finite and > minTemperature, got " + initialTemperature
            );
        }
        ConfigChecks.requirePenalty(unreachablePenalty);
        return this;
    }
}
