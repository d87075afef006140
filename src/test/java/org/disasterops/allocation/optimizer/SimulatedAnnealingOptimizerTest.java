package org.disasterops.allocation.optimizer;

import org.disasterops.allocation.fitness.AllocationProblem;
import org.disasterops.allocation.fitness.FitnessEvaluator;
import org.disasterops.allocation.fitness.FitnessWeights;
import org.disasterops.allocation.model.AllocationSolution;
import org.disasterops.allocation.model.Assignment;
import org.disasterops.testutil.NetworkFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Simulated Annealing Optimizer Tests")
class SimulatedAnnealingOptimizerTest {

    @ParameterizedTest
    @ValueSource(longs = {1L, 8L, 64L, 512L})
    @DisplayName("Best cost never exceeds the initial cost and never increases")
    void testBestNotWorseThanInitial(long seed) {
        AllocationProblem problem = OptimizerFixtures.regionProblem();

        OptimizationResult result = new SimulatedAnnealingOptimizer(AnnealingConfig.defaults(), new Random(seed)).run(problem);

        assertTrue(result.bestScore() <= result.initialScore());
        double[] history = result.bestScoreHistory();
        assertTrue(history.length > 0);
        for (int i = 1; i < history.length; i++) {
            assertTrue(history[i] <= history[i - 1]);
        }
        assertEquals(history[history.length - 1], result.bestScore());

        FitnessEvaluator evaluator = new FitnessEvaluator(problem, FitnessWeights.defaults(), 10_000.0);
        assertEquals(result.bestScore(), evaluator.annealingCost(result.solution().getAssignment()), 1e-9);
        assertEquals(1.0 / (1.0 + result.bestScore()), result.solution().getCoverageScore(), 1e-12);
    }

    @Test
    @DisplayName("Geometric cooling from 1000 to 1 at 0.95 takes 135 steps")
    void testScheduleLength() {
        OptimizationResult result = new SimulatedAnnealingOptimizer(AnnealingConfig.defaults(), new Random(3L))
                .run(OptimizerFixtures.regionProblem());

        assertEquals(135, result.bestScoreHistory().length);
    }

    @Test
    @DisplayName("Slow cooling finds the cheapest assignment of a small instance")
    void testFindsOptimum() {
        AnnealingConfig slow = AnnealingConfig.builder().coolingRate(0.99).build();

        AllocationSolution solution = new SimulatedAnnealingOptimizer(slow, new Random(17L))
                .optimizeAllocation(
                        NetworkFixtures.regionCenters(),
                        NetworkFixtures.regionZones(),
                        OptimizerFixtures.regionGraph());

        assertEquals(Assignment.of(Map.of("DZ1", "RC1", "DZ2", "RC2", "DZ3", "RC2", "DZ4", "RC2")), solution.getAssignment());
        assertEquals(7.2 * 0.2 + 15.6 * 0.6 + 6.0 * 0.4 + 13.2, solution.getTotalCost(), 1e-9);
    }

    @Test
    @DisplayName("Scarce stock goes to the most urgent zone first")
    void testScarceStockByPriority() {
        AllocationSolution solution = new SimulatedAnnealingOptimizer(AnnealingConfig.defaults(), new Random(2L))
                .run(OptimizerFixtures.scarceWaterProblem())
                .solution();

        assertEquals(80, solution.delivered("A", "water"));
        assertTrue(solution.delivered("B", "water") <= 20);
    }
}
