package org.disasterops.allocation.optimizer;

import org.disasterops.allocation.fitness.AllocationProblem;
import org.disasterops.allocation.fitness.FitnessEvaluator;
import org.disasterops.allocation.fitness.FitnessWeights;
import org.disasterops.allocation.fitness.ObjectiveVector;
import org.disasterops.allocation.model.AllocationSolution;
import org.disasterops.allocation.model.Assignment;
import org.disasterops.testutil.NetworkFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Multi-Objective Optimizer Tests")
class MultiObjectiveOptimizerTest {

    @Test
    @Timeout(value = 15, unit = TimeUnit.SECONDS)
    @DisplayName("Returned front is distinct, mutually non-dominated and sorted by cost")
    void testParetoFront() {
        AllocationProblem problem = OptimizerFixtures.regionProblem();
        MultiObjectiveConfig config = MultiObjectiveConfig.builder().populationSize(30).generations(40).build();

        List<AllocationSolution> front = new MultiObjectiveOptimizer(config, new Random(21L)).run(problem);

        assertFalse(front.isEmpty());
        FitnessEvaluator evaluator = new FitnessEvaluator(problem, FitnessWeights.defaults(), config.getUnreachablePenalty());
        List<ObjectiveVector> vectors = new ArrayList<>();
        Set<Assignment> assignments = new HashSet<>();
        for (AllocationSolution solution : front) {
            assertTrue(assignments.add(solution.getAssignment()), "duplicate assignment in front");
            ObjectiveVector vector = evaluator.objectives(solution.getAssignment());
            assertEquals(vector.totalCost(), solution.getTotalCost(), 1e-9);
            assertEquals(-vector.negatedCoverage(), solution.getCoverageScore(), 1e-9);
            assertEquals(-vector.negatedSpeed(), solution.getTimeEfficiency(), 1e-9);
            vectors.add(vector);
        }
        for (int i = 0; i < vectors.size(); i++) {
            for (int j = 0; j < vectors.size(); j++) {
                assertFalse(vectors.get(i).dominates(vectors.get(j)), i + " dominates " + j);
            }
        }
        for (int i = 1; i < front.size(); i++) {
            assertTrue(front.get(i).getTotalCost() >= front.get(i - 1).getTotalCost());
        }
    }

    @Test
    @Timeout(value = 15, unit = TimeUnit.SECONDS)
    @DisplayName("Cheapest member of the front is the nearest-center assignment")
    void testFrontContainsCheapest() {
        List<AllocationSolution> front = new MultiObjectiveOptimizer(MultiObjectiveConfig.defaults(), new Random(4L))
                .optimizeParetoFront(NetworkFixtures.regionCenters(), NetworkFixtures.regionZones(), OptimizerFixtures.regionGraph());

        assertEquals(42.0, front.get(0).getTotalCost(), 1e-9);
    }

    @Test
    @DisplayName("Single-center instance collapses to one solution")
    void testSingleCenter() {
        List<AllocationSolution> front = new MultiObjectiveOptimizer(
                MultiObjectiveConfig.builder().populationSize(8).generations(3).build(), new Random(1L))
                .run(OptimizerFixtures.scarceWaterProblem());

        assertEquals(1, front.size());
        assertEquals(80, front.get(0).delivered("A", "water"));
        assertEquals(20, front.get(0).delivered("B", "water"));
    }
}
