package org.disasterops.allocation.optimizer;

import lombok.experimental.UtilityClass;
import org.disasterops.allocation.fitness.AllocationProblem;
import org.disasterops.allocation.fitness.DistanceTable;
import org.disasterops.allocation.model.AllocationSolution;
import org.disasterops.allocation.model.DeliveryRoute;
import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.Resource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a genome into an {@link AllocationSolution}.
 * <p>
 * Quantities are resolved against a working copy of every center's stock: zones are served
 * in descending priority (then severity, then input order), each receiving
 * {@code min(remaining stock, need)} per resource from its assigned center. Unreachable
 * pairs ship nothing. Caller inputs are never modified.
 * </p>
 */
@UtilityClass
class SolutionAssembler {

    static AllocationSolution assemble(
            AllocationProblem problem,
            int[] genes,
            double totalCost,
            double coverageScore,
            double timeEfficiency
    ) {
        DistanceTable distances = problem.distances();
        AllocationSolution.AllocationSolutionBuilder builder = AllocationSolution.builder()
                .assignment(problem.decode(genes))
                .totalCost(totalCost)
                .coverageScore(coverageScore)
                .timeEfficiency(timeEfficiency);

        for (int z = 0; z < genes.length; z++) {
            int c = genes[z];
            builder.route(new DeliveryRoute(
                    problem.center(c).id(),
                    problem.zone(z).id(),
                    distances.travelCost(c, z),
                    distances.isReachable(c, z)
            ));
        }

        List<Map<String, Integer>> stock = new ArrayList<>(problem.centerCount());
        for (int c = 0; c < problem.centerCount(); c++) {
            Map<String, Integer> working = new HashMap<>();
            for (Resource resource : problem.center(c).getResources().values()) {
                working.put(resource.getId(), resource.getQuantity());
            }
            stock.add(working);
        }

        Map<String, Map<String, Integer>> allocations = new LinkedHashMap<>();
        Map<String, Map<String, Integer>> deliveries = new LinkedHashMap<>();
        for (int z : servingOrder(problem)) {
            int c = genes[z];
            if (!distances.isReachable(c, z)) {
                continue;
            }
            DisasterZone zone = problem.zone(z);
            String centerId = problem.center(c).id();
            Map<String, Integer> centerStock = stock.get(c);
            for (Resource need : zone.getResourcesNeeded()) {
                int available = centerStock.getOrDefault(need.getId(), 0);
                int shipped = Math.min(available, need.getQuantity());
                if (shipped <= 0) {
                    continue;
                }
                centerStock.put(need.getId(), available - shipped);
                allocations.computeIfAbsent(centerId, ignored -> new LinkedHashMap<>()).merge(need.getId(), shipped, Integer::sum);
                deliveries.computeIfAbsent(zone.id(), ignored -> new LinkedHashMap<>()).merge(need.getId(), shipped, Integer::sum);
            }
        }
        allocations.forEach((centerId, shipped) -> builder.allocation(centerId, Map.copyOf(shipped)));
        deliveries.forEach((zoneId, received) -> builder.delivery(zoneId, Map.copyOf(received)));
        return builder.build();
    }

    /**
     * Zone indexes by priority desc, severity desc, then index.
     */
    static List<Integer> servingOrder(AllocationProblem problem) {
        List<Integer> order = new ArrayList<>(problem.zoneCount());
        for (int z = 0; z < problem.zoneCount(); z++) {
            order.add(z);
        }
        order.sort(Comparator
                .comparingInt((Integer z) -> -problem.zone(z).getPriority())
                .thenComparingInt(z -> -problem.zone(z).getSeverity())
                .thenComparingInt(z -> z));
        return order;
    }

    /**
     * {@code 1 / (1 + totalCost / routes)}.
     */
    static double timeEfficiency(double totalCost, int routes) {
        return 1.0d / (1.0d + totalCost / routes);
    }
}
