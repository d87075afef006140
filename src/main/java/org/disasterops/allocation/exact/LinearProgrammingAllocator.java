package org.disasterops.allocation.exact;

import lombok.extern.slf4j.Slf4j;
import org.disasterops.allocation.fitness.AllocationProblem;
import org.disasterops.allocation.fitness.DistanceTable;
import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.network.NetworkGraph;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate-quantity LP allocation on ojAlgo.
 *
 * <p>One continuous variable {@code x[c][z] >= 0} per reachable center/zone pair, weighted by
 * {@code priority / (1 + travelCost)}. Each center ships at most its total stock and each zone
 * receives at most its total demand. Resource types are not distinguished.</p>
 */
@Slf4j
public final class LinearProgrammingAllocator {
    private static final double FLOW_EPSILON = 1e-9;

    public LinearAllocationResult allocate(List<ReliefCenter> centers, List<DisasterZone> zones, NetworkGraph graph) {
        return allocate(AllocationProblem.of(centers, zones, graph));
    }

    public LinearAllocationResult allocate(AllocationProblem problem) {
        DistanceTable distances = problem.distances();
        ExpressionsBasedModel model = new ExpressionsBasedModel();

        List<int[]> pairs = new ArrayList<>();
        List<Variable> variables = new ArrayList<>();
        for (int c = 0; c < problem.centerCount(); c++) {
            for (int z = 0; z < problem.zoneCount(); z++) {
                if (!distances.isReachable(c, z)) {
                    continue;
                }
                double weight = problem.zone(z).getPriority() / (1.0 + distances.travelCost(c, z));
                Variable x = model.addVariable("x_" + c + "_" + z).lower(0).weight(weight);
                pairs.add(new int[]{c, z});
                variables.add(x);
            }
        }
        if (variables.isEmpty()) {
            log.warn("No reachable center/zone pair; LP allocation is empty");
            return LinearAllocationResult.builder()
                    .status(AllocationStatus.OPTIMAL)
                    .objectiveValue(0.0)
                    .build();
        }

        for (int c = 0; c < problem.centerCount(); c++) {
            Expression supply = model.addExpression("supply_" + c).upper(problem.center(c).totalSupply());
            for (int i = 0; i < pairs.size(); i++) {
                if (pairs.get(i)[0] == c) {
                    supply.set(variables.get(i), 1);
                }
            }
        }
        for (int z = 0; z < problem.zoneCount(); z++) {
            Expression demand = model.addExpression("demand_" + z).upper(problem.zone(z).totalDemand());
            for (int i = 0; i < pairs.size(); i++) {
                if (pairs.get(i)[1] == z) {
                    demand.set(variables.get(i), 1);
                }
            }
        }

        Optimisation.Result result = model.maximise();
        if (!result.getState().isOptimal()) {
            log.warn("LP allocation ended in state {}", result.getState());
            return LinearAllocationResult.infeasible();
        }

        LinearAllocationResult.LinearAllocationResultBuilder builder = LinearAllocationResult.builder()
                .status(AllocationStatus.OPTIMAL)
                .objectiveValue(result.getValue());
        for (int i = 0; i < pairs.size(); i++) {
            double quantity = result.get(i).doubleValue();
            if (quantity > FLOW_EPSILON) {
                int[] pair = pairs.get(i);
                builder.flow(new AllocationFlow(
                        problem.center(pair[0]).id(), problem.zone(pair[1]).id(), quantity));
            }
        }
        LinearAllocationResult allocation = builder.build();
        log.debug("LP allocation objective {} over {} flows", allocation.getObjectiveValue(), allocation.getFlows().size());
        return allocation;
    }
}
