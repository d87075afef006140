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
 * Minimum-cost flow allocation on ojAlgo.
 *
 * <p>The flow network is source, then centers, then zones. The source-to-center arc carries
 * at most the center's total stock. Each reachable center-to-zone arc carries at most
 * {@code min(stock, demand)} at unit cost {@code travelCost * priority}. Every zone must
 * receive exactly its total demand; stock a center does not ship stays where it is. Resource
 * types are not distinguished.</p>
 *
 * <p>The result's objective value is the total flow cost. When demand cannot be met the
 * status is INFEASIBLE.</p>
 */
@Slf4j
public final class MinCostFlowAllocator {
    private static final double FLOW_EPSILON = 1e-9;

    public LinearAllocationResult allocate(List<ReliefCenter> centers, List<DisasterZone> zones, NetworkGraph graph) {
        return allocate(AllocationProblem.of(centers, zones, graph));
    }

    public LinearAllocationResult allocate(AllocationProblem problem) {
        DistanceTable distances = problem.distances();
        ExpressionsBasedModel model = new ExpressionsBasedModel();

        List<int[]> arcs = new ArrayList<>();
        List<Variable> variables = new ArrayList<>();
        for (int z = 0; z < problem.zoneCount(); z++) {
            DisasterZone zone = problem.zone(z);
            int demand = zone.totalDemand();
            boolean served = false;
            for (int c = 0; c < problem.centerCount(); c++) {
                if (!distances.isReachable(c, z)) {
                    continue;
                }
                int capacity = Math.min(problem.center(c).totalSupply(), demand);
                double unitCost = distances.travelCost(c, z) * zone.getPriority();
                Variable x = model.addVariable("f_" + c + "_" + z).lower(0).upper(capacity).weight(unitCost);
                arcs.add(new int[]{c, z});
                variables.add(x);
                served = true;
            }
            if (demand > 0 && !served) {
                log.warn("Zone {} needs {} units but no center reaches it; min-cost flow is infeasible", zone.id(), demand);
                return LinearAllocationResult.infeasible();
            }
        }
        if (variables.isEmpty()) {
            return LinearAllocationResult.builder()
                    .status(AllocationStatus.OPTIMAL)
                    .objectiveValue(0.0)
                    .build();
        }

        for (int c = 0; c < problem.centerCount(); c++) {
            Expression stock = model.addExpression("stock_" + c).upper(problem.center(c).totalSupply());
            for (int i = 0; i < arcs.size(); i++) {
                if (arcs.get(i)[0] == c) {
                    stock.set(variables.get(i), 1);
                }
            }
        }
        for (int z = 0; z < problem.zoneCount(); z++) {
            Expression demand = model.addExpression("demand_" + z).level(problem.zone(z).totalDemand());
            for (int i = 0; i < arcs.size(); i++) {
                if (arcs.get(i)[1] == z) {
                    demand.set(variables.get(i), 1);
                }
            }
        }

        Optimisation.Result result = model.minimise();
        if (!result.getState().isOptimal()) {
            log.warn("Min-cost flow ended in state {}", result.getState());
            return LinearAllocationResult.infeasible();
        }

        LinearAllocationResult.LinearAllocationResultBuilder builder = LinearAllocationResult.builder()
                .status(AllocationStatus.OPTIMAL)
                .objectiveValue(result.getValue());
        for (int i = 0; i < arcs.size(); i++) {
            double quantity = result.get(i).doubleValue();
            if (quantity > FLOW_EPSILON) {
                int[] arc = arcs.get(i);
                builder.flow(new AllocationFlow(problem.center(arc[0]).id(), problem.zone(arc[1]).id(), quantity));
            }
        }
        LinearAllocationResult allocation = builder.build();
        log.info("Min-cost flow cost {} over {} arcs", allocation.getObjectiveValue(), allocation.getFlows().size());
        return allocation;
    }
}
