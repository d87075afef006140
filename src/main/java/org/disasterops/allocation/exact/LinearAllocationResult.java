package org.disasterops.allocation.exact;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of the LP and min-cost flow allocators. Flows are listed only for pairs that carry a
 * positive quantity; the objective is the maximised score or the minimised flow cost.
 */
@Value
@Builder
public class LinearAllocationResult {
    AllocationStatus status;
    @Singular
    List<AllocationFlow> flows;
    double objectiveValue;

    public static LinearAllocationResult infeasible() {
        return LinearAllocationResult.builder()
                .status(AllocationStatus.INFEASIBLE)
                .objectiveValue(Double.NaN)
                .build();
    }

    public boolean isOptimal() {
        return status == AllocationStatus.OPTIMAL;
    }

    /**
     * @return total units delivered to the zone.
     */
    public double deliveredTo(String zoneId) {
        double total = 0.0;
        for (AllocationFlow flow : flows) {
            if (flow.zoneId().equals(zoneId)) {
                total += flow.quantity();
            }
        }
        return total;
    }

    /**
     * @return total units shipped from the center.
     */
    public double shippedFrom(String centerId) {
        double total = 0.0;
        for (AllocationFlow flow : flows) {
            if (flow.centerId().equals(centerId)) {
                total += flow.quantity();
            }
        }
        return total;
    }
}
