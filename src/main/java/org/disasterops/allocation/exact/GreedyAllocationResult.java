package org.disasterops.allocation.exact;

import lombok.Value;
import org.disasterops.allocation.model.ReliefCenter;

import java.util.List;
import java.util.Optional;

/**
 * Greedy allocation outcome: dispatches in serving order, stock left at each center,
 * and zones no single center could fully supply.
 */
@Value
public class GreedyAllocationResult {
    List<ZoneDispatch> dispatches;
    List<ReliefCenter> remainingCenters;
    List<String> unservedZoneIds;

    public GreedyAllocationResult(
            List<ZoneDispatch> dispatches,
            List<ReliefCenter> remainingCenters,
            List<String> unservedZoneIds
    ) {
        this.dispatches = List.copyOf(dispatches);
        this.remainingCenters = List.copyOf(remainingCenters);
        this.unservedZoneIds = List.copyOf(unservedZoneIds);
    }

    public Optional<ZoneDispatch> dispatchFor(String zoneId) {
        return dispatches.stream().filter(d -> d.zoneId().equals(zoneId)).findFirst();
    }

    public Optional<ReliefCenter> remainingCenter(String centerId) {
        return remainingCenters.stream().filter(c -> c.id().equals(centerId)).findFirst();
    }

    public double totalDeliveryTime() {
        double total = 0.0;
        for (ZoneDispatch dispatch : dispatches) {
            total += dispatch.deliveryTime();
        }
        return total;
    }
}
