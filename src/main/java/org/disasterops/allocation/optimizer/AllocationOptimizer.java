package org.disasterops.allocation.optimizer;

import org.disasterops.allocation.model.AllocationSolution;
import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.network.NetworkGraph;

import java.util.List;

/**
 * Single-solution allocation search.
 *
 * <p>Implementations are pure over their inputs; the graph is an immutable snapshot.</p>
 */
public interface AllocationOptimizer {

    /**
     * @return best assignment found, with resolved allocations and scores.
     * @throws org.disasterops.allocation.fitness.AllocationException when centers or zones are
     * empty or ids repeat.
     */
    AllocationSolution optimizeAllocation(List<ReliefCenter> centers, List<DisasterZone> zones, NetworkGraph graph);
}
