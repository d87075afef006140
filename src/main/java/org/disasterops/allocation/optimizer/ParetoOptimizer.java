package org.disasterops.allocation.optimizer;

import org.disasterops.allocation.model.AllocationSolution;
import org.disasterops.allocation.model.DisasterZone;
import org.disasterops.allocation.model.ReliefCenter;
import org.disasterops.network.NetworkGraph;

import java.util.List;

/**
 * Multi-objective allocation search returning mutually non-dominated solutions.
 */
public interface ParetoOptimizer {

    List<AllocationSolution> optimizeParetoFront(List<ReliefCenter> centers, List<DisasterZone> zones, NetworkGraph graph);
}
