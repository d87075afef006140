package org.disasterops.routing.search;

import org.disasterops.network.NetworkGraph;

/**
 * Traversal cost of one snapshot edge.
 *
 * <p>Implementations must return finite, non-negative values for every edge of the graph.</p>
 */
@FunctionalInterface
public interface EdgeCostFunction {

    double cost(NetworkGraph graph, int edgeId);
}
