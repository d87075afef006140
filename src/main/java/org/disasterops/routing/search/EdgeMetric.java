package org.disasterops.routing.search;

import org.disasterops.network.NetworkGraph;

/**
 * Built-in edge metrics: effective travel time or base distance.
 */
public enum EdgeMetric implements EdgeCostFunction {
    TIME {
        @Override
        public double cost(NetworkGraph graph, int edgeId) {
            return graph.getEdgeTime(edgeId);
        }
    },
    DISTANCE {
        @Override
        public double cost(NetworkGraph graph, int edgeId) {
            return graph.getEdgeDistance(edgeId);
        }
    }
}
