package org.disasterops.routing.search;

import org.disasterops.network.NetworkGraph;

import java.util.Arrays;
import java.util.PriorityQueue;

/**
 * Single-source Dijkstra that settles the whole reachable graph.
 *
 * <p>Used to fill travel-cost tables: one search per source instead of one per pair.</p>
 */
final class OneToManyDijkstra {

    private OneToManyDijkstra() {
    }

    /**
     * @return cost to every node, {@code +INF} for unreachable nodes.
     */
    static double[] costsFrom(NetworkGraph graph, int sourceNodeId, EdgeCostFunction costFunction) {
        double[] cost = new double[graph.nodeCount()];
        Arrays.fill(cost, Double.POSITIVE_INFINITY);
        cost[sourceNodeId] = 0.0d;

        PriorityQueue<Label> frontier = new PriorityQueue<>();
        frontier.add(new Label(sourceNodeId, 0.0d));
        NetworkGraph.EdgeIterator iterator = graph.iterator();
        while (!frontier.isEmpty()) {
            Label label = frontier.poll();
            if (label.cost() > cost[label.nodeId()]) {
                continue;
            }
            iterator.resetForNode(label.nodeId());
            while (iterator.hasNext()) {
                int edgeId = iterator.next();
                double edgeCost = costFunction.cost(graph, edgeId);
                if (!Double.isFinite(edgeCost)) {
                    continue;
                }
                double next = label.cost() + edgeCost;
                int target = graph.getEdgeDestination(edgeId);
                if (next < cost[target]) {
                    cost[target] = next;
                    frontier.add(new Label(target, next));
                }
            }
        }
        return cost;
    }

    private record Label(int nodeId, double cost) implements Comparable<Label> {
        @Override
        public int compareTo(Label other) {
            int byCost = Double.compare(this.cost, other.cost);
            return byCost != 0 ? byCost : Integer.compare(this.nodeId, other.nodeId);
        }
    }
}
