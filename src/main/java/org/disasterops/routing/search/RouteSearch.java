package org.disasterops.routing.search;

import org.disasterops.network.NetworkGraph;
import org.disasterops.routing.heuristic.GoalBoundHeuristic;
import org.disasterops.routing.heuristic.HeuristicFactory;
import org.disasterops.routing.heuristic.HeuristicProvider;
import org.disasterops.routing.heuristic.HeuristicType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Query facade over one immutable graph snapshot.
 *
 * <p>Location ids missing from the snapshot (unknown or excluded) resolve to an unreachable
 * result rather than an error. Thread-safe.</p>
 */
public final class RouteSearch {
    private static final NodeRoutePlanner DIJKSTRA_PLANNER = new NodeRoutePlanner(false);
    private static final NodeRoutePlanner A_STAR_PLANNER = new NodeRoutePlanner(true);

    private final NetworkGraph graph;

    public RouteSearch(NetworkGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public NetworkGraph graph() {
        return graph;
    }

    /**
     * Dijkstra on effective travel time.
     */
    public PathResult fastestPath(String origin, String destination) {
        return route(origin, destination, RoutingAlgorithm.DIJKSTRA, EdgeMetric.TIME);
    }

    /**
     * Computes one shortest path.
     *
     * @param origin origin location id.
     * @param destination destination location id.
     * @param algorithm Dijkstra or A* with the geographic heuristic.
     * @param costFunction edge cost to minimise.
     * @return path result; unreachable when either endpoint is absent from the snapshot.
     */
    public PathResult route(String origin, String destination, RoutingAlgorithm algorithm, EdgeCostFunction costFunction) {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(costFunction, "costFunction");
        int source = graph.nodeIndex(origin);
        int target = graph.nodeIndex(destination);
        if (source < 0 || target < 0) {
            return PathResult.unreachable(0);
        }
        if (algorithm == RoutingAlgorithm.DIJKSTRA) {
            return DIJKSTRA_PLANNER.compute(graph, source, target, costFunction, GoalBoundHeuristic.ZERO);
        }
        HeuristicProvider provider = HeuristicFactory.createOrFallback(
                HeuristicType.GEOGRAPHIC,
                graph,
                edgeId -> costFunction.cost(graph, edgeId)
        );
        return A_STAR_PLANNER.compute(graph, source, target, costFunction, provider.bindGoal(target));
    }

    /**
     * Costs from one origin to every node of the snapshot, indexed by internal node index.
     * All {@code +INF} when the origin is absent.
     */
    public double[] costsFrom(String origin, EdgeCostFunction costFunction) {
        Objects.requireNonNull(costFunction, "costFunction");
        int source = graph.nodeIndex(origin);
        if (source < 0) {
            double[] unreachable = new double[graph.nodeCount()];
            Arrays.fill(unreachable, Double.POSITIVE_INFINITY);
            return unreachable;
        }
        return OneToManyDijkstra.costsFrom(graph, source, costFunction);
    }
}
