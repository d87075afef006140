package org.disasterops.routing.heuristic;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.disasterops.network.NetworkGraph;

import java.util.function.IntToDoubleFunction;

/**
 * Creates heuristic providers for graph snapshots.
 */
@Slf4j
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "HEUR_TYPE_REQUIRED";
    public static final String REASON_GRAPH_REQUIRED = "HEUR_GRAPH_REQUIRED";

    /**
     * Creates a provider, failing when the requested type cannot be calibrated.
     *
     * @param type requested heuristic type.
     * @param graph snapshot to route on.
     * @param edgeCost edge cost used by the planner that will consume the heuristic.
     * @return initialized provider.
     */
    public static HeuristicProvider create(HeuristicType type, NetworkGraph graph, IntToDoubleFunction edgeCost) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, GEOGRAPHIC)"
            );
        }
        if (graph == null) {
            throw new HeuristicConfigurationException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        return switch (type) {
            case NONE -> new NullHeuristicProvider(graph);
            case GEOGRAPHIC -> new GeographicHeuristicProvider(graph, GeometryLowerBoundModel.calibrate(graph, edgeCost));
        };
    }

    /**
     * Like {@link #create} but degrades to {@link HeuristicType#NONE} when the graph
     * cannot be calibrated (no edges, or all edges of zero length).
     */
    public static HeuristicProvider createOrFallback(HeuristicType type, NetworkGraph graph, IntToDoubleFunction edgeCost) {
        try {
            return create(type, graph, edgeCost);
        } catch (HeuristicConfigurationException ex) {
            if (!ex.reasonCode().startsWith("HEUR_LB_")) {
                throw ex;
            }
            log.warn("Falling back to zero heuristic on {}: {}", graph, ex.getMessage());
            return new NullHeuristicProvider(graph);
        }
    }
}
